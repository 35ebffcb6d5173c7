package app.fsidrill.srs.analytics.controller;

import app.fsidrill.srs.analytics.controller.dto.UserIdRequest;
import app.fsidrill.srs.analytics.domain.AnalyticsExport;
import app.fsidrill.srs.analytics.domain.AnalyticsSummary;
import app.fsidrill.srs.analytics.domain.ResponseEntry;
import app.fsidrill.srs.analytics.domain.ResponseInput;
import app.fsidrill.srs.analytics.service.ResponseLogService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/analytics")
public class AnalyticsController {

    private final ResponseLogService responseLogService;

    public AnalyticsController(ResponseLogService responseLogService) {
        this.responseLogService = responseLogService;
    }

    @PostMapping("/prompt-timer")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void startPromptTimer() {
        responseLogService.startPromptTimer();
    }

    @PostMapping("/responses")
    @ResponseStatus(HttpStatus.CREATED)
    public ResponseEntry logResponse(@RequestBody ResponseInput input) {
        return responseLogService.logResponse(input);
    }

    @DeleteMapping("/responses")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void clear() {
        responseLogService.clearAnalytics();
    }

    @PutMapping("/user")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void setUser(@RequestBody UserIdRequest req) {
        responseLogService.setUserId(req.userId());
    }

    @GetMapping("/summary")
    public ResponseEntity<AnalyticsSummary> summary() {
        return responseLogService.getAnalyticsSummary()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/export")
    public AnalyticsExport export() {
        return responseLogService.exportAnalytics();
    }
}
