package app.fsidrill.srs.review.controller;

import app.fsidrill.srs.review.controller.dto.AnswerCardRequest;
import app.fsidrill.srs.review.controller.dto.CountResponse;
import app.fsidrill.srs.review.controller.dto.DrillMetaRequest;
import app.fsidrill.srs.review.controller.dto.ReviewAnswerResponse;
import app.fsidrill.srs.review.domain.Card;
import app.fsidrill.srs.review.domain.DrillItem;
import app.fsidrill.srs.review.domain.Rating;
import app.fsidrill.srs.review.service.GraduationStats;
import app.fsidrill.srs.review.service.ReviewResult;
import app.fsidrill.srs.review.service.SchedulerStats;
import app.fsidrill.srs.review.service.SrsScheduler;
import app.fsidrill.srs.review.store.SaveStatus;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/srs")
public class ReviewController {

    private final SrsScheduler scheduler;

    public ReviewController(SrsScheduler scheduler) {
        this.scheduler = scheduler;
    }

    // POST /srs/cards  [{id, pos_pattern, commonality, unit}]
    @PostMapping("/cards")
    @ResponseStatus(HttpStatus.CREATED)
    public CountResponse initializeCards(@RequestBody List<DrillItem> items) {
        return new CountResponse(scheduler.initializeCards(items));
    }

    // POST /srs/drills/meta  {drills: [{id, pattern_group, is_canonical}]}
    @PostMapping("/drills/meta")
    public CountResponse loadDrillMeta(@RequestBody DrillMetaRequest req) {
        return new CountResponse(scheduler.loadDrillMeta(req == null ? null : req.drills()));
    }

    @GetMapping("/cards/{cardId}")
    public Card getCard(@PathVariable String cardId) {
        return scheduler.getCard(cardId).orElseThrow(() -> notFound(cardId));
    }

    @GetMapping("/next")
    public ResponseEntity<Card> next() {
        return scheduler.getNextCard()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    // POST /srs/cards/{cardId}/answer  {rating: "good", error: {type}}
    @PostMapping("/cards/{cardId}/answer")
    public ReviewAnswerResponse answer(@PathVariable String cardId,
                                       @RequestBody AnswerCardRequest req) {
        Rating rating = Rating.fromString(req.rating());
        ReviewResult result = scheduler.processReview(cardId, rating, req.error())
                .orElseThrow(() -> notFound(cardId));
        return new ReviewAnswerResponse(
                cardId,
                rating,
                result.card(),
                result.interval(),
                result.intervalDisplay(),
                result.nextDue(),
                scheduler.saveStatus()
        );
    }

    @PostMapping("/queue")
    public List<Card> buildQueue(@RequestParam(required = false) Integer max) {
        return max == null ? scheduler.buildSessionQueue() : scheduler.buildSessionQueue(max);
    }

    @GetMapping("/due")
    public List<Card> due() {
        return scheduler.getDueCards();
    }

    @GetMapping("/stats")
    public SchedulerStats stats() {
        return scheduler.getStats();
    }

    @GetMapping("/stats/graduation")
    public GraduationStats graduationStats() {
        return scheduler.getGraduationStats();
    }

    @GetMapping("/stats/patterns")
    public Map<String, List<Card>> patternGroups() {
        return scheduler.getPatternGroups();
    }

    @GetMapping("/stats/problematic")
    public List<Card> problematic(@RequestParam(defaultValue = "10") int limit) {
        return scheduler.getProblematicCards(limit);
    }

    @GetMapping("/stats/errors")
    public Map<String, Integer> errorDistribution() {
        return scheduler.getErrorDistribution();
    }

    @GetMapping("/save-status")
    public SaveStatus saveStatus() {
        return scheduler.saveStatus();
    }

    @PostMapping("/cards/{cardId}/reset")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void resetCard(@PathVariable String cardId) {
        if (!scheduler.resetCard(cardId)) {
            throw notFound(cardId);
        }
    }

    @PostMapping("/cards/reset")
    public CountResponse resetAll() {
        return new CountResponse(scheduler.resetAllCards());
    }

    @PostMapping("/session/reset")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void resetSession() {
        scheduler.resetSessionStats();
    }

    private static ResponseStatusException notFound(String cardId) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Card not found: " + cardId);
    }
}
