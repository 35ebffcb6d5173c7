package app.fsidrill.srs.review.controller.dto;

import app.fsidrill.srs.review.domain.DrillDefinition;

import java.util.List;

public record DrillMetaRequest(
        List<DrillDefinition> drills
) {
}
