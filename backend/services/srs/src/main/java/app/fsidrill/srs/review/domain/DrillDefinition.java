package app.fsidrill.srs.review.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * One record of the drill metadata file. {@code isCanonical} defaults to true when absent.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DrillDefinition(
        String id,
        String patternGroup,
        Boolean isCanonical
) {
}
