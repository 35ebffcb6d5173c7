package app.fsidrill.srs.review.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DrillItem(
        String id,
        String posPattern,
        Double commonality,
        Integer unit
) {
}
