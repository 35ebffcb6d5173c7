package app.fsidrill.srs.review.domain;

public record DrillMeta(
        String patternGroup,
        boolean canonical
) {
    public DrillMeta {
        if (patternGroup != null && patternGroup.isBlank()) {
            patternGroup = null;
        }
    }

    public static DrillMeta from(DrillDefinition definition) {
        return new DrillMeta(definition.patternGroup(), !Boolean.FALSE.equals(definition.isCanonical()));
    }

    public DrillMeta withCanonical(boolean value) {
        return new DrillMeta(patternGroup, value);
    }

    public boolean grouped() {
        return patternGroup != null;
    }
}
