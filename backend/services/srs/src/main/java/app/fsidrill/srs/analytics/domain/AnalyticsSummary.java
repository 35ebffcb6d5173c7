package app.fsidrill.srs.analytics.domain;

import java.util.List;
import java.util.Map;

public record AnalyticsSummary(
        int totalResponses,
        int correctCount,
        int incorrectCount,
        double accuracy,
        long avgCorrectTimeMs,
        long avgIncorrectTimeMs,
        Map<String, Integer> errorTypes,
        Map<Integer, Integer> errorsByUnit,
        List<CardMistakes> topMistakes
) {
    public record CardMistakes(
            String cardId,
            int count,
            List<ResponseError> errors,
            String lastAnswer
    ) {
    }
}
