package app.fsidrill.srs.review.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CardState {
    NEW(0), LEARNING(1), REVIEW(2), RELEARNING(3);

    private final int code;
    CardState(int code) { this.code = code; }

    @JsonValue
    public int code() { return code; }

    public boolean isStepped() {
        return this != REVIEW;
    }

    @JsonCreator
    public static CardState fromCode(int code) {
        for (CardState s : values()) {
            if (s.code == code) return s;
        }
        throw new IllegalArgumentException("Unknown card state: " + code);
    }
}
