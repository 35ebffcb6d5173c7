package app.fsidrill.srs.review.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Rating {
    AGAIN(1), HARD(2), GOOD(3), EASY(4);

    private final int code;
    Rating(int code) { this.code = code; }

    @JsonValue
    public int code() { return code; }

    public boolean isCorrect() {
        return code >= GOOD.code;
    }

    public static Rating fromCode(int code) {
        for (Rating r : values()) {
            if (r.code == code) return r;
        }
        throw new IllegalArgumentException("Unknown rating code: " + code);
    }

    @JsonCreator
    public static Rating fromString(String v) {
        if (v == null || v.isBlank()) {
            throw new IllegalArgumentException("Rating is required");
        }
        String trimmed = v.trim();
        if (trimmed.chars().allMatch(Character::isDigit)) {
            return fromCode(Integer.parseInt(trimmed));
        }
        try {
            return Rating.valueOf(trimmed.toUpperCase());
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown rating: " + v);
        }
    }
}
