package com.quick.guessing.game;

import java.util.Objects;

/**
 * Why a bonus was awarded. Only the three kinds below exist; {@code playerName} is set
 * for {@link Kind#OTHER_MATCH} and nothing else.
 */
public record BonusReason(Kind kind, String playerName) {

    private static final BonusReason EXACT = new BonusReason(Kind.EXACT_MATCH, null);
    private static final BonusReason REVERSE = new BonusReason(Kind.REVERSE_MATCH, null);

    public enum Kind {
        EXACT_MATCH,
        REVERSE_MATCH,
        OTHER_MATCH
    }

    public BonusReason {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.OTHER_MATCH && (playerName == null || playerName.isBlank())) {
            throw new IllegalArgumentException("other-match bonus needs the matched player's name");
        }
        if (kind != Kind.OTHER_MATCH && playerName != null) {
            throw new IllegalArgumentException(kind + " bonus does not name a player");
        }
    }

    public static BonusReason exactMatch() {
        return EXACT;
    }

    public static BonusReason reverseMatch() {
        return REVERSE;
    }

    public static BonusReason otherMatch(String playerName) {
        return new BonusReason(Kind.OTHER_MATCH, playerName);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case EXACT_MATCH -> "exact-match";
            case REVERSE_MATCH -> "reverse-match";
            case OTHER_MATCH -> "other-match(" + playerName + ")";
        };
    }
}
