package com.quick.guessing.game;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What happens after a start, restart or play.
 *
 * <ul>
 *   <li>{@link Kind#NEXT_TURN}: {@code round}, {@code turn} and {@code player} name the next actor.</li>
 *   <li>{@link Kind#NEXT_ROUND}: as above for the new round; {@code totals} are the running totals
 *       at the end of the previous round.</li>
 *   <li>{@link Kind#ENDED}: {@code totals} are the final totals; no next actor.</li>
 * </ul>
 *
 * @param totals player name to running total, in turn order
 */
public record TurnOutcome(Kind kind, int round, int turn, String player, Map<String, Integer> totals) {

    public enum Kind {
        NEXT_TURN,
        NEXT_ROUND,
        ENDED
    }

    public TurnOutcome {
        totals = Collections.unmodifiableMap(new LinkedHashMap<>(totals));
    }

    public static TurnOutcome nextTurn(int round, int turn, String player) {
        return new TurnOutcome(Kind.NEXT_TURN, round, turn, player, Map.of());
    }

    public static TurnOutcome nextRound(int round, String player, Map<String, Integer> previousTotals) {
        return new TurnOutcome(Kind.NEXT_ROUND, round, 0, player, previousTotals);
    }

    public static TurnOutcome ended(int round, Map<String, Integer> finalTotals) {
        return new TurnOutcome(Kind.ENDED, round, -1, null, finalTotals);
    }
}
