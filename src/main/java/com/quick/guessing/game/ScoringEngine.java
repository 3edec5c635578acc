package com.quick.guessing.game;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Scoring rules. Stateless; every method is a pure function of its arguments.
 */
public final class ScoringEngine {

    public static final int BASE_POINTS = 100;
    public static final int EXACT_MATCH_BONUS = 50;
    public static final int REVERSE_MATCH_BONUS = 25;
    public static final int OTHER_MATCH_BONUS = 25;

    private ScoringEngine() {
    }

    /**
     * Closeness score, {@code 100 - |guess - assigned|}. Not clamped, so it goes negative
     * once the distance exceeds 100.
     */
    public static int roundPoints(int assigned, int guess) {
        return BASE_POINTS - Math.abs(guess - assigned);
    }

    /**
     * Reverses the decimal digits of a positive number. Leading zeros of the result are
     * dropped: 40 becomes 4, 10 becomes 1.
     */
    public static long reverseDigits(int number) {
        if (number < 0) {
            throw new IllegalArgumentException("Cannot reverse a negative number: " + number);
        }
        return Long.parseLong(new StringBuilder(Integer.toString(number)).reverse().toString());
    }

    /**
     * Bonuses earned by a guess.
     *
     * @param assigned       the guessing player's own assigned number
     * @param guess          the guess
     * @param othersAssigned current assigned number of every other player, by name, in turn order
     * @return exact-match or reverse-match (never both) first, then one other-match per matching player
     */
    public static List<Bonus> bonuses(int assigned, int guess, Map<String, Integer> othersAssigned) {
        List<Bonus> bonuses = new ArrayList<>();
        if (guess == assigned) {
            bonuses.add(new Bonus(EXACT_MATCH_BONUS, BonusReason.exactMatch()));
        } else if (guess == reverseDigits(assigned)) {
            bonuses.add(new Bonus(REVERSE_MATCH_BONUS, BonusReason.reverseMatch()));
        }
        othersAssigned.forEach((name, otherAssigned) -> {
            if (otherAssigned != null && otherAssigned == guess) {
                bonuses.add(new Bonus(OTHER_MATCH_BONUS, BonusReason.otherMatch(name)));
            }
        });
        return bonuses;
    }

    public static int totalPoints(int assigned, int guess, List<Bonus> bonuses) {
        int bonusPoints = bonuses.stream().mapToInt(Bonus::value).sum();
        return roundPoints(assigned, guess) + bonusPoints;
    }
}
