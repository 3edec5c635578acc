package com.quick.guessing.game;

import java.util.ArrayList;
import java.util.List;

/**
 * One player's ledger entry for one game round.
 *
 * <p>A round moves strictly forward: created with an assigned number, then given a guess,
 * then zero or more bonuses, then closed with its points. Each step returns a new value;
 * a closed round rejects every further change.
 *
 * @param round    round number in the game, starting at 0
 * @param assigned the number the player should guess
 * @param guess    the player's guess, {@code null} until played
 * @param points   round score, {@code null} until closed
 * @param bonuses  bonuses in award order
 */
public record Round(int round, int assigned, Integer guess, Integer points, List<Bonus> bonuses) {

    public Round {
        bonuses = List.copyOf(bonuses);
    }

    public static Round start(int round, int assigned) {
        return new Round(round, assigned, null, null, List.of());
    }

    public boolean isGuessed() {
        return guess != null;
    }

    public boolean isClosed() {
        return points != null;
    }

    public Round withGuess(int value) {
        if (isGuessed()) {
            throw new IllegalStateException("Round " + round + " already has a guess");
        }
        return new Round(round, assigned, value, null, bonuses);
    }

    public Round withBonus(Bonus bonus) {
        if (!isGuessed()) {
            throw new IllegalStateException("Bonus added before a guess in round " + round);
        }
        if (isClosed()) {
            throw new IllegalStateException("Round " + round + " is already closed");
        }
        List<Bonus> next = new ArrayList<>(bonuses);
        next.add(bonus);
        return new Round(round, assigned, guess, null, next);
    }

    public Round close() {
        if (!isGuessed()) {
            throw new IllegalStateException("Round " + round + " cannot close without a guess");
        }
        if (isClosed()) {
            throw new IllegalStateException("Round " + round + " is already closed");
        }
        return new Round(round, assigned, guess, ScoringEngine.totalPoints(assigned, guess, bonuses), bonuses);
    }
}
