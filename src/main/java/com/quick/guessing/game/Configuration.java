package com.quick.guessing.game;

/**
 * Game settings.
 *
 * @param maxPoints the game ends after a round in which any player's total reaches this value
 * @param maxGuess  upper bound of the guess range; the range is {@code [1, maxGuess]}
 */
public record Configuration(int maxPoints, int maxGuess) {

    public Configuration {
        if (maxPoints <= 0) {
            throw new IllegalArgumentException("maxPoints must be positive: " + maxPoints);
        }
        if (maxGuess <= 0) {
            throw new IllegalArgumentException("maxGuess must be positive: " + maxGuess);
        }
    }

    public boolean inRange(int guess) {
        return guess >= 1 && guess <= maxGuess;
    }
}
