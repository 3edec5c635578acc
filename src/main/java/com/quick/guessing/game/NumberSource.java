package com.quick.guessing.game;

/**
 * Supplies the secret numbers assigned to players at the start of each round.
 */
public interface NumberSource {

    /**
     * @return a number in {@code [1, maxGuess]}
     */
    int draw(int maxGuess);
}
