package com.quick.guessing.game;

/**
 * Settings supplied by a host. A {@code null} field falls back to the server default, so
 * configuring replaces the whole configuration rather than patching it.
 */
public record GameOptions(Integer maxPoints, Integer maxGuess) {

    public static GameOptions maxPoints(int maxPoints) {
        return new GameOptions(maxPoints, null);
    }

    public static GameOptions maxGuess(int maxGuess) {
        return new GameOptions(null, maxGuess);
    }

    public boolean isValid() {
        return (maxPoints == null || maxPoints > 0) && (maxGuess == null || maxGuess > 0);
    }

    public Configuration resolve(Configuration defaults) {
        return new Configuration(
                maxPoints != null ? maxPoints : defaults.maxPoints(),
                maxGuess != null ? maxGuess : defaults.maxGuess()
        );
    }
}
