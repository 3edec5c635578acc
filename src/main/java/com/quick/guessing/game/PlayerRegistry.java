package com.quick.guessing.game;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connected players keyed by name, plus the game each of them currently occupies.
 *
 * <p>A player occupies at most one game. Occupancy is taken with {@link #claimGame}, a single
 * compare-and-insert, before the player is put on a roster; a claim on a closed game counts
 * as free.
 */
public class PlayerRegistry extends EntityRegistry<PlayerEntity> {

    private final Map<String, GameEntity> occupancy = new ConcurrentHashMap<>();

    public PlayerRegistry() {
        super("player");
    }

    /**
     * @return {@code false} if the player already occupies a live game
     */
    public boolean claimGame(String playerName, GameEntity game) {
        GameEntity existing = occupancy.putIfAbsent(playerName, game);
        while (existing != null) {
            if (existing.isAlive()) {
                return false;
            }
            if (occupancy.replace(playerName, existing, game)) {
                return true;
            }
            existing = occupancy.putIfAbsent(playerName, game);
        }
        return true;
    }

    public Optional<GameEntity> gameOf(String playerName) {
        GameEntity game = occupancy.get(playerName);
        if (game == null || !game.isAlive()) {
            return Optional.empty();
        }
        return Optional.of(game);
    }

    /**
     * Clears the player's game only if it is still the given one.
     */
    public void releaseGame(String playerName, GameEntity game) {
        occupancy.remove(playerName, game);
    }

    @Override
    public void unregister(String name) {
        super.unregister(name);
        occupancy.remove(name);
    }

    @Override
    public void clear() {
        super.clear();
        occupancy.clear();
    }
}
