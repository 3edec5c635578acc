package com.quick.guessing.game;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * The shared state of one server: both registries and the settings new entities are built with.
 */
@Getter
@Component
public class ServerContext {

    private final PlayerRegistry players = new PlayerRegistry();
    private final GameRegistry games = new GameRegistry();
    private final NumberSource numbers;
    private final Configuration defaults;
    private final Duration callTimeout;

    public ServerContext(NumberSource numbers,
                         @Value("${guess.defaults.max-points:300}") int defaultMaxPoints,
                         @Value("${guess.defaults.max-guess:100}") int defaultMaxGuess,
                         @Value("${guess.entity.call-timeout-ms:5000}") long callTimeoutMs) {
        this.numbers = numbers;
        this.defaults = new Configuration(defaultMaxPoints, defaultMaxGuess);
        this.callTimeout = Duration.ofMillis(callTimeoutMs);
    }

    public PlayerEntity newPlayer(String name) {
        return new PlayerEntity(name, callTimeout);
    }

    public GameEntity newGame(String host, String name) {
        return new GameEntity(host, name, this);
    }

    /**
     * Closes and forgets every player and game.
     */
    public void clear() {
        games.clear();
        players.clear();
    }
}
