package com.quick.guessing.game;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A connected player and their round ledger.
 *
 * <p>The ledger is only written by the game the player occupies. Ledger misuse, such as a
 * bonus before a guess, is a bug in the caller and raises {@link IllegalStateException}.
 */
public class PlayerEntity extends Entity {

    private final String name;
    // newest first
    private final List<Round> rounds = new ArrayList<>();

    public PlayerEntity(String name, Duration callTimeout) {
        super(callTimeout);
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Player name is required");
        }
        this.name = name;
    }

    @Override
    public String id() {
        return name;
    }

    public String name() {
        return name;
    }

    public PlayerInfo info() {
        return call(() -> new PlayerInfo(name, sumClosedRounds(), rounds));
    }

    public Optional<Round> currentRound() {
        return call(() -> rounds.isEmpty() ? Optional.empty() : Optional.of(rounds.get(0)));
    }

    public void startRound(int round, int assigned) {
        run(() -> rounds.add(0, Round.start(round, assigned)));
    }

    public Round recordGuess(int guess) {
        return call(() -> replaceCurrent(current().withGuess(guess)));
    }

    public Round addBonus(Bonus bonus) {
        return call(() -> replaceCurrent(current().withBonus(bonus)));
    }

    /**
     * Closes the current round and returns its points.
     */
    public int closeRound() {
        return call(() -> replaceCurrent(current().close()).points());
    }

    public int totalPoints() {
        return call(this::sumClosedRounds);
    }

    public void reset() {
        run(rounds::clear);
    }

    private Round current() {
        if (rounds.isEmpty()) {
            throw new IllegalStateException("Player " + name + " has no round in progress");
        }
        return rounds.get(0);
    }

    private Round replaceCurrent(Round round) {
        rounds.set(0, round);
        return round;
    }

    private int sumClosedRounds() {
        return rounds.stream()
                .filter(Round::isClosed)
                .mapToInt(Round::points)
                .sum();
    }
}
