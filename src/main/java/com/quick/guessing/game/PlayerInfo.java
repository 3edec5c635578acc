package com.quick.guessing.game;

import java.util.List;

/**
 * Snapshot of a player's ledger.
 *
 * @param rounds newest first
 */
public record PlayerInfo(String name, int points, List<Round> rounds) {

    public PlayerInfo {
        rounds = List.copyOf(rounds);
    }
}
