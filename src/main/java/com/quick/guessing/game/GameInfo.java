package com.quick.guessing.game;

import java.util.List;

public record GameInfo(
        GameState state,
        String host,
        String name,
        List<String> players,
        int round,
        int turn,
        Configuration config
) {

    public GameInfo {
        players = List.copyOf(players);
    }
}
