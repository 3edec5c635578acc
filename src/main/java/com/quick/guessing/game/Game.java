package com.quick.guessing.game;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one game session. Owned by its {@link GameEntity} and never shared.
 */
@Data
public class Game {
    private String host;
    private String name;
    private List<String> players = new ArrayList<>(); // join order
    private List<String> turnOrder = List.of();       // roster captured at start/restart
    private int round;
    private int turn;                                 // index into turnOrder
    private Configuration config;
    private GameState state = GameState.SETTING_UP;
}
