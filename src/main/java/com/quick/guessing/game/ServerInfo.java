package com.quick.guessing.game;

import java.util.List;

/**
 * @param players names of connected players
 * @param games   one summary line per live game
 */
public record ServerInfo(List<String> players, List<String> games) {
}
