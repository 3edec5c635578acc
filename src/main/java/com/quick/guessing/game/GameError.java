package com.quick.guessing.game;

/**
 * Expected failures of the game API. These are returned inside a {@link Result}, never thrown.
 */
public enum GameError {
    PLAYER_NOT_FOUND,
    PLAYER_NAME_TAKEN,
    GAME_NOT_FOUND,
    PLAYER_NOT_HOST,
    PLAYER_IN_GAME,
    INVALID_ACTION_FOR_STATE,
    WRONG_TURN,
    OUT_OF_RANGE,
    INVALID_CONFIGURATION
}
