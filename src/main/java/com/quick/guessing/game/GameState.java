package com.quick.guessing.game;

public enum GameState {
    SETTING_UP,
    IN_PLAY,
    ENDED
}
