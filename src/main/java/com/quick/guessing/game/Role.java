package com.quick.guessing.game;

public enum Role {
    HOST,
    PLAYER
}
