package com.quick.guessing.game;

/**
 * Live games keyed by host name.
 */
public class GameRegistry extends EntityRegistry<GameEntity> {

    public GameRegistry() {
        super("game");
    }
}
