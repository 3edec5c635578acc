package com.quick.guessing.game;

import java.util.Objects;

public record Bonus(int value, BonusReason reason) {

    public Bonus {
        if (value < 0) {
            throw new IllegalArgumentException("Bonus value must be non-negative: " + value);
        }
        Objects.requireNonNull(reason, "reason");
    }
}
