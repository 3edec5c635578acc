package com.quick.guessing.game;

import org.springframework.stereotype.Component;

import java.util.Random;

@Component
public class RandomNumberSource implements NumberSource {

    private final Random random = new Random();

    @Override
    public int draw(int maxGuess) {
        return random.nextInt(maxGuess) + 1;
    }
}
