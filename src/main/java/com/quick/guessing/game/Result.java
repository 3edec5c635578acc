package com.quick.guessing.game;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a game API call: either a value or a {@link GameError}, never both.
 *
 * @param value success payload, may be {@code null} for calls that only acknowledge
 * @param error failure kind, {@code null} on success
 */
public record Result<T>(T value, GameError error) {

    private static final Result<Void> OK = new Result<>(null, null);

    public static <T> Result<T> ok(T value) {
        return new Result<>(value, null);
    }

    public static Result<Void> ok() {
        return OK;
    }

    public static <T> Result<T> error(GameError error) {
        return new Result<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean isError(GameError expected) {
        return error == expected;
    }

    /**
     * Returns the success value, failing loudly when called on an error result.
     */
    public T orElseThrow() {
        if (error != null) {
            throw new IllegalStateException("Result is an error: " + error);
        }
        return value;
    }

    public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        if (error != null) {
            return error(error);
        }
        return ok(mapper.apply(value));
    }

    public <R> Result<R> flatMap(Function<? super T, Result<R>> mapper) {
        if (error != null) {
            return error(error);
        }
        return mapper.apply(value);
    }
}
