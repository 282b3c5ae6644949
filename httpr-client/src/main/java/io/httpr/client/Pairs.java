package io.httpr.client;

import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * Splits flat name/value argument lists used by the builder methods.
 */
final class Pairs {
    private Pairs() {}

    static void forEach(String[] pairs, String what, BiConsumer<String, String> action) {
        Objects.requireNonNull(pairs, what);
        if (pairs.length % 2 != 0) {
            throw new IllegalArgumentException(what + " must be given as name/value pairs, got " + pairs.length + " arguments");
        }
        for (int i = 0; i < pairs.length; i += 2) {
            action.accept(Objects.requireNonNull(pairs[i], what + " name"), Objects.requireNonNull(pairs[i + 1], what + " value"));
        }
    }
}
