package utils;

import java.util.function.Supplier;

public class Invariant {

    public static void check(boolean condition, String message) {
        if (!condition) {
            fail(message);
        }
    }

    public static void check(boolean condition, Supplier<String> message) {
        if (!condition) {
            fail(message.get());
        }
    }

    public static void fail(String message) {
        Log.fatal("Invariant violated: " + message);
        throw new InvariantViolationException(message);
    }
}
