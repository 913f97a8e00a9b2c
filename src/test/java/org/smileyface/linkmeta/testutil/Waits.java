package org.smileyface.linkmeta.testutil;

import java.time.Duration;
import java.util.function.BooleanSupplier;

public final class Waits {

    private Waits() {
    }

    /**
     * Polls {@code condition} every 20 ms until it holds or {@code timeout} elapses.
     *
     * @return whether the condition held before the deadline
     */
    public static boolean waitUntil(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) return true;
            Thread.sleep(20);
        }
        return condition.getAsBoolean();
    }
}
