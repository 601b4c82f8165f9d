package com.delta.harvester.crawl.util;

public final class Pauses {
    private Pauses() {
    }

    /**
     * Sleeps for {@code millis}; non-positive values return immediately.
     *
     * @return false if the thread was interrupted (the interrupt flag is restored)
     */
    public static boolean pause(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
