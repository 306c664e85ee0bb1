package org.ndfcclient.rest;

/**
 * Pauses between two attempts of a polled or retried request.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Sleeps for the given number of seconds.
     *
     * @param seconds Seconds to sleep
     */
    void sleep(int seconds);

    /**
     * Sleeper backed by {@link Thread#sleep(long)}.
     */
    Sleeper THREAD = seconds -> {
        try {
            Thread.sleep(seconds * 1000L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NdfcException("Interrupted while waiting to resend a request", e);
        }
    };
}
