package de.mirkosertic.docmirror.util;

/**
 * Blocks the calling thread. Exists so that throttling and backoff can be replaced
 * by a no-op in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    Sleeper NONE = millis -> {
    };

    void sleep(long millis) throws InterruptedException;
}
