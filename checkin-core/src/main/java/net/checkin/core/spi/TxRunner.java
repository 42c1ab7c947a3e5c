package net.checkin.core.spi;

import java.util.concurrent.Callable;

/**
 * Transaction boundary for store access.
 * {@code required} joins a running transaction on the current thread or opens one;
 * {@code requiresNew} always commits on its own before returning.
 */
public interface TxRunner {
    <T> T required(Callable<T> body) throws Exception;
    <T> T requiresNew(Callable<T> body) throws Exception;

    default void required(Runnable body) throws Exception { required(() -> { body.run(); return null; }); }
    default void requiresNew(Runnable body) throws Exception { requiresNew(() -> { body.run(); return null; }); }

    /** Runs bodies directly, for stores that commit on every call. */
    static TxRunner direct() {
        return new TxRunner() {
            @Override public <T> T required(Callable<T> body) throws Exception { return body.call(); }
            @Override public <T> T requiresNew(Callable<T> body) throws Exception { return body.call(); }
        };
    }
}
