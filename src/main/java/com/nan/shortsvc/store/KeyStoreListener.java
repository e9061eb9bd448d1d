package com.nan.shortsvc.store;

/**
 * Receives the outcome of every create accepted by an {@link InMemoryKeyStore}.
 * Called after the store lock has been released.
 */
public interface KeyStoreListener {

    KeyStoreListener NOOP = (key, existing, collisions) -> { };

    /**
     * @param key        the key handed back to the caller
     * @param existing   true when the value was already stored and nothing was inserted
     * @param collisions number of candidate keys skipped because another value held them
     */
    void onCreate(String key, boolean existing, int collisions);
}
