package com.nan.shortsvc.store;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import com.nan.shortsvc.exception.KeyDerivationException;
import com.nan.shortsvc.exception.KeyNotFoundException;
import com.nan.shortsvc.exception.ValueTooLargeException;

/**
 * Keeps key -> value pairs in RAM and derives keys from the value's digest.
 *
 * <p>Candidate keys are windows of the digest. The first window is {@code minKeySize} characters
 * at offset 0. When a window is held by a different value it slides one character to the right;
 * once it no longer fits it grows by one character and starts again at offset 0. A value therefore
 * always walks the same sequence of candidates, and lands on the same key as long as no entries
 * are removed (there is no removal).
 *
 * <p>A single lock guards the map for the whole probe loop and for lookups, so two creates can
 * never both claim the same free window.
 */
public class InMemoryKeyStore implements KeyStore {

    public static final int DEFAULT_MAX_LEN = 2083;
    public static final int DEFAULT_MIN_KEY_SIZE = 6;

    private final Map<String, String> entries = new HashMap<>();
    private final Object lock = new Object();

    private final int maxLen;
    private final int minKeySize;
    private final ValueDigester digester;
    private final KeyStoreListener listener;

    public InMemoryKeyStore() {
        this(DEFAULT_MAX_LEN, DEFAULT_MIN_KEY_SIZE, new ValueDigester(), KeyStoreListener.NOOP);
    }

    public InMemoryKeyStore(int maxLen, int minKeySize, ValueDigester digester, KeyStoreListener listener) {
        if (maxLen < 1) {
            throw new IllegalArgumentException("maxLen must be positive: " + maxLen);
        }
        if (minKeySize < 1 || minKeySize > ValueDigester.DIGEST_LENGTH) {
            throw new IllegalArgumentException("minKeySize must be within 1.." + ValueDigester.DIGEST_LENGTH + ": " + minKeySize);
        }
        this.maxLen = maxLen;
        this.minKeySize = minKeySize;
        this.digester = digester;
        this.listener = listener;
    }

    @Override
    public String create(String value) {
        checkLength(value);

        String digest = digester.digest(value);

        String key;
        boolean existing;
        int collisions = 0;

        synchronized (lock) {
            int size = minKeySize;
            int offset = 0;
            while (true) {
                // window ran off the end of the digest -> widen and rescan
                if (offset + size > digest.length()) {
                    size++;
                    offset = 0;
                }
                if (size > digest.length()) {
                    throw new KeyDerivationException("no free key left in digest " + digest
                            + " after " + collisions + " collisions");
                }

                String candidate = digest.substring(offset, offset + size);
                String current = entries.get(candidate);

                if (current == null) {
                    entries.put(candidate, value);
                    key = candidate;
                    existing = false;
                    break;
                }
                if (current.equals(value)) {
                    key = candidate;
                    existing = true;
                    break;
                }
                collisions++;
                offset++;
            }
        }

        listener.onCreate(key, existing, collisions);
        return key;
    }

    @Override
    public String lookup(String key) {
        checkLength(key);

        synchronized (lock) {
            String value = entries.get(key);
            if (value == null) {
                throw new KeyNotFoundException(key);
            }
            return value;
        }
    }

    // Number of stored entries.
    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    public int getMaxLen() {
        return maxLen;
    }

    public int getMinKeySize() {
        return minKeySize;
    }

    // Length is counted in UTF-8 bytes, the same unit the digest is computed over.
    private void checkLength(String s) {
        int length = s.getBytes(StandardCharsets.UTF_8).length;
        if (length > maxLen) {
            throw new ValueTooLargeException(length, maxLen);
        }
    }
}
