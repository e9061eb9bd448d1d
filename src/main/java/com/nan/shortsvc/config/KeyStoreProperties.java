package com.nan.shortsvc.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.nan.shortsvc.store.InMemoryKeyStore;

@ConfigurationProperties(prefix = "short.store")
public class KeyStoreProperties {

    // Storage backend; only "inmem" exists for now
    private String type = "inmem";

    // Longest value (create) or key (lookup) accepted, in UTF-8 bytes
    private int maxLen = InMemoryKeyStore.DEFAULT_MAX_LEN;

    // Width of the first candidate key
    private int minKeySize = InMemoryKeyStore.DEFAULT_MIN_KEY_SIZE;

    public String getType() { return type; }
    public int getMaxLen() { return maxLen; }
    public int getMinKeySize() { return minKeySize; }

    public void setType(String type) { this.type = type; }
    public void setMaxLen(int maxLen) { this.maxLen = maxLen; }
    public void setMinKeySize(int minKeySize) { this.minKeySize = minKeySize; }
}
