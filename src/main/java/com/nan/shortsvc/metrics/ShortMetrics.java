package com.nan.shortsvc.metrics;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

import org.springframework.stereotype.Component;

import com.nan.shortsvc.store.KeyStoreListener;

/*
  Business counters for the service, kept in memory for the lifetime of the process.
  Outcomes come from ShortService; existing/collision counts come straight from the store.
*/
@Component
public class ShortMetrics implements KeyStoreListener {

    public static final String CREATE_SUCCESS = "create.success";
    public static final String CREATE_FAILURE = "create.failure";
    public static final String CREATE_EXISTING = "create.existing";
    public static final String CREATE_COLLISIONS = "create.collisions";
    public static final String LOOKUP_SUCCESS = "lookup.success";
    public static final String LOOKUP_FAILURE = "lookup.failure";

    private final Map<String, LongAdder> counters = new ConcurrentHashMap<>();

    public ShortMetrics() {
        for (String name : new String[] {CREATE_SUCCESS, CREATE_FAILURE, CREATE_EXISTING,
                CREATE_COLLISIONS, LOOKUP_SUCCESS, LOOKUP_FAILURE}) {
            counters.put(name, new LongAdder());
        }
    }

    @Override
    public void onCreate(String key, boolean existing, int collisions) {
        if (existing) {
            increment(CREATE_EXISTING, 1);
        }
        if (collisions > 0) {
            increment(CREATE_COLLISIONS, collisions);
        }
    }

    public void recordCreate(boolean success) {
        increment(success ? CREATE_SUCCESS : CREATE_FAILURE, 1);
    }

    public void recordLookup(boolean success) {
        increment(success ? LOOKUP_SUCCESS : LOOKUP_FAILURE, 1);
    }

    public long get(String name) {
        LongAdder adder = counters.get(name);
        return adder == null ? 0L : adder.sum();
    }

    public Map<String, Long> snapshot() {
        Map<String, Long> out = new TreeMap<>();
        counters.forEach((name, adder) -> out.put(name, adder.sum()));
        return Collections.unmodifiableMap(out);
    }

    private void increment(String name, long delta) {
        counters.computeIfAbsent(name, k -> new LongAdder()).add(delta);
    }
}
