package com.nan.shortsvc.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.nan.shortsvc.exception.KeyDerivationException;
import com.nan.shortsvc.exception.ShortServiceException;
import com.nan.shortsvc.metrics.ShortMetrics;
import com.nan.shortsvc.store.KeyStore;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;

/*
  Service sits between the HTTP layer and the KeyStore.
  - rate limiting + circuit breaking (resilience4j, see application.yml)
  - one log line per call
  - success/failure counters
  The store itself stays free of logging and metrics.
*/
@Service
public class ShortService {

    private static final Logger log = LoggerFactory.getLogger(ShortService.class);

    private final KeyStore store;
    private final ShortMetrics metrics;

    public ShortService(KeyStore store, ShortMetrics metrics) {
        this.store = store;
        this.metrics = metrics;
    }

    @CircuitBreaker(name = "create")
    @RateLimiter(name = "create")
    public String create(String value) {
        try {
            String key = store.create(value);
            metrics.recordCreate(true);
            log.info("method=Create v={} k={}", value, key);
            return key;
        } catch (RuntimeException e) {
            metrics.recordCreate(false);
            logFailure("Create", value, e);
            throw e;
        }
    }

    @CircuitBreaker(name = "lookup")
    @RateLimiter(name = "lookup")
    public String lookup(String key) {
        try {
            String value = store.lookup(key);
            metrics.recordLookup(true);
            log.info("method=Lookup k={} v={}", key, value);
            return value;
        } catch (RuntimeException e) {
            metrics.recordLookup(false);
            logFailure("Lookup", key, e);
            throw e;
        }
    }

    private void logFailure(String method, String input, RuntimeException e) {
        if (e instanceof ShortServiceException && !(e instanceof KeyDerivationException)) {
            log.warn("method={} in={} err={}", method, input, e.getMessage());
        } else {
            log.error("method={} in={} failed", method, input, e);
        }
    }
}
