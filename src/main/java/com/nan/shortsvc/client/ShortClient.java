package com.nan.shortsvc.client;

import java.time.Duration;
import java.util.function.Supplier;

import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import com.nan.shortsvc.exception.KeyNotFoundException;
import com.nan.shortsvc.exception.ValueTooLargeException;
import com.nan.shortsvc.model.CreateRequest;
import com.nan.shortsvc.model.CreateResponse;
import com.nan.shortsvc.model.LookupResponse;
import com.nan.shortsvc.store.KeyStore;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;

/*
  ShortClient talks to a remote short service over HTTP and behaves like a local KeyStore.
  Every call goes through a client-side rate limiter and circuit breaker.
  404 -> KeyNotFoundException, 400 -> ValueTooLargeException, anything else -> RestClientException.
*/
public class ShortClient implements KeyStore {

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final RateLimiter limiter;
    private final CircuitBreaker breaker;

    public ShortClient(String instance) {
        this(instance, new RestTemplate());
    }

    public ShortClient(String instance, RestTemplate restTemplate) {
        this.baseUrl = normalize(instance);
        this.restTemplate = restTemplate;
        this.limiter = RateLimiter.of("shortClient", RateLimiterConfig.custom()
                .limitForPeriod(50)
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .timeoutDuration(Duration.ZERO)
                .build());
        this.breaker = CircuitBreaker.of("shortClient", CircuitBreakerConfig.custom()
                .waitDurationInOpenState(Duration.ofSeconds(5))
                .ignoreExceptions(KeyNotFoundException.class, ValueTooLargeException.class, RequestNotPermitted.class)
                .build());
    }

    @Override
    public String create(String value) {
        return call(() -> {
            try {
                CreateResponse resp = restTemplate.postForObject(baseUrl + "/api", new CreateRequest(value), CreateResponse.class);
                return resp == null ? null : resp.getK();
            } catch (HttpClientErrorException.BadRequest e) {
                throw new ValueTooLargeException("server rejected value: " + e.getStatusText());
            }
        });
    }

    @Override
    public String lookup(String key) {
        return call(() -> {
            try {
                LookupResponse resp = restTemplate.getForObject(baseUrl + "/api/{key}", LookupResponse.class, key);
                return resp == null ? null : resp.getV();
            } catch (HttpClientErrorException.NotFound e) {
                throw new KeyNotFoundException(key);
            } catch (HttpClientErrorException.BadRequest e) {
                throw new ValueTooLargeException("server rejected key: " + e.getStatusText());
            }
        });
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    CircuitBreaker getBreaker() {
        return breaker;
    }

    private <T> T call(Supplier<T> supplier) {
        return CircuitBreaker.decorateSupplier(breaker, RateLimiter.decorateSupplier(limiter, supplier)).get();
    }

    // "host:port" -> "http://host:port", trailing slash dropped
    static String normalize(String instance) {
        String url = instance.startsWith("http") ? instance : "http://" + instance;
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
