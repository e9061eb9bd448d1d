package com.nan.shortsvc.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.nan.shortsvc.metrics.ShortMetrics;
import com.nan.shortsvc.store.InMemoryKeyStore;
import com.nan.shortsvc.store.KeyStore;
import com.nan.shortsvc.store.ValueDigester;

@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Bean
    public KeyStore keyStore(KeyStoreProperties props, ShortMetrics metrics) {
        switch (props.getType()) {
            case "inmem":
                log.info("Storage={} maxLen={} minKeySize={}", props.getType(), props.getMaxLen(), props.getMinKeySize());
                return new InMemoryKeyStore(props.getMaxLen(), props.getMinKeySize(), new ValueDigester(), metrics);
            default:
                throw new IllegalStateException("unknown storage backend: " + props.getType());
        }
    }
}
