package com.nan.shortsvc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ShortServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShortServiceApplication.class, args);
    }
}
