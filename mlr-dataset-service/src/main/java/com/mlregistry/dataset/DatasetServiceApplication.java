package com.mlregistry.dataset;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Dataset Service Application
 * Registers message brokers and topics, links datasets to them and reads live topic data
 */
@SpringBootApplication
@EnableConfigurationProperties
public class DatasetServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(DatasetServiceApplication.class, args);
    }
}
