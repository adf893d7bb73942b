package com.multiquery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MultiQueryApplication {

    public static void main(String[] args) {
        SpringApplication.run(MultiQueryApplication.class, args);
    }
}
