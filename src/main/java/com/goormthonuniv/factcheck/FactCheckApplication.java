package com.goormthonuniv.factcheck;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.PropertySource;

@SpringBootApplication
@PropertySource(
        value = "classpath:properties/env.properties",
        ignoreResourceNotFound = true
)
public class FactCheckApplication {

    public static void main(String[] args) {
        SpringApplication.run(FactCheckApplication.class, args);
    }
}
