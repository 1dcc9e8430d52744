package com.hookmetrics.analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;

// Mongo client is built in MongoConfig with explicit timeouts
@SpringBootApplication(exclude = MongoAutoConfiguration.class)
public class SpringBootAnalyticsApplication {
    public static void main(String[] args) {
        SpringApplication.run(SpringBootAnalyticsApplication.class, args);
    }
}
