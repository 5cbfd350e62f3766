package com.ironcondor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class IronCondorAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(IronCondorAnalyticsApplication.class, args);
    }
}
