package com.sparta.farmshare;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableRetry
@ConfigurationPropertiesScan
public class FarmshareApplication {

    public static void main(String[] args) {
        SpringApplication.run(FarmshareApplication.class, args);
    }
}
