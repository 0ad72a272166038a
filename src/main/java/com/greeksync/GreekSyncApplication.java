package com.greeksync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class GreekSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(GreekSyncApplication.class, args);
    }
}
