package com.userstats.platform;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class UserStatsPlatformApplication {

    public static void main(String[] args) {
        SpringApplication.run(UserStatsPlatformApplication.class, args);
    }
}
