package com.studytrack.badges;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BadgeBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(BadgeBackendApplication.class, args);
    }

}
