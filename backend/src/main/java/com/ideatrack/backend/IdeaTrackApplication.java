package com.ideatrack.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IdeaTrackApplication {

    public static void main(String[] args) {
        SpringApplication.run(IdeaTrackApplication.class, args);
    }
}
