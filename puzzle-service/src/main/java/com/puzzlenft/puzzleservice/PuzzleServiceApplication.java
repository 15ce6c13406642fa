package com.puzzlenft.puzzleservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PuzzleServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(PuzzleServiceApplication.class, args);
    }
}
