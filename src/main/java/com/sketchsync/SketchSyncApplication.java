package com.sketchsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SketchSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(SketchSyncApplication.class, args);
    }
}
