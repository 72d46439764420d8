package com.williamcallahan.flarenormalizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the MadCap Flare normalization pipeline.
 */
@SpringBootApplication
public class FlareNormalizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlareNormalizerApplication.class, args);
    }
}
