package com.valkyrlabs;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ThorDrive: authorization engine for a shared file/folder hierarchy.
 *
 * Entities live in {@code com.valkyrlabs.model}, repositories in
 * {@code com.valkyrlabs.api}, and the core in {@code com.valkyrlabs.thordrive}.
 */
@SpringBootApplication
public class ThorDrive {

    public static void main(String[] args) {
        SpringApplication.run(ThorDrive.class, args);
    }
}
