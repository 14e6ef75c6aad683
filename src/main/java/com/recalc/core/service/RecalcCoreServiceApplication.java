package com.recalc.core.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Recalc Core Service Application - Entry point for the Spring Boot application.
 *
 * A background process with no request/response API. It:
 * - Recalculates program calibrations when science observations become ready
 * - Recalculates calibration targets when calibration times change
 * - Polls for pending telluric resolutions on a fixed period
 *
 * The backing-store collaborators (session factory, service identity, change
 * feeds, recalculation services) are supplied as beans by the deployment.
 */
@SpringBootApplication
@ConfigurationPropertiesScan("com.recalc.core.service.config")
public class RecalcCoreServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(RecalcCoreServiceApplication.class, args);
    }
}
