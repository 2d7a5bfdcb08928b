package com.dcruver.weekly;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the weekly notes reporter.
 *
 * Reads a collection of dated documents from the content store, groups them into weeks
 * under a selectable numbering policy, and prints per-week digests of their content.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class WeeklyNotesApplication {

    public static void main(String[] args) {
        log.info("Starting weekly notes reporter...");
        SpringApplication.run(WeeklyNotesApplication.class, args);
    }
}
