package com.dcruver.weekly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.LocalDate;

/**
 * Initial week policy. Changed at runtime through the shell.
 */
@ConfigurationProperties(prefix = "weekly.week")
@Data
public class WeekPolicyProperties {
    private String policy = "project";
    private LocalDate anchorDate = LocalDate.of(2025, 7, 1);
}
