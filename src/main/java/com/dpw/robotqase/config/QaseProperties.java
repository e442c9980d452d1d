package com.dpw.robotqase.config;

import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Qase TestOps settings. The official environment variables {@code QASE_TESTOPS_PROJECT},
 * {@code QASE_TESTOPS_API_TOKEN} and {@code QASE_TESTOPS_RUN_TITLE} reach these fields through the
 * placeholders in application.yml.
 */
@Data
@ConfigurationProperties(prefix = "qase.testops")
public class QaseProperties {
    private String project;
    @ToString.Exclude
    private String apiToken;
    private String runTitle;
    private String baseUrl = "https://api.qase.io/v1";
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration readTimeout = Duration.ofSeconds(60);
}
