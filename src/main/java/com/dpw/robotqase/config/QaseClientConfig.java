package com.dpw.robotqase.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
@EnableConfigurationProperties(QaseProperties.class)
public class QaseClientConfig {

    // The API token can be overridden on the command line, so it is sent per request rather than set here
    @Bean
    public RestTemplate qaseRestTemplate(RestTemplateBuilder builder, QaseProperties properties) {
        return builder
                .rootUri(properties.getBaseUrl())
                .setConnectTimeout(properties.getConnectTimeout())
                .setReadTimeout(properties.getReadTimeout())
                .build();
    }
}
