package com.scoregate.config;

import java.time.Clock;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * RestTemplate for all Steam Web API calls. Every call is bounded by the
     * configured timeouts; a timeout is handled as a transient failure by the callers.
     */
    @Bean
    public RestTemplate steamRestTemplate(RestTemplateBuilder builder, SteamProperties steamProperties) {
        return builder
                .setConnectTimeout(steamProperties.getConnectTimeout())
                .setReadTimeout(steamProperties.getReadTimeout())
                .build();
    }
}
