package com.example.autoheal.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class AppConfig {

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Shared by Slack delivery and the diagnosis oracle. The oracle narrows the
     * call timeout per request.
     */
    @Bean
    public OkHttpClient okHttpClient(AutohealProperties properties) {
        Duration io = Duration.ofSeconds(Math.max(5, properties.getDiagnosis().getTimeoutSeconds()));
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(5))
                .readTimeout(io)
                .writeTimeout(io)
                .retryOnConnectionFailure(false)
                .build();
    }

    /**
     * Single time source for cooldowns, expiries and trend windows.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
