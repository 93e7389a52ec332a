package com.ideatrack.backend.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class JacksonConfig {

    /**
     * Shared mapper for the API and the snapshot file.
     */
    public static JsonMapper buildMapper() {
        return JsonMapper.builder()
                // Instant 직렬화 지원
                .addModule(new JavaTimeModule())
                // 2026-01-05T... 형태로 내보내기(타임스탬프 숫자 방지)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return buildMapper();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
