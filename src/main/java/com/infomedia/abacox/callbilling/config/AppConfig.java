package com.infomedia.abacox.callbilling.config;

import org.openapitools.jackson.nullable.JsonNullableModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

import java.time.Clock;

@Configuration
@EnableJpaAuditing
public class AppConfig {

    /** Single time source, so billing timestamps can be pinned in tests. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JsonNullableModule jsonNullableModule() {
        return new JsonNullableModule();
    }
}
