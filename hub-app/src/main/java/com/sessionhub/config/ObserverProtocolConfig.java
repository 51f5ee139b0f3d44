package com.sessionhub.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sessionhub.api.protocol.ObserverMessageCodec;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 观察端协议编解码，复用 Spring Boot 配置好的 ObjectMapper（含 JavaTimeModule）。
 */
@Configuration
public class ObserverProtocolConfig {

    @Bean
    public ObserverMessageCodec observerMessageCodec(ObjectMapper objectMapper) {
        return new ObserverMessageCodec(objectMapper);
    }
}
