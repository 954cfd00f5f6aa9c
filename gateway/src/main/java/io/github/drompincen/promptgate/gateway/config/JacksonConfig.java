package io.github.drompincen.promptgate.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.promptgate.protocol.json.ProtocolJson;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JacksonConfig {

    // same settings the hook uses, so both ends agree on dates and unknown fields
    @Bean
    ObjectMapper objectMapper() {
        return ProtocolJson.newObjectMapper();
    }
}
