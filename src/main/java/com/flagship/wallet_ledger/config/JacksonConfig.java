package com.flagship.wallet_ledger.config;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Jackson configuration for the ledger API.
 *
 * Amounts travel as JSON numbers and must reach {@link com.flagship.wallet_ledger.shared.Money}
 * exactly as sent:
 * - Floats are read as BigDecimal, never through double
 * - Number literals are capped at {@value #MAX_NUMBER_LENGTH} characters, far above any
 *   18-digit amount, so oversized literals fail while parsing
 * - BigDecimals are written plain, so a balance never appears as 1E+3
 * - Timestamps are ISO-8601 strings
 */
@Configuration
public class JacksonConfig {

    static final int MAX_NUMBER_LENGTH = 64;

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.getFactory().setStreamReadConstraints(
            StreamReadConstraints.builder().maxNumberLength(MAX_NUMBER_LENGTH).build());

        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        mapper.enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);

        return mapper;
    }
}
