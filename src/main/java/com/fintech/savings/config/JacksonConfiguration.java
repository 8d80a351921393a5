package com.fintech.savings.config;

import com.fasterxml.jackson.datatype.jsr310.deser.LocalDateTimeDeserializer;
import com.fasterxml.jackson.datatype.jsr310.ser.LocalDateTimeSerializer;
import com.fintech.savings.domain.model.Timestamps;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Every {@code LocalDateTime} on the wire uses {@link Timestamps#PATTERN}.
 */
@Configuration
public class JacksonConfiguration {

    @Bean
    public Jackson2ObjectMapperBuilderCustomizer timestampFormatCustomizer() {
        return builder -> builder
                .serializers(new LocalDateTimeSerializer(Timestamps.FORMATTER))
                .deserializers(new LocalDateTimeDeserializer(Timestamps.FORMATTER));
    }
}
