package com.bit.sdupi.config;

import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;

/**
 * 金额超出 JS 安全整数范围，BigInteger 统一序列化为字符串
 */
@Configuration
public class JacksonConfig {

    @Bean
    public Jackson2ObjectMapperBuilderCustomizer bigIntegerAsString() {
        return builder -> builder.serializerByType(BigInteger.class, ToStringSerializer.instance);
    }
}
