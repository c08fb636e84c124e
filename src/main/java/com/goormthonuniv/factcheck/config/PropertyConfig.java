package com.goormthonuniv.factcheck.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

/**
 * 로컬 비밀값(OPENROUTER_API_KEY 등)은 properties/env.properties 에 둘 수 있다(없어도 됨).
 */
@Configuration
@PropertySource(
        value = "classpath:properties/env.properties",
        ignoreResourceNotFound = true
)
@EnableConfigurationProperties(FactCheckProperties.class)
public class PropertyConfig {

}
