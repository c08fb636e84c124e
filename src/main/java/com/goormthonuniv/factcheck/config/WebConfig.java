package com.goormthonuniv.factcheck.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.net.http.HttpClient;

@Configuration
public class WebConfig {

    /** LLM 호출용. 요청별 timeout 은 HttpRequest 에서 지정 */
    @Bean
    public HttpClient llmHttpClient(FactCheckProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(properties.getOpenrouter().getConnectTimeout())
                .build();
    }

    @Bean
    public WebMvcConfigurer corsConfigurer() {
        return new WebMvcConfigurer() {
            @Override public void addCorsMappings(CorsRegistry registry) {
                registry.addMapping("/api/**")
                        .allowedOrigins("*")
                        .allowedMethods("GET", "POST", "OPTIONS");
            }
        };
    }
}
