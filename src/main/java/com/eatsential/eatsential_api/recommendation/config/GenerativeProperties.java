package com.eatsential.eatsential_api.recommendation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "generative")
public record GenerativeProperties(
        String baseUrl,
        String apiKey,
        String model,
        Double temperature,
        Long timeoutMs,
        Long connectTimeoutMs
) {

    public GenerativeProperties {
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = "https://generativelanguage.googleapis.com";
        }
        if (model == null || model.isBlank()) {
            model = "gemini-2.5-flash";
        }
        if (temperature == null) {
            temperature = 0.2;
        }
        if (timeoutMs == null || timeoutMs <= 0) {
            timeoutMs = 5000L;
        }
        if (connectTimeoutMs == null || connectTimeoutMs <= 0) {
            connectTimeoutMs = 2000L;
        }
    }

    /**
     * 키가 없거나 "test" 이면 외부 호출 없이 결정적 스텁 점수를 쓴다(로컬/테스트).
     */
    public boolean offline() {
        return apiKey == null || apiKey.isBlank() || "test".equalsIgnoreCase(apiKey.trim());
    }
}
