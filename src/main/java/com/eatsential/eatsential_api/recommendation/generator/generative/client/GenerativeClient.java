package com.eatsential.eatsential_api.recommendation.generator.generative.client;

import com.eatsential.eatsential_api.recommendation.config.GenerativeProperties;
import com.eatsential.eatsential_api.recommendation.generator.GenerationFailedException;
import com.eatsential.eatsential_api.recommendation.generator.GenerationFailedException.Reason;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;

/**
 * Gemini generateContent 호출. 응답 원문 문자열만 돌려주고 해석은 파서가 맡는다.
 * timeout 은 Reactor 구독 취소로 진행 중인 HTTP 호출까지 끊는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GenerativeClient {

    static final String CIRCUIT_BREAKER = "generative";
    private static final String API_KEY_HEADER = "x-goog-api-key";
    private static final int MAX_LOGGED_BODY = 500;

    private final WebClient generativeWebClient;
    private final GenerativeProperties properties;

    @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "generateContentFallback")
    public String generateContent(String prompt) {
        Map<String, Object> body = Map.of(
                "contents", List.of(Map.of("role", "user", "parts", List.of(Map.of("text", prompt)))),
                "generationConfig", Map.of(
                        "temperature", properties.temperature(),
                        "responseMimeType", "application/json"
                )
        );

        long startNs = System.nanoTime();
        try {
            String raw = generativeWebClient.post()
                    .uri("/v1beta/models/{model}:generateContent", properties.model())
                    .header(API_KEY_HEADER, properties.apiKey())
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp ->
                            resp.bodyToMono(String.class).defaultIfEmpty("")
                                    .map(errorBody -> new GenerationFailedException(
                                            Reason.UPSTREAM_ERROR,
                                            "Generative backend returned " + resp.statusCode().value()
                                                    + ": " + abbreviate(errorBody)
                                    ))
                    )
                    .bodyToMono(String.class)
                    .timeout(Duration.ofMillis(properties.timeoutMs()))
                    .block();

            if (raw == null || raw.isBlank()) {
                throw new GenerationFailedException(Reason.EMPTY_REPLY, "Generative backend returned empty body");
            }
            log.debug("[Generative] reply received. model={}, elapsedMs={}, length={}",
                    properties.model(), (System.nanoTime() - startNs) / 1_000_000, raw.length());
            return raw;
        } catch (GenerationFailedException e) {
            throw e;
        } catch (RuntimeException e) {
            throw translate(e);
        }
    }

    private String generateContentFallback(String prompt, Throwable throwable) {
        throw translate(throwable);
    }

    private GenerationFailedException translate(Throwable throwable) {
        if (throwable instanceof GenerationFailedException failed) {
            return failed;
        }
        if (throwable instanceof CallNotPermittedException) {
            return new GenerationFailedException(Reason.CIRCUIT_OPEN, "Generative circuit breaker is open", throwable);
        }
        if (throwable instanceof BulkheadFullException) {
            return new GenerationFailedException(Reason.BULKHEAD_FULL, "Generative bulkhead is full", throwable);
        }
        Throwable cause = Exceptions.unwrap(throwable);
        if (cause instanceof TimeoutException) {
            return new GenerationFailedException(
                    Reason.TIMEOUT, "Generative backend timed out after " + properties.timeoutMs() + "ms", cause);
        }
        if (cause instanceof WebClientRequestException) {
            return new GenerationFailedException(Reason.UPSTREAM_ERROR, "Generative backend unreachable: " + cause.getMessage(), cause);
        }
        return new GenerationFailedException(Reason.UPSTREAM_ERROR, "Generative call failed: " + cause.getMessage(), cause);
    }

    private String abbreviate(String text) {
        if (text == null || text.length() <= MAX_LOGGED_BODY) {
            return text;
        }
        return text.substring(0, MAX_LOGGED_BODY) + "...";
    }
}
