package com.eatsential.eatsential_api.recommendation.generator;

import lombok.Getter;

/**
 * 생성형 생성기 실패. 오케스트레이터가 잡아서 기본 생성기로 대체하며 클라이언트에 노출되지 않는다.
 */
@Getter
public class GenerationFailedException extends RuntimeException {

    public enum Reason {
        TIMEOUT,
        UPSTREAM_ERROR,
        CIRCUIT_OPEN,
        BULKHEAD_FULL,
        MALFORMED_REPLY,
        EMPTY_REPLY,
        DEGENERATE_SCORES
    }

    private final Reason reason;

    public GenerationFailedException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public GenerationFailedException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
