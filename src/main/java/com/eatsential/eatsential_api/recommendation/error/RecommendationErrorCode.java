package com.eatsential.eatsential_api.recommendation.error;

import com.eatsential.eatsential_api.global.error.code.ErrorCode;
import org.springframework.http.HttpStatus;

public enum RecommendationErrorCode implements ErrorCode {

    // 400
    INVALID_FILTER(HttpStatus.BAD_REQUEST, "추천 필터 값이 올바르지 않습니다."),

    // 503
    CATALOG_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "메뉴 정보를 불러올 수 없습니다. 잠시 후 다시 시도해주세요.");

    private final HttpStatus status;
    private final String message;

    RecommendationErrorCode(HttpStatus status, String message) {
        this.status = status;
        this.message = message;
    }

    @Override public HttpStatus getStatus() { return status; }
    @Override public String getMessage() { return message; }
    @Override public String getCode() { return name(); }
}
