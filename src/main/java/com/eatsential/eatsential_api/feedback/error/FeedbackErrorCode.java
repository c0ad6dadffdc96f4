package com.eatsential.eatsential_api.feedback.error;

import com.eatsential.eatsential_api.global.error.code.ErrorCode;
import org.springframework.http.HttpStatus;

public enum FeedbackErrorCode implements ErrorCode {

    // 400
    INVALID_FEEDBACK(HttpStatus.BAD_REQUEST, "피드백 값이 올바르지 않습니다."),

    // 500
    FEEDBACK_STORE_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "피드백 저장 중 오류가 발생했습니다.");

    private final HttpStatus status;
    private final String message;

    FeedbackErrorCode(HttpStatus status, String message) {
        this.status = status;
        this.message = message;
    }

    @Override public HttpStatus getStatus() { return status; }
    @Override public String getMessage() { return message; }
    @Override public String getCode() { return name(); }
}
