package com.eatsential.eatsential_api.global.error.api;

import com.eatsential.eatsential_api.global.error.code.ErrorCode;
import java.util.List;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 클라이언트에 ErrorResponse 로 내려가는 도메인 예외.
 * errors 는 필드 검증 실패, data 는 운영 로그용 상세(원인 메시지 등)에 쓴다.
 */
@Getter
public class ApiException extends RuntimeException {

    private final ErrorCode errorCode;
    private final List<FieldErrorData> errors;
    private final Object data;

    public ApiException(ErrorCode errorCode) {
        this(errorCode, null, null, null);
    }

    public ApiException(ErrorCode errorCode, List<FieldErrorData> errors) {
        this(errorCode, errors == null ? null : List.copyOf(errors), null, null);
    }

    public ApiException(ErrorCode errorCode, Object data) {
        this(errorCode, null, data, null);
    }

    // 저장소 장애처럼 원인 예외를 스택트레이스로 남겨야 하는 경우
    public ApiException(ErrorCode errorCode, Object data, Throwable cause) {
        this(errorCode, null, data, cause);
    }

    private ApiException(ErrorCode errorCode, List<FieldErrorData> errors, Object data, Throwable cause) {
        super(errorCode.getMessage(), cause);
        this.errorCode = errorCode;
        this.errors = errors;
        this.data = data;
    }

    public static ApiException ofField(ErrorCode errorCode, String field, String reason) {
        return new ApiException(errorCode, List.of(new FieldErrorData(field, reason)));
    }

    public HttpStatus getStatus() {
        return errorCode.getStatus();
    }
}
