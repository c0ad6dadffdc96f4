package com.eatsential.eatsential_api.global.error.handler;

import com.eatsential.eatsential_api.global.error.api.ApiException;
import com.eatsential.eatsential_api.global.error.api.ErrorResponse;
import com.eatsential.eatsential_api.global.error.api.FieldErrorData;
import com.eatsential.eatsential_api.global.error.code.CommonErrorCode;
import com.eatsential.eatsential_api.global.error.code.ErrorCode;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    // 도메인/비즈니스 예외
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ErrorResponse> handleApiException(ApiException ex) {
        ErrorCode ec = ex.getErrorCode();
        if (ec.getStatus().is5xxServerError()) {
            LOG.error("[ApiException] code={}, data={}", ec.getCode(), ex.getData(), ex);
        }
        return toResponse(ec, ex.getErrors(), ex.getData());
    }

    // @Valid body 검증 실패
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(MethodArgumentNotValidException ex) {
        List<FieldErrorData> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> new FieldErrorData(fe.getField(), safeReason(fe.getDefaultMessage())))
                .toList();
        return toResponse(CommonErrorCode.VALIDATION_FAILED, errors, null);
    }

    // @RequestParam 검증 실패
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException ex) {
        List<FieldErrorData> errors = ex.getConstraintViolations().stream()
                .map(this::toFieldError)
                .toList();
        return toResponse(CommonErrorCode.VALIDATION_FAILED, errors, null);
    }

    // JSON 파싱 실패
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(HttpMessageNotReadableException ex) {
        return toResponse(CommonErrorCode.INVALID_JSON, null, null);
    }

    // 필수 쿼리 파라미터 누락
    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingRequestParam(MissingServletRequestParameterException ex) {
        List<FieldErrorData> errors = List.of(new FieldErrorData(ex.getParameterName(), "필수값입니다."));
        return toResponse(CommonErrorCode.PARAMETER_MISSING, errors, null);
    }

    // 호출자 식별 헤더(X-Member-Id) 누락
    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingRequestHeader(MissingRequestHeaderException ex) {
        List<FieldErrorData> errors = List.of(new FieldErrorData(ex.getHeaderName(), "필수 헤더입니다."));
        return toResponse(CommonErrorCode.PARAMETER_MISSING, errors, null);
    }

    // 타입 미스매치
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        List<FieldErrorData> errors = List.of(new FieldErrorData(ex.getName(), "형식이 올바르지 않습니다."));
        return toResponse(CommonErrorCode.TYPE_MISMATCH, errors, null);
    }

    // 매핑되지 않은 HTTP 메서드
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        return toResponse(CommonErrorCode.METHOD_NOT_ALLOWED, null, ex.getMethod());
    }

    // JSON 이 아닌 Content-Type
    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMediaTypeNotSupported(HttpMediaTypeNotSupportedException ex) {
        String contentType = ex.getContentType() != null ? ex.getContentType().toString() : null;
        return toResponse(CommonErrorCode.UNSUPPORTED_MEDIA_TYPE, null, contentType);
    }

    // 예상 못한 예외
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception ex) {
        LOG.error("Unhandled exception", ex);
        return toResponse(CommonErrorCode.INTERNAL_SERVER_ERROR, null, null);
    }

    private ResponseEntity<ErrorResponse> toResponse(ErrorCode ec, List<FieldErrorData> errors, Object data) {
        return ResponseEntity.status(ec.getStatus())
                .body(new ErrorResponse(ec.getCode(), ec.getMessage(), errors, data));
    }

    private FieldErrorData toFieldError(ConstraintViolation<?> v) {
        String path = v.getPropertyPath() != null ? v.getPropertyPath().toString() : "unknown";
        return new FieldErrorData(extractLastPathToken(path), safeReason(v.getMessage()));
    }

    private String extractLastPathToken(String path) {
        int idx = path.lastIndexOf('.');
        return (idx >= 0 && idx < path.length() - 1) ? path.substring(idx + 1) : path;
    }

    private String safeReason(String reason) {
        return (reason == null || reason.isBlank()) ? "유효하지 않습니다." : reason;
    }
}
