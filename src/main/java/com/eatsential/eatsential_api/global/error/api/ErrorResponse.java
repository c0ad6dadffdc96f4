package com.eatsential.eatsential_api.global.error.api;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "ErrorResponse")
public record ErrorResponse(
	@Schema(example = "INVALID_FILTER") String code,
	@Schema(example = "추천 필터 값이 올바르지 않습니다.") String message,
	@Schema(description = "필터/바디 검증 실패 시 필드별 사유") List<FieldErrorData> errors,
	@Schema(description = "비즈니스 에러에서 추가 정보 필요 시 사용") Object data
) { }
