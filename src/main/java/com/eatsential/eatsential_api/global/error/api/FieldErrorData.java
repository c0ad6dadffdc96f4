package com.eatsential.eatsential_api.global.error.api;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "FieldErrorData")
public record FieldErrorData(
        @Schema(example = "filters.price_range") String field,
        @Schema(example = "$, $$, $$$, $$$$ 중 하나여야 합니다.") String reason) {
}
