package com.eatsential.eatsential_api.recommendation.dto.response;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "RecommendationResponse")
public record RecommendationResponse(
        List<RecommendedItemResponse> items,
        @Schema(description = "실제로 결과를 만든 생성기", allowableValues = {"LLM", "BASELINE"}) String source,
        @Schema(description = "생성형 실패로 기본 생성기 결과를 대신 반환했는지 여부") boolean fallback
) {
}
