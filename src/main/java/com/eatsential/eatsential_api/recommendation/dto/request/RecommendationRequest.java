package com.eatsential.eatsential_api.recommendation.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;

@Schema(name = "RecommendationRequest")
public record RecommendationRequest(
        @Schema(example = "llm", allowableValues = {"llm", "baseline"}, defaultValue = "llm")
        String mode,

        @Valid
        RecommendationFiltersRequest filters
) {
}
