package com.eatsential.eatsential_api.recommendation.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;

import java.util.List;

@Schema(name = "RecommendationFilters")
public record RecommendationFiltersRequest(
        @Schema(example = "[\"vegan\", \"gluten-free\"]")
        @Size(max = 10, message = "diet는 최대 10개까지 지정할 수 있습니다.")
        List<String> diet,

        @Schema(example = "[\"italian\"]")
        @Size(max = 10, message = "cuisine은 최대 10개까지 지정할 수 있습니다.")
        List<String> cuisine,

        @Schema(example = "$$", allowableValues = {"$", "$$", "$$$", "$$$$"})
        @JsonProperty("price_range")
        String priceRange
) {
}
