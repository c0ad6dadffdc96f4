package com.eatsential.eatsential_api.recommendation.dto.response;

import com.eatsential.eatsential_api.recommendation.model.Candidate;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;

@Schema(name = "RecommendedItem")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RecommendedItemResponse(
        @JsonProperty("item_id") Long itemId,
        String name,
        @Schema(example = "0.87") double score,
        String explanation,
        @JsonProperty("restaurant_name") String restaurantName,
        @JsonProperty("restaurant_place_id") String restaurantPlaceId,
        BigDecimal price,
        BigDecimal calories
) {

    public static RecommendedItemResponse from(Candidate candidate) {
        return new RecommendedItemResponse(
                candidate.itemId(),
                candidate.name(),
                candidate.score(),
                candidate.explanation(),
                candidate.restaurantName(),
                candidate.restaurantPlaceId(),
                candidate.price(),
                candidate.calories()
        );
    }
}
