package com.eatsential.eatsential_api.feedback.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

@Schema(name = "FeedbackSubmitRequest")
public record FeedbackSubmitRequest(
        @Schema(example = "42")
        @JsonProperty("item_id")
        @NotNull(message = "item_id는 필수입니다.")
        @Positive(message = "item_id는 양수여야 합니다.")
        Long itemId,

        @Schema(example = "meal", allowableValues = {"meal", "restaurant"})
        @JsonProperty("item_type")
        @NotBlank(message = "item_type은 필수입니다.")
        String itemType,

        @Schema(example = "like", allowableValues = {"like", "dislike"})
        @JsonProperty("feedback_type")
        @NotBlank(message = "feedback_type은 필수입니다.")
        String feedbackType,

        @Schema(example = "too salty")
        @Size(max = 500, message = "notes는 500자 이하여야 합니다.")
        String notes
) {
}
