package com.eatsential.eatsential_api.feedback.dto.response;

import com.eatsential.eatsential_api.feedback.entity.RecommendationFeedback;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(name = "FeedbackResponse")
public record FeedbackResponse(
        Long id,
        @JsonProperty("item_id") Long itemId,
        @JsonProperty("item_type") String itemType,
        @JsonProperty("feedback_type") String feedbackType,
        @JsonProperty("created_at") Instant createdAt
) {

    public static FeedbackResponse from(RecommendationFeedback feedback) {
        return new FeedbackResponse(
                feedback.getId(),
                feedback.getItemId(),
                feedback.getItemType().value(),
                feedback.getFeedbackType().value(),
                feedback.getCreatedAt()
        );
    }
}
