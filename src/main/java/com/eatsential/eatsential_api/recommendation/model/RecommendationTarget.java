package com.eatsential.eatsential_api.recommendation.model;

import com.eatsential.eatsential_api.feedback.entity.FeedbackItemType;

/**
 * 추천 단위. 메뉴 추천이면 Candidate.itemId 가 메뉴 id, 식당 추천이면 식당 id 다.
 */
public enum RecommendationTarget {

    MEAL(FeedbackItemType.MEAL),
    RESTAURANT(FeedbackItemType.RESTAURANT);

    private final FeedbackItemType feedbackItemType;

    RecommendationTarget(FeedbackItemType feedbackItemType) {
        this.feedbackItemType = feedbackItemType;
    }

    public FeedbackItemType feedbackItemType() {
        return feedbackItemType;
    }
}
