package com.eatsential.eatsential_api.recommendation.ranking;

import com.eatsential.eatsential_api.feedback.entity.FeedbackItemType;
import com.eatsential.eatsential_api.feedback.model.FeedbackSnapshot;
import com.eatsential.eatsential_api.recommendation.config.RecommendationProperties;
import com.eatsential.eatsential_api.recommendation.model.Candidate;
import com.eatsential.eatsential_api.recommendation.model.RecommendationTarget;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 좋아요/싫어요 반영.
 * <ul>
 *     <li>최신 피드백이 싫어요인 항목, 싫어요한 식당의 항목은 제거</li>
 *     <li>최신 피드백이 좋아요인 항목, 좋아요가 있는 식당의 항목은 점수 x likeBoost (최대 1.0)</li>
 * </ul>
 * 부스트된 후보는 meta 에 표시되어 다시 적용해도 바뀌지 않는다. 순서는 건드리지 않는다.
 */
@Component
@RequiredArgsConstructor
public class FeedbackAdjuster {

    static final String LIKED_SUFFIX = " (You liked this before)";

    private final RecommendationProperties properties;

    public List<Candidate> adjust(List<Candidate> candidates, FeedbackSnapshot snapshot) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        if (snapshot == null || snapshot.isEmpty()) {
            return List.copyOf(candidates);
        }

        List<Candidate> adjusted = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            if (isExcluded(candidate, snapshot)) {
                continue;
            }
            adjusted.add(shouldBoost(candidate, snapshot) ? boost(candidate) : candidate);
        }
        return adjusted;
    }

    private boolean isExcluded(Candidate candidate, FeedbackSnapshot snapshot) {
        if (snapshot.isDisliked(FeedbackItemType.RESTAURANT, candidate.restaurantId())) {
            return true;
        }
        return candidate.target() == RecommendationTarget.MEAL
                && snapshot.isDisliked(FeedbackItemType.MEAL, candidate.itemId());
    }

    private boolean shouldBoost(Candidate candidate, FeedbackSnapshot snapshot) {
        if (candidate.isBoosted()) {
            return false;
        }
        if (candidate.target() == RecommendationTarget.MEAL
                && snapshot.isLiked(FeedbackItemType.MEAL, candidate.itemId())) {
            return true;
        }
        return snapshot.isRestaurantLiked(candidate.restaurantId());
    }

    private Candidate boost(Candidate candidate) {
        String explanation = candidate.explanation() == null ? LIKED_SUFFIX.trim() : candidate.explanation() + LIKED_SUFFIX;
        return candidate.toBuilder()
                .score(candidate.score() * properties.likeBoost())
                .explanation(explanation)
                .build()
                .withMeta(Candidate.META_BOOSTED, String.valueOf(properties.likeBoost()));
    }
}
