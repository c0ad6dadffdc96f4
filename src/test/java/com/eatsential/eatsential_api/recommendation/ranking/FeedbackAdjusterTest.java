package com.eatsential.eatsential_api.recommendation.ranking;

import com.eatsential.eatsential_api.feedback.entity.FeedbackItemType;
import com.eatsential.eatsential_api.feedback.entity.FeedbackType;
import com.eatsential.eatsential_api.feedback.entity.RecommendationFeedback;
import com.eatsential.eatsential_api.feedback.model.FeedbackSnapshot;
import com.eatsential.eatsential_api.recommendation.config.RecommendationProperties;
import com.eatsential.eatsential_api.recommendation.model.Candidate;
import com.eatsential.eatsential_api.recommendation.model.RecommendationTarget;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FeedbackAdjusterTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final FeedbackAdjuster adjuster = new FeedbackAdjuster(RecommendationProperties.defaults());
    private long feedbackId = 1L;

    private RecommendationFeedback feedback(FeedbackItemType itemType, long itemId, FeedbackType type, Instant at) {
        return RecommendationFeedback.builder()
                .id(feedbackId++)
                .memberId(1L)
                .itemId(itemId)
                .itemType(itemType)
                .feedbackType(type)
                .createdAt(at)
                .build();
    }

    private Candidate meal(long itemId, long restaurantId, double score) {
        return Candidate.builder()
                .target(RecommendationTarget.MEAL)
                .itemId(itemId)
                .restaurantId(restaurantId)
                .name("meal-" + itemId)
                .score(score)
                .explanation("base")
                .build();
    }

    @Test
    void dislikedItemIsRemovedEvenWhenItWouldRankFirst() {
        // given: 100번 메뉴를 싫어요 -> 0.95 점이어도 제외
        FeedbackSnapshot snapshot = FeedbackSnapshot.of(
                List.of(feedback(FeedbackItemType.MEAL, 100L, FeedbackType.DISLIKE, T0)), Map.of(100L, 1L));
        List<Candidate> candidates = List.of(meal(100L, 1L, 0.95), meal(101L, 2L, 0.7));

        // when
        List<Candidate> adjusted = adjuster.adjust(candidates, snapshot);

        // then
        assertThat(adjusted).extracting(Candidate::itemId).containsExactly(101L);
    }

    @Test
    void likeOnAnyItemOfRestaurantBoostsOtherItemsOfThatRestaurant() {
        // given: R9의 500번 메뉴에 좋아요, 새 후보 501번(R9, 0.5)
        FeedbackSnapshot snapshot = FeedbackSnapshot.of(
                List.of(feedback(FeedbackItemType.MEAL, 500L, FeedbackType.LIKE, T0)), Map.of(500L, 9L));

        // when
        List<Candidate> adjusted = adjuster.adjust(List.of(meal(501L, 9L, 0.5), meal(600L, 3L, 0.5)), snapshot);

        // then: 0.5 * 1.2 = 0.6, 다른 식당은 그대로
        assertThat(adjusted.get(0).score()).isCloseTo(0.6, within(1e-9));
        assertThat(adjusted.get(0).isBoosted()).isTrue();
        assertThat(adjusted.get(0).explanation()).endsWith(FeedbackAdjuster.LIKED_SUFFIX);
        assertThat(adjusted.get(1).score()).isCloseTo(0.5, within(1e-9));
        assertThat(adjusted.get(1).isBoosted()).isFalse();
    }

    @Test
    void boostIsClampedToOne() {
        FeedbackSnapshot snapshot = FeedbackSnapshot.of(
                List.of(feedback(FeedbackItemType.MEAL, 1L, FeedbackType.LIKE, T0)), Map.of(1L, 1L));

        List<Candidate> adjusted = adjuster.adjust(List.of(meal(1L, 1L, 0.95)), snapshot);

        assertThat(adjusted.get(0).score()).isEqualTo(1.0);
    }

    @Test
    void reapplyingIsNoOp() {
        // given: 좋아요/싫어요가 섞인 스냅샷
        FeedbackSnapshot snapshot = FeedbackSnapshot.of(List.of(
                feedback(FeedbackItemType.MEAL, 1L, FeedbackType.LIKE, T0),
                feedback(FeedbackItemType.MEAL, 2L, FeedbackType.DISLIKE, T0),
                feedback(FeedbackItemType.RESTAURANT, 30L, FeedbackType.LIKE, T0)
        ), Map.of(1L, 10L, 2L, 20L));
        List<Candidate> candidates = List.of(
                meal(1L, 10L, 0.4), meal(2L, 20L, 0.9), meal(3L, 30L, 0.5), meal(4L, 40L, 0.3));

        // when
        List<Candidate> once = adjuster.adjust(candidates, snapshot);
        List<Candidate> twice = adjuster.adjust(once, snapshot);

        // then
        assertThat(twice).isEqualTo(once);
        assertThat(once).extracting(Candidate::itemId).containsExactly(1L, 3L, 4L);
    }

    @Test
    void latestFeedbackWins() {
        // given: 싫어요 후 좋아요 -> 최신인 좋아요가 유효
        FeedbackSnapshot snapshot = FeedbackSnapshot.of(List.of(
                feedback(FeedbackItemType.MEAL, 7L, FeedbackType.DISLIKE, T0),
                feedback(FeedbackItemType.MEAL, 7L, FeedbackType.LIKE, T0.plusSeconds(60))
        ), Map.of(7L, 1L));

        List<Candidate> adjusted = adjuster.adjust(List.of(meal(7L, 1L, 0.5)), snapshot);

        assertThat(adjusted).hasSize(1);
        assertThat(adjusted.get(0).isBoosted()).isTrue();
    }

    @Test
    void dislikedRestaurantRemovesItsItemsAndRestaurantCandidate() {
        FeedbackSnapshot snapshot = FeedbackSnapshot.of(
                List.of(feedback(FeedbackItemType.RESTAURANT, 5L, FeedbackType.DISLIKE, T0)), Map.of());
        Candidate restaurant = Candidate.builder()
                .target(RecommendationTarget.RESTAURANT).itemId(5L).restaurantId(5L).name("R5").score(0.8).build();

        assertThat(adjuster.adjust(List.of(meal(1L, 5L, 0.9), meal(2L, 6L, 0.4)), snapshot))
                .extracting(Candidate::itemId).containsExactly(2L);
        assertThat(adjuster.adjust(List.of(restaurant), snapshot)).isEmpty();
    }

    @Test
    void emptySnapshotLeavesCandidatesUntouched() {
        List<Candidate> candidates = List.of(meal(1L, 1L, 0.3), meal(2L, 2L, 0.7));

        assertThat(adjuster.adjust(candidates, FeedbackSnapshot.empty())).isEqualTo(candidates);
    }
}
