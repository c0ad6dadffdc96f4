package com.eatsential.eatsential_api.feedback.model;

import com.eatsential.eatsential_api.feedback.entity.FeedbackItemType;
import com.eatsential.eatsential_api.feedback.entity.FeedbackType;
import com.eatsential.eatsential_api.feedback.entity.RecommendationFeedback;

import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 요청 시작 시점에 한 번 만드는 회원별 피드백 최신 상태.
 * append-only 기록을 (createdAt, id) 순서로 접어 항목별 마지막 상태만 남긴다. 생성 후 변경되지 않는다.
 */
public final class FeedbackSnapshot {

    private static final Comparator<RecommendationFeedback> RECENCY =
            Comparator.comparing(RecommendationFeedback::getCreatedAt)
                    .thenComparing(RecommendationFeedback::getId, Comparator.nullsFirst(Comparator.naturalOrder()));

    private static final FeedbackSnapshot EMPTY = new FeedbackSnapshot(Map.of(), Map.of(), Set.of());

    private final Map<Long, FeedbackType> latestMeal;
    private final Map<Long, FeedbackType> latestRestaurant;
    private final Set<Long> likedRestaurantIds;

    private FeedbackSnapshot(
            Map<Long, FeedbackType> latestMeal,
            Map<Long, FeedbackType> latestRestaurant,
            Set<Long> likedRestaurantIds
    ) {
        this.latestMeal = Map.copyOf(latestMeal);
        this.latestRestaurant = Map.copyOf(latestRestaurant);
        this.likedRestaurantIds = Set.copyOf(likedRestaurantIds);
    }

    public static FeedbackSnapshot empty() {
        return EMPTY;
    }

    /**
     * @param records              회원의 피드백 기록 (순서 무관)
     * @param restaurantIdByItemId 메뉴 id -> 식당 id. 메뉴 좋아요를 식당 단위 부스트로 넓히는 데 쓴다.
     */
    public static FeedbackSnapshot of(
            Collection<RecommendationFeedback> records,
            Map<Long, Long> restaurantIdByItemId
    ) {
        if (records == null || records.isEmpty()) {
            return EMPTY;
        }

        Map<FeedbackItemType, Map<Long, RecommendationFeedback>> latest = new EnumMap<>(FeedbackItemType.class);
        for (RecommendationFeedback record : records) {
            Map<Long, RecommendationFeedback> byItem =
                    latest.computeIfAbsent(record.getItemType(), type -> new HashMap<>());
            byItem.merge(record.getItemId(), record,
                    (current, candidate) -> RECENCY.compare(candidate, current) > 0 ? candidate : current);
        }

        Map<Long, FeedbackType> meal = toStates(latest.get(FeedbackItemType.MEAL));
        Map<Long, FeedbackType> restaurant = toStates(latest.get(FeedbackItemType.RESTAURANT));

        Set<Long> liked = new HashSet<>();
        restaurant.forEach((restaurantId, type) -> {
            if (type == FeedbackType.LIKE) {
                liked.add(restaurantId);
            }
        });
        Map<Long, Long> resolver = restaurantIdByItemId == null ? Map.of() : restaurantIdByItemId;
        meal.forEach((itemId, type) -> {
            Long restaurantId = resolver.get(itemId);
            if (type == FeedbackType.LIKE && restaurantId != null) {
                liked.add(restaurantId);
            }
        });

        return new FeedbackSnapshot(meal, restaurant, liked);
    }

    private static Map<Long, FeedbackType> toStates(Map<Long, RecommendationFeedback> latestByItem) {
        Map<Long, FeedbackType> states = new HashMap<>();
        if (latestByItem != null) {
            latestByItem.forEach((itemId, record) -> states.put(itemId, record.getFeedbackType()));
        }
        return states;
    }

    public Optional<FeedbackType> latest(FeedbackItemType itemType, Long itemId) {
        if (itemId == null) {
            return Optional.empty();
        }
        Map<Long, FeedbackType> states = itemType == FeedbackItemType.MEAL ? latestMeal : latestRestaurant;
        return Optional.ofNullable(states.get(itemId));
    }

    public boolean isDisliked(FeedbackItemType itemType, Long itemId) {
        return latest(itemType, itemId).filter(type -> type == FeedbackType.DISLIKE).isPresent();
    }

    public boolean isLiked(FeedbackItemType itemType, Long itemId) {
        return latest(itemType, itemId).filter(type -> type == FeedbackType.LIKE).isPresent();
    }

    public boolean isRestaurantLiked(Long restaurantId) {
        return restaurantId != null && likedRestaurantIds.contains(restaurantId);
    }

    public Set<Long> dislikedMealIds() {
        Set<Long> ids = new HashSet<>();
        latestMeal.forEach((itemId, type) -> {
            if (type == FeedbackType.DISLIKE) {
                ids.add(itemId);
            }
        });
        return ids;
    }

    public boolean isEmpty() {
        return latestMeal.isEmpty() && latestRestaurant.isEmpty();
    }
}
