package com.eatsential.eatsential_api.recommendation.model;

import com.eatsential.eatsential_api.catalog.model.CatalogItem;
import lombok.Builder;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 점수와 설명이 붙은 추천 후보. 파이프라인의 모든 단계가 이 모양만 주고받는다.
 * 식당 추천에서는 itemId == restaurantId 이다.
 */
@Builder(toBuilder = true)
public record Candidate(
        RecommendationTarget target,
        Long itemId,
        Long restaurantId,
        String restaurantName,
        String restaurantPlaceId,
        String name,
        double score,
        String explanation,
        Set<Long> allergenIds,
        BigDecimal price,
        BigDecimal calories,
        Map<String, String> meta
) {

    public static final String META_BOOSTED = "boosted";
    public static final String META_SOURCE = "source";

    public Candidate {
        target = target == null ? RecommendationTarget.MEAL : target;
        score = clamp(score);
        allergenIds = allergenIds == null ? Set.of() : Set.copyOf(allergenIds);
        meta = meta == null ? Map.of() : Map.copyOf(meta);
    }

    public static double clamp(double score) {
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    /**
     * 카탈로그 메뉴로부터 점수 0 인 후보 틀을 만든다.
     */
    public static Candidate fromItem(CatalogItem item) {
        return Candidate.builder()
                .target(RecommendationTarget.MEAL)
                .itemId(item.itemId())
                .restaurantId(item.restaurantId())
                .restaurantName(item.restaurantName())
                .restaurantPlaceId(item.restaurantPlaceId())
                .name(item.name())
                .allergenIds(item.allergenIds())
                .price(item.price())
                .calories(item.calories())
                .build();
    }

    /**
     * 한 식당의 (안전 필터를 통과한) 메뉴들로 식당 후보 틀을 만든다. price 는 평균가.
     */
    public static Candidate fromRestaurant(List<CatalogItem> items) {
        CatalogItem first = items.get(0);
        Set<Long> allergens = new LinkedHashSet<>();
        BigDecimal total = BigDecimal.ZERO;
        int priced = 0;
        for (CatalogItem item : items) {
            allergens.addAll(item.allergenIds());
            if (item.price() != null) {
                total = total.add(item.price());
                priced++;
            }
        }
        BigDecimal average = priced == 0 ? null : total.divide(BigDecimal.valueOf(priced), 2, RoundingMode.HALF_UP);
        return Candidate.builder()
                .target(RecommendationTarget.RESTAURANT)
                .itemId(first.restaurantId())
                .restaurantId(first.restaurantId())
                .restaurantName(first.restaurantName())
                .restaurantPlaceId(first.restaurantPlaceId())
                .name(first.restaurantName())
                .allergenIds(allergens)
                .price(average)
                .build();
    }

    public boolean isBoosted() {
        return meta.containsKey(META_BOOSTED);
    }

    public Candidate withMeta(String key, String value) {
        Map<String, String> copy = new HashMap<>(meta);
        copy.put(Objects.requireNonNull(key), Objects.requireNonNull(value));
        return toBuilder().meta(copy).build();
    }
}
