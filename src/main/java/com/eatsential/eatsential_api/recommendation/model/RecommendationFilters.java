package com.eatsential.eatsential_api.recommendation.model;

import com.eatsential.eatsential_api.catalog.entity.PriceTier;

import java.util.Set;

/**
 * 검증을 통과한 추천 필터. diets/cuisines 는 소문자로 정규화되어 있다.
 */
public record RecommendationFilters(
        Set<String> diets,
        Set<String> cuisines,
        PriceTier priceTier
) {

    private static final RecommendationFilters NONE = new RecommendationFilters(Set.of(), Set.of(), null);

    public RecommendationFilters {
        diets = diets == null ? Set.of() : Set.copyOf(diets);
        cuisines = cuisines == null ? Set.of() : Set.copyOf(cuisines);
    }

    public static RecommendationFilters none() {
        return NONE;
    }

    public boolean hasDiets() {
        return !diets.isEmpty();
    }

    public boolean hasCuisines() {
        return !cuisines.isEmpty();
    }

    public boolean hasPriceTier() {
        return priceTier != null;
    }
}
