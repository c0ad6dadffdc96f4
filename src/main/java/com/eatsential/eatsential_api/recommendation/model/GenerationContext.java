package com.eatsential.eatsential_api.recommendation.model;

import com.eatsential.eatsential_api.catalog.model.CatalogItem;
import com.eatsential.eatsential_api.profile.model.UserHealthContext;

import java.util.List;

/**
 * 생성기 입력. items 는 이미 안전 필터와 싫어요 제외를 거친 카탈로그다.
 */
public record GenerationContext(
        RecommendationTarget target,
        UserHealthContext health,
        RecommendationFilters filters,
        List<CatalogItem> items
) {

    public GenerationContext {
        items = items == null ? List.of() : List.copyOf(items);
        filters = filters == null ? RecommendationFilters.none() : filters;
    }

}
