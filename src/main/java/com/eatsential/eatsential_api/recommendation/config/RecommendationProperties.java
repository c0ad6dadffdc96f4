package com.eatsential.eatsential_api.recommendation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 추천 정책 상수. 기본값은 운영 합의 전 잠정치다.
 */
@ConfigurationProperties(prefix = "recommendation")
public record RecommendationProperties(
        Integer limit,
        Integer maxSameRestaurant,
        Double likeBoost,
        Integer maxGenerativeCandidates
) {

    public RecommendationProperties {
        if (limit == null || limit <= 0) {
            limit = 10;
        }
        if (maxSameRestaurant == null || maxSameRestaurant <= 0) {
            maxSameRestaurant = 2;
        }
        if (likeBoost == null || likeBoost < 1.0) {
            likeBoost = 1.2;
        }
        if (maxGenerativeCandidates == null || maxGenerativeCandidates <= 0) {
            maxGenerativeCandidates = 100;
        }
    }

    public static RecommendationProperties defaults() {
        return new RecommendationProperties(null, null, null, null);
    }
}
