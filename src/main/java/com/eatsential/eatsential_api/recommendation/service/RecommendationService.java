package com.eatsential.eatsential_api.recommendation.service;

import com.eatsential.eatsential_api.recommendation.dto.request.RecommendationRequest;
import com.eatsential.eatsential_api.recommendation.dto.response.RecommendationResponse;

public interface RecommendationService {

    RecommendationResponse recommendMeals(Long memberId, RecommendationRequest request);

    RecommendationResponse recommendRestaurants(Long memberId, RecommendationRequest request);
}
