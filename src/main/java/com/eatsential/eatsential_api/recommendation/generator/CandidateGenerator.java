package com.eatsential.eatsential_api.recommendation.generator;

import com.eatsential.eatsential_api.recommendation.model.Candidate;
import com.eatsential.eatsential_api.recommendation.model.GenerationContext;
import com.eatsential.eatsential_api.recommendation.model.RecommendationMode;

import java.util.List;

/**
 * Strategy: 추천 모드별 후보 생성기.
 * 반환 목록은 점수 내림차순이며 동점은 생성기 고유 순서를 유지한다.
 */
public interface CandidateGenerator {

    RecommendationMode mode();

    /**
     * @throws GenerationFailedException 후보를 만들 수 없을 때 (생성형만 해당)
     */
    List<Candidate> generate(GenerationContext context);
}
