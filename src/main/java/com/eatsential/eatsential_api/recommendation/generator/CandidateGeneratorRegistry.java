package com.eatsential.eatsential_api.recommendation.generator;

import com.eatsential.eatsential_api.recommendation.model.RecommendationMode;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Registry 역할: RecommendationMode -> CandidateGenerator 매핑.
 * 생성기 구현체(@Component)를 추가하면 자동 등록된다.
 */
@Component
public final class CandidateGeneratorRegistry {

	private final Map<RecommendationMode, CandidateGenerator> generators;

	public CandidateGeneratorRegistry(List<CandidateGenerator> generators) {
		Map<RecommendationMode, CandidateGenerator> map = new EnumMap<>(RecommendationMode.class);
		for (CandidateGenerator generator : generators) {
			RecommendationMode mode = generator.mode();
			if (map.containsKey(mode)) {
				throw new IllegalStateException("Duplicate CandidateGenerator for mode: " + mode);
			}
			map.put(mode, generator);
		}
		this.generators = Map.copyOf(map);
	}

	public CandidateGenerator get(RecommendationMode mode) {
		return find(mode)
			.orElseThrow(() -> new IllegalArgumentException("Unsupported recommendation mode: " + mode));
	}

	public Optional<CandidateGenerator> find(RecommendationMode mode) {
		if (mode == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(generators.get(mode));
	}
}
