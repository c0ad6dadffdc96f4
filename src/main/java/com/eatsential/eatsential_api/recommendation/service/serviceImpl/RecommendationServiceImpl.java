package com.eatsential.eatsential_api.recommendation.service.serviceImpl;

import com.eatsential.eatsential_api.catalog.model.CatalogItem;
import com.eatsential.eatsential_api.catalog.service.MenuCatalogService;
import com.eatsential.eatsential_api.feedback.entity.FeedbackItemType;
import com.eatsential.eatsential_api.feedback.model.FeedbackSnapshot;
import com.eatsential.eatsential_api.feedback.service.FeedbackService;
import com.eatsential.eatsential_api.global.error.api.ApiException;
import com.eatsential.eatsential_api.global.logging.RequestMetricsContext;
import com.eatsential.eatsential_api.profile.model.UserHealthContext;
import com.eatsential.eatsential_api.profile.service.HealthProfileReader;
import com.eatsential.eatsential_api.recommendation.config.RecommendationProperties;
import com.eatsential.eatsential_api.recommendation.dto.request.RecommendationRequest;
import com.eatsential.eatsential_api.recommendation.dto.response.RecommendationResponse;
import com.eatsential.eatsential_api.recommendation.dto.response.RecommendedItemResponse;
import com.eatsential.eatsential_api.recommendation.error.RecommendationErrorCode;
import com.eatsential.eatsential_api.recommendation.generator.CandidateGeneratorRegistry;
import com.eatsential.eatsential_api.recommendation.generator.GenerationFailedException;
import com.eatsential.eatsential_api.recommendation.model.Candidate;
import com.eatsential.eatsential_api.recommendation.model.GenerationContext;
import com.eatsential.eatsential_api.recommendation.model.RecommendationMode;
import com.eatsential.eatsential_api.recommendation.model.RecommendationTarget;
import com.eatsential.eatsential_api.recommendation.ranking.DiversitySelector;
import com.eatsential.eatsential_api.recommendation.ranking.FeedbackAdjuster;
import com.eatsential.eatsential_api.recommendation.safety.SafetyFilter;
import com.eatsential.eatsential_api.recommendation.service.RecommendationService;
import com.eatsential.eatsential_api.recommendation.validation.RecommendationRequestValidator;
import com.eatsential.eatsential_api.recommendation.validation.RecommendationRequestValidator.ValidatedRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 추천 오케스트레이터.
 * 입력 스냅샷 -> 안전 필터 -> 생성기(생성형 실패 시 기본 생성기) -> 안전 필터 재적용 -> 피드백 반영 -> 다양성 선택
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecommendationServiceImpl implements RecommendationService {

    private final RecommendationRequestValidator requestValidator;
    private final HealthProfileReader healthProfileReader;
    private final MenuCatalogService menuCatalogService;
    private final FeedbackService feedbackService;
    private final SafetyFilter safetyFilter;
    private final CandidateGeneratorRegistry generatorRegistry;
    private final FeedbackAdjuster feedbackAdjuster;
    private final DiversitySelector diversitySelector;
    private final RecommendationProperties properties;

    @Override
    public RecommendationResponse recommendMeals(Long memberId, RecommendationRequest request) {
        return recommend(memberId, request, RecommendationTarget.MEAL);
    }

    @Override
    public RecommendationResponse recommendRestaurants(Long memberId, RecommendationRequest request) {
        return recommend(memberId, request, RecommendationTarget.RESTAURANT);
    }

    private RecommendationResponse recommend(Long memberId, RecommendationRequest request, RecommendationTarget target) {
        ValidatedRequest validated = requestValidator.validate(request);

        // 1) 요청 시작 시점 입력 스냅샷 (이후 들어온 피드백은 이번 추천에 반영되지 않는다)
        UserHealthContext health = readHealth(memberId);
        List<CatalogItem> catalog = loadCatalog();
        FeedbackSnapshot feedback = feedbackService.snapshot(memberId, restaurantIndex(catalog));

        // 2) 생성 전 안전 필터 + 싫어요 항목 제외
        List<CatalogItem> eligible = excludeDisliked(safetyFilter.filterItems(catalog, health), feedback, target);
        if (eligible.isEmpty()) {
            log.info("[Recommend] no eligible items. memberId={}, target={}, catalogSize={}",
                    memberId, target, catalog.size());
            return toResponse(List.of(), validated.mode(), false);
        }

        // 3) 생성
        GenerationContext context = new GenerationContext(target, health, validated.filters(), eligible);
        Generation generation = generate(memberId, validated.mode(), context);

        // 4) 후처리: 안전 필터 재검증 -> 피드백 -> 다양성
        List<Candidate> safe = safetyFilter.filter(generation.candidates(), health.allergenIds());
        List<Candidate> adjusted = feedbackAdjuster.adjust(safe, feedback);
        int perRestaurant = target == RecommendationTarget.RESTAURANT ? 1 : properties.maxSameRestaurant();
        List<Candidate> selected = diversitySelector.select(adjusted, properties.limit(), perRestaurant);

        log.info("[Recommend] done. memberId={}, target={}, mode={}, source={}, fallback={}, generated={}, returned={}",
                memberId, target, validated.mode(), generation.source(), generation.fallback(),
                generation.candidates().size(), selected.size());
        return toResponse(selected, generation.source(), generation.fallback());
    }

    private Generation generate(Long memberId, RecommendationMode mode, GenerationContext context) {
        long startNs = System.nanoTime();
        Generation generation;
        if (mode == RecommendationMode.BASELINE) {
            generation = new Generation(generatorRegistry.get(RecommendationMode.BASELINE).generate(context),
                    RecommendationMode.BASELINE, false);
        } else {
            generation = generateWithFallback(memberId, mode, context);
        }
        RequestMetricsContext.recordGeneration(
                generation.source().name(),
                generation.fallback(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs)
        );
        return generation;
    }

    private Generation generateWithFallback(Long memberId, RecommendationMode mode, GenerationContext context) {
        try {
            return new Generation(generatorRegistry.get(mode).generate(context), mode, false);
        } catch (GenerationFailedException e) {
            log.warn("[Recommend] generative failed, falling back to baseline. memberId={}, reason={}, message={}",
                    memberId, e.getReason(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("[Recommend] unexpected generative error, falling back to baseline. memberId={}", memberId, e);
        }
        return new Generation(generatorRegistry.get(RecommendationMode.BASELINE).generate(context),
                RecommendationMode.BASELINE, true);
    }

    private UserHealthContext readHealth(Long memberId) {
        try {
            return healthProfileReader.read(memberId);
        } catch (DataAccessException e) {
            throw new ApiException(RecommendationErrorCode.CATALOG_UNAVAILABLE, "health profile store unavailable", e);
        }
    }

    private List<CatalogItem> loadCatalog() {
        try {
            return menuCatalogService.loadActiveItems();
        } catch (DataAccessException e) {
            throw new ApiException(RecommendationErrorCode.CATALOG_UNAVAILABLE, "menu catalog unavailable", e);
        }
    }

    private Map<Long, Long> restaurantIndex(List<CatalogItem> catalog) {
        Map<Long, Long> index = new HashMap<>();
        for (CatalogItem item : catalog) {
            if (item.itemId() != null && item.restaurantId() != null) {
                index.put(item.itemId(), item.restaurantId());
            }
        }
        return index;
    }

    private List<CatalogItem> excludeDisliked(List<CatalogItem> items, FeedbackSnapshot feedback, RecommendationTarget target) {
        if (feedback.isEmpty()) {
            return items;
        }
        return items.stream()
                .filter(item -> !feedback.isDisliked(FeedbackItemType.RESTAURANT, item.restaurantId()))
                .filter(item -> target != RecommendationTarget.MEAL
                        || !feedback.isDisliked(FeedbackItemType.MEAL, item.itemId()))
                .toList();
    }

    private RecommendationResponse toResponse(List<Candidate> candidates, RecommendationMode source, boolean fallback) {
        List<RecommendedItemResponse> items = candidates.stream()
                .map(RecommendedItemResponse::from)
                .toList();
        return new RecommendationResponse(items, source.name(), fallback);
    }

    private record Generation(List<Candidate> candidates, RecommendationMode source, boolean fallback) {
    }
}
