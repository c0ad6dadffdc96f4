package com.eatsential.eatsential_api.recommendation.service.serviceImpl;

import com.eatsential.eatsential_api.catalog.entity.PriceTier;
import com.eatsential.eatsential_api.catalog.model.CatalogItem;
import com.eatsential.eatsential_api.catalog.service.MenuCatalogService;
import com.eatsential.eatsential_api.feedback.entity.FeedbackItemType;
import com.eatsential.eatsential_api.feedback.entity.FeedbackType;
import com.eatsential.eatsential_api.feedback.entity.RecommendationFeedback;
import com.eatsential.eatsential_api.feedback.model.FeedbackSnapshot;
import com.eatsential.eatsential_api.feedback.service.FeedbackService;
import com.eatsential.eatsential_api.global.error.api.ApiException;
import com.eatsential.eatsential_api.profile.model.UserHealthContext;
import com.eatsential.eatsential_api.profile.service.HealthProfileReader;
import com.eatsential.eatsential_api.recommendation.config.RecommendationProperties;
import com.eatsential.eatsential_api.recommendation.dto.request.RecommendationFiltersRequest;
import com.eatsential.eatsential_api.recommendation.dto.request.RecommendationRequest;
import com.eatsential.eatsential_api.recommendation.dto.response.RecommendationResponse;
import com.eatsential.eatsential_api.recommendation.dto.response.RecommendedItemResponse;
import com.eatsential.eatsential_api.recommendation.error.RecommendationErrorCode;
import com.eatsential.eatsential_api.recommendation.generator.CandidateGenerator;
import com.eatsential.eatsential_api.recommendation.generator.CandidateGeneratorRegistry;
import com.eatsential.eatsential_api.recommendation.generator.GenerationFailedException;
import com.eatsential.eatsential_api.recommendation.generator.GenerationFailedException.Reason;
import com.eatsential.eatsential_api.recommendation.generator.baseline.BaselineGenerator;
import com.eatsential.eatsential_api.recommendation.model.Candidate;
import com.eatsential.eatsential_api.recommendation.model.GenerationContext;
import com.eatsential.eatsential_api.recommendation.model.RecommendationMode;
import com.eatsential.eatsential_api.recommendation.ranking.DiversitySelector;
import com.eatsential.eatsential_api.recommendation.ranking.FeedbackAdjuster;
import com.eatsential.eatsential_api.recommendation.safety.SafetyFilter;
import com.eatsential.eatsential_api.recommendation.validation.RecommendationRequestValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.eatsential.eatsential_api.support.CatalogFixtures.item;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

// 저장소/생성형 생성기만 목으로 두고 나머지 파이프라인은 실제 구현으로 돌린다.
@ExtendWith(MockitoExtension.class)
class RecommendationServiceImplTest {

    private static final Long MEMBER_ID = 1L;
    private static final long PEANUT = 7L;

    @Mock
    private HealthProfileReader healthProfileReader;

    @Mock
    private MenuCatalogService menuCatalogService;

    @Mock
    private FeedbackService feedbackService;

    @Mock
    private CandidateGenerator generativeGenerator;

    private RecommendationServiceImpl service;

    private final List<CatalogItem> catalog = List.of(
            item(1L, 10L, "Peanut Noodles", "thai", PriceTier.TWO, Set.of(PEANUT), Set.of("vegan")),
            item(2L, 10L, "Tofu Curry", "thai", PriceTier.TWO, Set.of(), Set.of("vegan")),
            item(3L, 10L, "Green Papaya Salad", "thai", PriceTier.TWO, Set.of(), Set.of("vegan")),
            item(4L, 20L, "Margherita Pizza", "italian", PriceTier.TWO, Set.of(), Set.of("vegetarian")),
            item(5L, 20L, "Vegan Lasagna", "italian", PriceTier.THREE, Set.of(), Set.of("vegan")),
            item(6L, 30L, "Falafel Plate", "mediterranean", PriceTier.ONE, Set.of(), Set.of("vegan")),
            item(7L, 40L, "Satay Skewers", "thai", PriceTier.TWO, Set.of(PEANUT), Set.of())
    );

    @BeforeEach
    void setUp() {
        when(generativeGenerator.mode()).thenReturn(RecommendationMode.LLM);
        RecommendationProperties properties = RecommendationProperties.defaults();
        service = new RecommendationServiceImpl(
                new RecommendationRequestValidator(),
                healthProfileReader,
                menuCatalogService,
                feedbackService,
                new SafetyFilter(),
                new CandidateGeneratorRegistry(List.of(new BaselineGenerator(), generativeGenerator)),
                new FeedbackAdjuster(properties),
                new DiversitySelector(),
                properties
        );
    }

    private void givenInputs(FeedbackSnapshot snapshot) {
        when(healthProfileReader.read(MEMBER_ID)).thenReturn(new UserHealthContext(
                MEMBER_ID, Set.of(PEANUT), Set.of("peanut"), Set.of(), Set.of()));
        when(menuCatalogService.loadActiveItems()).thenReturn(catalog);
        when(feedbackService.snapshot(eq(MEMBER_ID), anyMap())).thenReturn(snapshot);
    }

    private RecommendationRequest request(String mode) {
        return new RecommendationRequest(mode, new RecommendationFiltersRequest(List.of("vegan"), List.of("thai"), "$$"));
    }

    private List<Long> itemIds(RecommendationResponse response) {
        return response.items().stream().map(RecommendedItemResponse::itemId).toList();
    }

    @Test
    void generativeTimeoutFallsBackToBaselineResult() {
        // given
        givenInputs(FeedbackSnapshot.empty());
        when(generativeGenerator.generate(any())).thenThrow(new GenerationFailedException(Reason.TIMEOUT, "timed out"));

        // when
        RecommendationResponse fallback = service.recommendMeals(MEMBER_ID, request("llm"));
        RecommendationResponse baseline = service.recommendMeals(MEMBER_ID, request("baseline"));

        // then: 기본 모드로 직접 요청한 결과와 같은 목록, fallback 표시만 다르다.
        assertThat(fallback.fallback()).isTrue();
        assertThat(fallback.source()).isEqualTo("BASELINE");
        assertThat(baseline.fallback()).isFalse();
        assertThat(fallback.items()).isEqualTo(baseline.items());
        assertThat(fallback.items()).isNotEmpty();
    }

    @Test
    void unexpectedGeneratorErrorAlsoFallsBack() {
        givenInputs(FeedbackSnapshot.empty());
        when(generativeGenerator.generate(any())).thenThrow(new IllegalStateException("boom"));

        RecommendationResponse response = service.recommendMeals(MEMBER_ID, request(null));

        assertThat(response.fallback()).isTrue();
        assertThat(response.source()).isEqualTo("BASELINE");
    }

    @Test
    void generativeSuccessIsReportedAsLlm() {
        // given
        givenInputs(FeedbackSnapshot.empty());
        when(generativeGenerator.generate(any())).thenReturn(List.of(
                Candidate.fromItem(catalog.get(5)).toBuilder().score(0.9).explanation("Light and vegan").build(),
                Candidate.fromItem(catalog.get(1)).toBuilder().score(0.8).explanation("Warm curry").build()
        ));

        // when
        RecommendationResponse response = service.recommendMeals(MEMBER_ID, request("llm"));

        // then
        assertThat(response.source()).isEqualTo("LLM");
        assertThat(response.fallback()).isFalse();
        assertThat(itemIds(response)).containsExactly(6L, 2L);
    }

    @Test
    void allergenItemsNeverReachGeneratorOrResponse() {
        // given: 생성형 응답이 알레르기 성분을 달고 돌아온 경우도 재검증에서 걸러진다.
        givenInputs(FeedbackSnapshot.empty());
        when(generativeGenerator.generate(any())).thenReturn(List.of(
                Candidate.fromItem(catalog.get(1)).toBuilder().score(0.9).allergenIds(Set.of(PEANUT)).build(),
                Candidate.fromItem(catalog.get(2)).toBuilder().score(0.8).build()
        ));

        // when
        RecommendationResponse response = service.recommendMeals(MEMBER_ID, request("llm"));

        // then
        ArgumentCaptor<GenerationContext> captor = ArgumentCaptor.forClass(GenerationContext.class);
        verify(generativeGenerator).generate(captor.capture());
        assertThat(captor.getValue().items()).extracting(CatalogItem::itemId).doesNotContain(1L, 7L);
        assertThat(itemIds(response)).containsExactly(3L);
    }

    @Test
    void baselineModeNeverCallsGenerativeAndIsDeterministic() {
        givenInputs(FeedbackSnapshot.empty());

        RecommendationResponse first = service.recommendMeals(MEMBER_ID, request("baseline"));
        RecommendationResponse second = service.recommendMeals(MEMBER_ID, request("baseline"));

        assertThat(first).isEqualTo(second);
        assertThat(first.source()).isEqualTo("BASELINE");
        assertThat(itemIds(first)).doesNotContain(1L, 7L);
        verify(generativeGenerator, never()).generate(any());
    }

    @Test
    void dislikedMealAndRestaurantAreExcluded() {
        // given: 2번 메뉴 싫어요, 30번 식당 싫어요
        Instant now = Instant.parse("2026-01-01T00:00:00Z");
        FeedbackSnapshot snapshot = FeedbackSnapshot.of(List.of(
                feedback(1L, 2L, FeedbackItemType.MEAL, FeedbackType.DISLIKE, now),
                feedback(2L, 30L, FeedbackItemType.RESTAURANT, FeedbackType.DISLIKE, now)
        ), Map.of());
        givenInputs(snapshot);

        // when
        RecommendationResponse response = service.recommendMeals(MEMBER_ID, new RecommendationRequest("baseline", null));

        // then
        assertThat(itemIds(response)).doesNotContain(2L, 6L).isNotEmpty();
    }

    @Test
    void restaurantModeReturnsEachRestaurantOnce() {
        givenInputs(FeedbackSnapshot.empty());

        RecommendationResponse response = service.recommendRestaurants(MEMBER_ID, new RecommendationRequest("baseline", null));

        // 40번 식당은 안전한 메뉴가 없어 제외된다.
        assertThat(itemIds(response)).doesNotHaveDuplicates().containsExactlyInAnyOrder(10L, 20L, 30L);
    }

    @Test
    void cuisineFilterNarrowsBaselineResult() {
        givenInputs(FeedbackSnapshot.empty());

        RecommendationResponse response = service.recommendMeals(MEMBER_ID, request("baseline"));

        // thai 이외 요리는 제외되고 알레르기 메뉴(1, 7)도 빠진다.
        assertThat(itemIds(response)).containsExactlyInAnyOrder(2L, 3L);
        assertThat(response.items()).allSatisfy(item -> assertThat(item.explanation()).contains("vegan"));
    }

    @Test
    void emptyEligibleSetReturnsEmptyWithoutGenerating() {
        // given: 활성 식당 메뉴가 하나도 없음
        when(healthProfileReader.read(MEMBER_ID)).thenReturn(UserHealthContext.empty(MEMBER_ID));
        when(menuCatalogService.loadActiveItems()).thenReturn(List.of());
        when(feedbackService.snapshot(eq(MEMBER_ID), anyMap())).thenReturn(FeedbackSnapshot.empty());

        // when
        RecommendationResponse response = service.recommendMeals(MEMBER_ID, request("llm"));

        // then
        assertThat(response.items()).isEmpty();
        assertThat(response.source()).isEqualTo("LLM");
        assertThat(response.fallback()).isFalse();
        verify(generativeGenerator, never()).generate(any());
    }

    @Test
    void catalogFailureIsCatalogUnavailable() {
        when(healthProfileReader.read(MEMBER_ID)).thenReturn(UserHealthContext.empty(MEMBER_ID));
        when(menuCatalogService.loadActiveItems()).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThatThrownBy(() -> service.recommendMeals(MEMBER_ID, request("baseline")))
                .isInstanceOfSatisfying(ApiException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(RecommendationErrorCode.CATALOG_UNAVAILABLE));
        verifyNoInteractions(feedbackService);
    }

    @Test
    void invalidFilterIsRejectedBeforeAnyRead() {
        RecommendationRequest invalid = new RecommendationRequest("llm",
                new RecommendationFiltersRequest(List.of("vegan"), List.of(), "$$$$$"));

        assertThatThrownBy(() -> service.recommendMeals(MEMBER_ID, invalid))
                .isInstanceOfSatisfying(ApiException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(RecommendationErrorCode.INVALID_FILTER));
        verifyNoInteractions(healthProfileReader, menuCatalogService, feedbackService);
    }

    private RecommendationFeedback feedback(Long id, Long itemId, FeedbackItemType itemType, FeedbackType type, Instant at) {
        return RecommendationFeedback.builder()
                .id(id)
                .memberId(MEMBER_ID)
                .itemId(itemId)
                .itemType(itemType)
                .feedbackType(type)
                .createdAt(at)
                .build();
    }
}
