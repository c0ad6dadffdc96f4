package com.eatsential.eatsential_api.recommendation.generator.baseline;

import com.eatsential.eatsential_api.catalog.entity.PriceTier;
import com.eatsential.eatsential_api.catalog.model.CatalogItem;
import com.eatsential.eatsential_api.recommendation.generator.CandidateGenerator;
import com.eatsential.eatsential_api.recommendation.model.Candidate;
import com.eatsential.eatsential_api.recommendation.model.GenerationContext;
import com.eatsential.eatsential_api.recommendation.model.RecommendationFilters;
import com.eatsential.eatsential_api.recommendation.model.RecommendationMode;
import com.eatsential.eatsential_api.recommendation.model.RecommendationTarget;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 규칙 기반 생성기. 같은 입력이면 항상 같은 순서를 돌려주므로 생성형 실패 시 대체 경로로도 쓴다.
 *
 * <pre>
 * score = 0.5 * diet + 0.3 * cuisine + 0.2 * price
 * </pre>
 * 사용자가 지정하지 않은 항목은 0.5(중립)로 계산한다.
 */
@Component
public class BaselineGenerator implements CandidateGenerator {

    static final double DIET_WEIGHT = 0.5;
    static final double CUISINE_WEIGHT = 0.3;
    static final double PRICE_WEIGHT = 0.2;
    static final double NEUTRAL = 0.5;

    private static final Comparator<Candidate> BY_SCORE_DESC =
            Comparator.comparingDouble(Candidate::score).reversed();

    @Override
    public RecommendationMode mode() {
        return RecommendationMode.BASELINE;
    }

    @Override
    public List<Candidate> generate(GenerationContext context) {
        if (context.target() == RecommendationTarget.RESTAURANT) {
            return generateRestaurants(context.filters(), groupByRestaurant(context.items()));
        }
        return generateMeals(context.filters(), context.items());
    }

    public List<Candidate> generateMeals(RecommendationFilters filters, List<CatalogItem> items) {
        List<Candidate> candidates = new ArrayList<>();
        for (CatalogItem item : items) {
            Profile profile = new Profile(item.dietTags(), item.cuisine(), item.effectivePriceTier());
            if (isExcluded(filters, profile)) {
                continue;
            }
            candidates.add(score(Candidate.fromItem(item), filters, profile));
        }
        // List.sort 는 안정 정렬이라 동점은 카탈로그 순서를 유지한다.
        candidates.sort(BY_SCORE_DESC);
        return candidates;
    }

    public List<Candidate> generateRestaurants(RecommendationFilters filters, Map<Long, List<CatalogItem>> itemsByRestaurant) {
        List<Candidate> candidates = new ArrayList<>();
        for (List<CatalogItem> items : itemsByRestaurant.values()) {
            if (items.isEmpty()) {
                continue;
            }
            Profile profile = restaurantProfile(items);
            if (isExcluded(filters, profile)) {
                continue;
            }
            candidates.add(score(Candidate.fromRestaurant(items), filters, profile));
        }
        candidates.sort(BY_SCORE_DESC);
        return candidates;
    }

    public static Map<Long, List<CatalogItem>> groupByRestaurant(List<CatalogItem> items) {
        Map<Long, List<CatalogItem>> grouped = new LinkedHashMap<>();
        for (CatalogItem item : items) {
            if (item.restaurantId() != null) {
                grouped.computeIfAbsent(item.restaurantId(), id -> new ArrayList<>()).add(item);
            }
        }
        return grouped;
    }

    private Candidate score(Candidate base, RecommendationFilters filters, Profile profile) {
        double diet = dietScore(filters, profile.dietTags());
        double cuisine = cuisineScore(filters, profile.cuisine());
        double price = priceScore(filters, profile.priceTier());
        double total = DIET_WEIGHT * diet + CUISINE_WEIGHT * cuisine + PRICE_WEIGHT * price;
        return base.toBuilder()
                .score(total)
                .explanation(explain(filters, profile, diet, cuisine, price))
                .meta(Map.of(Candidate.META_SOURCE, RecommendationMode.BASELINE.value()))
                .build();
    }

    private boolean isExcluded(RecommendationFilters filters, Profile profile) {
        if (filters.hasCuisines() && profile.cuisine() != null
                && !filters.cuisines().contains(profile.cuisine().toLowerCase(Locale.ROOT))) {
            return true;
        }
        return filters.hasPriceTier() && profile.priceTier() != null
                && profile.priceTier().distanceTo(filters.priceTier()) > 1;
    }

    double dietScore(RecommendationFilters filters, Set<String> dietTags) {
        if (!filters.hasDiets()) {
            return NEUTRAL;
        }
        if (dietTags.isEmpty()) {
            return 0.0;
        }
        long matched = dietTags.stream().filter(filters.diets()::contains).count();
        return (double) matched / dietTags.size();
    }

    double cuisineScore(RecommendationFilters filters, String cuisine) {
        if (!filters.hasCuisines()) {
            return NEUTRAL;
        }
        if (cuisine == null) {
            return 0.0;
        }
        return filters.cuisines().contains(cuisine.toLowerCase(Locale.ROOT)) ? 1.0 : 0.0;
    }

    double priceScore(RecommendationFilters filters, PriceTier tier) {
        if (!filters.hasPriceTier()) {
            return NEUTRAL;
        }
        if (tier == null) {
            return 0.0;
        }
        return switch (tier.distanceTo(filters.priceTier())) {
            case 0 -> 1.0;
            case 1 -> 0.5;
            default -> 0.0;
        };
    }

    private String explain(RecommendationFilters filters, Profile profile, double diet, double cuisine, double price) {
        List<String> reasons = new ArrayList<>();
        if (filters.hasDiets() && diet > 0) {
            List<String> matched = profile.dietTags().stream()
                    .filter(filters.diets()::contains)
                    .sorted()
                    .toList();
            reasons.add("fits your " + String.join(", ", matched) + " diet");
        }
        if (filters.hasCuisines() && cuisine > 0) {
            reasons.add(profile.cuisine() + " cuisine");
        }
        if (filters.hasPriceTier() && price > 0) {
            reasons.add(price >= 1.0
                    ? "in your " + filters.priceTier().symbol() + " price range"
                    : "close to your " + filters.priceTier().symbol() + " price range");
        }
        if (reasons.isEmpty()) {
            return "Popular pick that matches your safety profile";
        }
        String joined = String.join("; ", reasons);
        return Character.toUpperCase(joined.charAt(0)) + joined.substring(1);
    }

    private Profile restaurantProfile(List<CatalogItem> items) {
        Set<String> tags = new LinkedHashSet<>();
        items.forEach(item -> tags.addAll(item.dietTags()));
        CatalogItem first = items.get(0);
        PriceTier tier = first.restaurantPriceTier();
        if (tier == null) {
            tier = PriceTier.fromPrice(Candidate.fromRestaurant(items).price());
        }
        return new Profile(tags, first.cuisine(), tier);
    }

    // 점수 계산에 쓰는 메뉴/식당 공통 특성
    private record Profile(Set<String> dietTags, String cuisine, PriceTier priceTier) {
    }
}
