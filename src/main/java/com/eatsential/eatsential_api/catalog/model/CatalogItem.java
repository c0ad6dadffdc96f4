package com.eatsential.eatsential_api.catalog.model;

import com.eatsential.eatsential_api.catalog.entity.Allergen;
import com.eatsential.eatsential_api.catalog.entity.MenuItem;
import com.eatsential.eatsential_api.catalog.entity.PriceTier;
import com.eatsential.eatsential_api.catalog.entity.Restaurant;
import lombok.Builder;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 한 요청 동안 변하지 않는 메뉴 스냅샷. 엔티티(지연 로딩)를 추천 파이프라인 밖에 둔다.
 */
@Builder
public record CatalogItem(
        Long itemId,
        Long restaurantId,
        String restaurantName,
        String restaurantPlaceId,
        String cuisine,
        PriceTier restaurantPriceTier,
        String name,
        String description,
        BigDecimal price,
        BigDecimal calories,
        BigDecimal proteinG,
        BigDecimal carbsG,
        BigDecimal fatG,
        Set<Long> allergenIds,
        Set<String> dietTags
) {

    public CatalogItem {
        allergenIds = allergenIds == null ? Set.of() : Set.copyOf(allergenIds);
        dietTags = dietTags == null ? Set.of() : dietTags.stream()
                .filter(tag -> tag != null && !tag.isBlank())
                .map(tag -> tag.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public static CatalogItem from(MenuItem menuItem) {
        Restaurant restaurant = menuItem.getRestaurant();
        return CatalogItem.builder()
                .itemId(menuItem.getId())
                .restaurantId(restaurant.getId())
                .restaurantName(restaurant.getName())
                .restaurantPlaceId(restaurant.getPlaceId())
                .cuisine(restaurant.getCuisine())
                .restaurantPriceTier(restaurant.getPriceTier())
                .name(menuItem.getName())
                .description(menuItem.getDescription())
                .price(menuItem.getPrice())
                .calories(menuItem.getCalories())
                .proteinG(menuItem.getProteinG())
                .carbsG(menuItem.getCarbsG())
                .fatG(menuItem.getFatG())
                .allergenIds(menuItem.getAllergens().stream().map(Allergen::getId).collect(Collectors.toSet()))
                .dietTags(menuItem.getDietTags())
                .build();
    }

    /**
     * 식당 가격대가 없으면 메뉴 가격으로 추정한다. 둘 다 없으면 null.
     */
    public PriceTier effectivePriceTier() {
        return restaurantPriceTier != null ? restaurantPriceTier : PriceTier.fromPrice(price);
    }

    // 이름 + 설명, 소문자. 텍스트 기반 안전 검사용
    public String searchableText() {
        String text = (name == null ? "" : name) + " " + (description == null ? "" : description);
        return text.toLowerCase(Locale.ROOT);
    }
}
