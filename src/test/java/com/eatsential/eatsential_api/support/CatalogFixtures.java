package com.eatsential.eatsential_api.support;

import com.eatsential.eatsential_api.catalog.entity.PriceTier;
import com.eatsential.eatsential_api.catalog.model.CatalogItem;

import java.math.BigDecimal;
import java.util.Set;

// 테스트용 카탈로그 메뉴 생성 도우미
public final class CatalogFixtures {

    private CatalogFixtures() {
    }

    public static CatalogItem item(long itemId, long restaurantId, String name) {
        return item(itemId, restaurantId, name, null, null, Set.of(), Set.of());
    }

    public static CatalogItem item(
            long itemId,
            long restaurantId,
            String name,
            String cuisine,
            PriceTier tier,
            Set<Long> allergenIds,
            Set<String> dietTags
    ) {
        return CatalogItem.builder()
                .itemId(itemId)
                .restaurantId(restaurantId)
                .restaurantName("Restaurant " + restaurantId)
                .restaurantPlaceId("place-" + restaurantId)
                .cuisine(cuisine)
                .restaurantPriceTier(tier)
                .name(name)
                .description(null)
                .price(new BigDecimal("12.50"))
                .calories(new BigDecimal("540"))
                .allergenIds(allergenIds)
                .dietTags(dietTags)
                .build();
    }
}
