package com.eatsential.eatsential_api.catalog.entity;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Optional;

/**
 * 식당 가격대. 메뉴 가격으로부터 추정할 때는 1인 기준 USD 구간을 사용한다.
 * ($ ~10, $$ 10~25, $$$ 25~45, $$$$ 45~)
 */
public enum PriceTier {

    ONE("$", new BigDecimal("10")),
    TWO("$$", new BigDecimal("25")),
    THREE("$$$", new BigDecimal("45")),
    FOUR("$$$$", null);

    private final String symbol;
    private final BigDecimal upperBound;

    PriceTier(String symbol, BigDecimal upperBound) {
        this.symbol = symbol;
        this.upperBound = upperBound;
    }

    public String symbol() {
        return symbol;
    }

    public int distanceTo(PriceTier other) {
        return Math.abs(ordinal() - other.ordinal());
    }

    public static Optional<PriceTier> fromSymbol(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        String trimmed = symbol.trim();
        return Arrays.stream(values())
                .filter(tier -> tier.symbol.equals(trimmed))
                .findFirst();
    }

    public static PriceTier fromPrice(BigDecimal price) {
        if (price == null) {
            return null;
        }
        for (PriceTier tier : values()) {
            if (tier.upperBound == null || price.compareTo(tier.upperBound) < 0) {
                return tier;
            }
        }
        return FOUR;
    }
}
