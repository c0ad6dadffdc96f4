package com.eatsential.eatsential_api.recommendation.validation;

import com.eatsential.eatsential_api.catalog.entity.PriceTier;
import com.eatsential.eatsential_api.global.error.api.ApiException;
import com.eatsential.eatsential_api.global.error.api.FieldErrorData;
import com.eatsential.eatsential_api.recommendation.dto.request.RecommendationFiltersRequest;
import com.eatsential.eatsential_api.recommendation.dto.request.RecommendationRequest;
import com.eatsential.eatsential_api.recommendation.error.RecommendationErrorCode;
import com.eatsential.eatsential_api.recommendation.model.RecommendationFilters;
import com.eatsential.eatsential_api.recommendation.model.RecommendationMode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 요청 DTO 를 검증하고 내부 필터 모델로 바꾼다. 잘못된 값은 모아서 INVALID_FILTER 한 번으로 알린다.
 */
@Component
public class RecommendationRequestValidator {

    private static final int MAX_VALUE_LENGTH = 50;
    private static final Pattern VALUE_PATTERN = Pattern.compile("[\\p{L}\\p{N} _'&-]+");

    public ValidatedRequest validate(RecommendationRequest request) {
        List<FieldErrorData> errors = new ArrayList<>();

        RecommendationMode mode = RecommendationMode.LLM;
        if (request != null && request.mode() != null) {
            mode = RecommendationMode.fromValue(request.mode()).orElse(null);
            if (mode == null) {
                errors.add(new FieldErrorData("mode", "llm 또는 baseline 이어야 합니다."));
            }
        }

        RecommendationFiltersRequest filters = request == null ? null : request.filters();
        Set<String> diets = normalize("filters.diet", filters == null ? null : filters.diet(), errors);
        Set<String> cuisines = normalize("filters.cuisine", filters == null ? null : filters.cuisine(), errors);

        PriceTier priceTier = null;
        String priceRange = filters == null ? null : filters.priceRange();
        if (priceRange != null && !priceRange.isBlank()) {
            priceTier = PriceTier.fromSymbol(priceRange).orElse(null);
            if (priceTier == null) {
                errors.add(new FieldErrorData("filters.price_range", "$, $$, $$$, $$$$ 중 하나여야 합니다."));
            }
        }

        if (!errors.isEmpty()) {
            throw new ApiException(RecommendationErrorCode.INVALID_FILTER, errors);
        }
        return new ValidatedRequest(mode, new RecommendationFilters(diets, cuisines, priceTier));
    }

    private Set<String> normalize(String field, List<String> values, List<FieldErrorData> errors) {
        Set<String> normalized = new LinkedHashSet<>();
        if (values == null) {
            return normalized;
        }
        for (String value : values) {
            if (value == null || value.isBlank()) {
                errors.add(new FieldErrorData(field, "빈 값은 허용되지 않습니다."));
                continue;
            }
            String trimmed = value.trim();
            if (trimmed.length() > MAX_VALUE_LENGTH || !VALUE_PATTERN.matcher(trimmed).matches()) {
                errors.add(new FieldErrorData(field, "허용되지 않는 값입니다: " + abbreviate(trimmed)));
                continue;
            }
            normalized.add(trimmed.toLowerCase(Locale.ROOT));
        }
        return normalized;
    }

    private String abbreviate(String value) {
        return value.length() <= MAX_VALUE_LENGTH ? value : value.substring(0, MAX_VALUE_LENGTH) + "...";
    }

    public record ValidatedRequest(RecommendationMode mode, RecommendationFilters filters) {
    }
}
