package com.eatsential.eatsential_api.recommendation.generator.generative;

import com.eatsential.eatsential_api.profile.model.UserHealthContext;
import com.eatsential.eatsential_api.recommendation.model.Candidate;
import com.eatsential.eatsential_api.recommendation.model.RecommendationFilters;
import com.eatsential.eatsential_api.recommendation.model.RecommendationTarget;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

@Component
@RequiredArgsConstructor
public class GenerativePromptBuilder {

    private static final String INSTRUCTION = """
            You rank %s for a user with dietary restrictions.
            Only use item_id values from "candidates". Never include an item that contains one of the user's allergens.
            Reply with JSON only: {"version": "v1", "items": [{"item_id": "...", "score": 0.0-1.0, "explanation": "one short sentence"}]}.
            Return at most %d items ordered from best to worst.
            """;

    private final ObjectMapper objectMapper;

    public String build(
            RecommendationTarget target,
            UserHealthContext health,
            RecommendationFilters filters,
            List<Candidate> templates,
            int maxResults
    ) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("profile", Map.of(
                "allergies", new TreeSet<>(health.allergenNames()),
                "strict_diets", new TreeSet<>(health.strictDiets()),
                "preferred_cuisines", new TreeSet<>(health.preferredCuisines())
        ));
        Map<String, Object> filterMap = new LinkedHashMap<>();
        filterMap.put("diet", new TreeSet<>(filters.diets()));
        filterMap.put("cuisine", new TreeSet<>(filters.cuisines()));
        filterMap.put("price_range", filters.hasPriceTier() ? filters.priceTier().symbol() : null);
        payload.put("filters", filterMap);
        payload.put("candidates", templates.stream().map(this::describe).toList());

        String subject = target == RecommendationTarget.RESTAURANT ? "restaurants" : "menu items";
        try {
            return INSTRUCTION.formatted(subject, maxResults) + "\n" + objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize generative prompt", e);
        }
    }

    private Map<String, Object> describe(Candidate template) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("item_id", String.valueOf(template.itemId()));
        item.put("name", template.name());
        item.put("restaurant", template.restaurantName());
        if (template.price() != null) {
            item.put("price", template.price());
        }
        if (template.calories() != null) {
            item.put("calories", template.calories());
        }
        return item;
    }
}
