package com.eatsential.eatsential_api.recommendation.safety;

import com.eatsential.eatsential_api.catalog.model.CatalogItem;
import com.eatsential.eatsential_api.profile.model.UserHealthContext;
import com.eatsential.eatsential_api.recommendation.model.Candidate;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * 알레르기 안전 필터. 점수 감점이 아니라 무조건 제외이며, 두 생성기 모두 같은 규칙을 거친다.
 * 모든 메서드는 입력을 바꾸지 않는 순수 함수라 같은 결과에 다시 적용해도 결과가 같다.
 */
@Component
public class SafetyFilter {

    static final Map<String, Set<String>> STRICT_DIET_EXCLUSIONS = Map.of(
            "vegan", Set.of("beef", "pork", "chicken", "fish", "shrimp", "egg", "cheese", "milk", "honey", "butter", "yogurt"),
            "vegetarian", Set.of("beef", "pork", "chicken", "turkey", "fish", "shrimp", "bacon"),
            "gluten-free", Set.of("wheat", "barley", "rye", "gluten", "bread", "pasta"),
            "keto", Set.of("sugar", "bread", "pasta", "rice", "noodle", "potato")
    );

    // "gluten-free", "dairy free", "vegan cheese", "plant-based chicken" 처럼 해당 재료가 없다는 표기
    private static final Pattern FREE_OF_LABEL = Pattern.compile("\\b\\p{L}+[- ]free\\b");
    private static final Pattern SUBSTITUTE_LABEL =
            Pattern.compile("\\b(?:vegan|plant[- ]based|meatless)\\s+\\p{L}+");

    private final Map<String, Pattern> termPatterns = new ConcurrentHashMap<>();

    /**
     * 알레르기 성분 태그가 하나라도 겹치는 후보를 제거한다. 심각도는 보지 않는다.
     */
    public List<Candidate> filter(List<Candidate> candidates, Set<Long> allergySet) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        if (allergySet == null || allergySet.isEmpty()) {
            return List.copyOf(candidates);
        }
        return candidates.stream()
                .filter(candidate -> Collections.disjoint(candidate.allergenIds(), allergySet))
                .toList();
    }

    /**
     * 점수 계산 전 카탈로그 단계 필터.
     * 태그 교집합 제외 + 성분명 텍스트 검사 + 엄격 식단 금지 재료 검사.
     * 태그가 일부만 달린 메뉴도 있으므로 성분명 검사는 태그 유무와 상관없이 모든 메뉴에 적용한다.
     */
    public List<CatalogItem> filterItems(List<CatalogItem> items, UserHealthContext health) {
        if (items == null || items.isEmpty()) {
            return List.of();
        }
        if (health == null) {
            return List.copyOf(items);
        }
        return items.stream()
                .filter(item -> Collections.disjoint(item.allergenIds(), health.allergenIds()))
                .filter(item -> !mentionsAny(item.searchableText(), health.allergenNames()))
                .filter(item -> !violatesStrictDiet(item, health.strictDiets()))
                .toList();
    }

    boolean violatesStrictDiet(CatalogItem item, Set<String> strictDiets) {
        if (strictDiets.isEmpty()) {
            return false;
        }
        String text = withoutDietLabels(item.searchableText());
        for (String diet : strictDiets) {
            Set<String> forbidden = STRICT_DIET_EXCLUSIONS.get(diet);
            if (forbidden != null && mentionsAny(text, forbidden)) {
                return true;
            }
        }
        return false;
    }

    // 식단 검사 전용. 알레르기 검사는 "peanut-free" 표기도 믿지 않는다.
    static String withoutDietLabels(String text) {
        String stripped = FREE_OF_LABEL.matcher(text).replaceAll(" ");
        return SUBSTITUTE_LABEL.matcher(stripped).replaceAll(" ");
    }

    private boolean mentionsAny(String text, Collection<String> terms) {
        if (terms.isEmpty()) {
            return false;
        }
        for (String term : terms) {
            if (term != null && !term.isBlank() && termPattern(term).matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    // "egg" 가 "eggplant" 에 걸리지 않도록 단어 경계 + 복수형까지만 허용
    private Pattern termPattern(String term) {
        return termPatterns.computeIfAbsent(term,
                t -> Pattern.compile("\\b" + Pattern.quote(t.trim()) + "(s|es)?\\b"));
    }
}
