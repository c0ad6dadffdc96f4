package com.eatsential.eatsential_api.recommendation.safety;

import com.eatsential.eatsential_api.catalog.model.CatalogItem;
import com.eatsential.eatsential_api.profile.model.UserHealthContext;
import com.eatsential.eatsential_api.recommendation.model.Candidate;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.eatsential.eatsential_api.support.CatalogFixtures.item;
import static org.assertj.core.api.Assertions.assertThat;

class SafetyFilterTest {

    private final SafetyFilter safetyFilter = new SafetyFilter();

    private Candidate candidate(long itemId, Set<Long> allergens) {
        return Candidate.builder().itemId(itemId).restaurantId(1L).score(0.5).allergenIds(allergens).build();
    }

    @Test
    void dropsCandidatesSharingAnyAllergenTag() {
        // given: 사용자 알레르기 {1(땅콩), 2(갑각류)}
        List<Candidate> candidates = List.of(
                candidate(10L, Set.of(1L)),
                candidate(11L, Set.of(3L)),
                candidate(12L, Set.of(2L, 3L)),
                candidate(13L, Set.of())
        );

        // when
        List<Candidate> safe = safetyFilter.filter(candidates, Set.of(1L, 2L));

        // then
        assertThat(safe).extracting(Candidate::itemId).containsExactly(11L, 13L);
        assertThat(safe).allMatch(c -> c.allergenIds().stream().noneMatch(Set.of(1L, 2L)::contains));
    }

    @Test
    void filteringTwiceIsNoOp() {
        List<Candidate> candidates = List.of(candidate(1L, Set.of(5L)), candidate(2L, Set.of(6L)));

        List<Candidate> once = safetyFilter.filter(candidates, Set.of(5L));

        assertThat(safetyFilter.filter(once, Set.of(5L))).isEqualTo(once);
    }

    @Test
    void noAllergiesKeepsEverything() {
        List<Candidate> candidates = List.of(candidate(1L, Set.of(5L)));

        assertThat(safetyFilter.filter(candidates, Set.of())).isEqualTo(candidates);
    }

    @Test
    void strictVeganExcludesItemsMentioningAnimalProducts() {
        // given: 엄격 비건. "Eggplant" 는 egg 가 아니므로 남아야 한다.
        UserHealthContext health = new UserHealthContext(1L, Set.of(), Set.of(), Set.of("vegan"), Set.of());
        List<CatalogItem> items = List.of(
                item(1L, 1L, "Grilled Chicken Bowl"),
                item(2L, 1L, "Roasted Eggplant Salad"),
                item(3L, 1L, "Scrambled Eggs"),
                item(4L, 1L, "Tofu Stir Fry")
        );

        // when
        List<CatalogItem> safe = safetyFilter.filterItems(items, health);

        // then
        assertThat(safe).extracting(CatalogItem::itemId).containsExactly(2L, 4L);
    }

    @Test
    void itemMentioningAllergenNameIsDroppedEvenWhenPartiallyTagged() {
        // given: 땅콩 알레르기. 10번은 유제품(3)만 태그돼 있지만 이름에 땅콩이 들어 있다.
        UserHealthContext health = new UserHealthContext(1L, Set.of(1L), Set.of("peanut"), Set.of(), Set.of());
        List<CatalogItem> items = List.of(
                item(10L, 1L, "Peanut Satay Noodles", null, null, Set.of(3L), Set.of()),
                item(11L, 1L, "Peanut Noodles"),
                item(12L, 1L, "Satay", null, null, Set.of(1L), Set.of()),
                item(13L, 1L, "Green Curry", null, null, Set.of(3L), Set.of()),
                item(14L, 1L, "Pad Thai")
        );

        // when
        List<CatalogItem> safe = safetyFilter.filterItems(items, health);

        // then
        assertThat(safe).extracting(CatalogItem::itemId).containsExactly(13L, 14L);
    }

    @Test
    void allergenFreeLabelIsNotTrusted() {
        // 알레르기는 "peanut-free" 표기가 있어도 이름에 성분명이 있으면 제외한다.
        UserHealthContext health = new UserHealthContext(1L, Set.of(1L), Set.of("peanut"), Set.of(), Set.of());

        List<CatalogItem> safe = safetyFilter.filterItems(List.of(item(1L, 1L, "Peanut-free Pad Thai")), health);

        assertThat(safe).isEmpty();
    }

    @Test
    void strictDietKeepsItemsLabelledForThatDiet() {
        // given: 엄격 글루텐프리 + 비건
        UserHealthContext health = new UserHealthContext(
                1L, Set.of(), Set.of(), Set.of("gluten-free", "vegan"), Set.of());
        List<CatalogItem> items = List.of(
                item(1L, 1L, "Gluten-Free Quinoa Salad"),
                item(2L, 1L, "Vegan Cheese Flatbread", null, null, Set.of(), Set.of()),
                item(3L, 1L, "Dairy Free Coconut Curry"),
                item(4L, 1L, "Wheat Bread Sandwich"),
                item(5L, 1L, "Four Cheese Salad"),
                item(6L, 1L, "Plant-based Chicken Wrap")
        );

        // when
        List<CatalogItem> safe = safetyFilter.filterItems(items, health);

        // then: 표기 자체는 통과, 실제 재료(밀, 치즈)는 제외
        assertThat(safe).extracting(CatalogItem::itemId).containsExactly(1L, 2L, 3L, 6L);
    }

    @Test
    void dietLabelsAreRemovedBeforeTermCheck() {
        assertThat(SafetyFilter.withoutDietLabels("gluten-free quinoa salad")).doesNotContain("gluten");
        assertThat(SafetyFilter.withoutDietLabels("vegan cheese pizza")).doesNotContain("cheese").contains("pizza");
        assertThat(SafetyFilter.withoutDietLabels("grilled chicken bowl")).isEqualTo("grilled chicken bowl");
    }

    @Test
    void filterItemsIsIdempotent() {
        UserHealthContext health = new UserHealthContext(1L, Set.of(1L), Set.of("milk"), Set.of("keto"), Set.of());
        List<CatalogItem> items = List.of(
                item(1L, 1L, "Fried Rice"),
                item(2L, 1L, "Steak"),
                item(3L, 1L, "Milk Shake")
        );

        List<CatalogItem> once = safetyFilter.filterItems(items, health);

        assertThat(once).extracting(CatalogItem::itemId).containsExactly(2L);
        assertThat(safetyFilter.filterItems(once, health)).isEqualTo(once);
    }
}
