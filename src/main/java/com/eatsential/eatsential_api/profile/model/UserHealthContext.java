package com.eatsential.eatsential_api.profile.model;

import java.util.Set;

/**
 * 추천 한 건 동안 사용하는 건강 프로필 읽기 전용 뷰.
 *
 * @param allergenIds      알레르기 성분 id (심각도 무관)
 * @param allergenNames    소문자 성분명. 태그가 없는 메뉴의 텍스트 검사용
 * @param strictDiets      is_strict 인 식단(vegan, keto ...) 소문자
 * @param preferredCuisines 프로필에 저장된 선호 요리. 생성형 프롬프트 참고용
 */
public record UserHealthContext(
        Long memberId,
        Set<Long> allergenIds,
        Set<String> allergenNames,
        Set<String> strictDiets,
        Set<String> preferredCuisines
) {

    public UserHealthContext {
        allergenIds = allergenIds == null ? Set.of() : Set.copyOf(allergenIds);
        allergenNames = allergenNames == null ? Set.of() : Set.copyOf(allergenNames);
        strictDiets = strictDiets == null ? Set.of() : Set.copyOf(strictDiets);
        preferredCuisines = preferredCuisines == null ? Set.of() : Set.copyOf(preferredCuisines);
    }

    public static UserHealthContext empty(Long memberId) {
        return new UserHealthContext(memberId, Set.of(), Set.of(), Set.of(), Set.of());
    }
}
