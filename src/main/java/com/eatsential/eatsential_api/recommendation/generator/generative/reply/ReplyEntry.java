package com.eatsential.eatsential_api.recommendation.generator.generative.reply;

import java.util.List;

/**
 * 생성형 응답 한 줄. 외부 응답 형태가 달라도 여기까지 정규화된다.
 * score 는 숫자가 아니면 null, allergenIds 는 참고용(카탈로그 태그와 합쳐 재검증).
 */
public record ReplyEntry(
        String itemId,
        String name,
        Double score,
        String explanation,
        List<Long> allergenIds
) {

    public ReplyEntry {
        allergenIds = allergenIds == null ? List.of() : List.copyOf(allergenIds);
    }
}
