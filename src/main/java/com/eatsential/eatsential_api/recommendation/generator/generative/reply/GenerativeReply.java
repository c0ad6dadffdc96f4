package com.eatsential.eatsential_api.recommendation.generator.generative.reply;

import java.util.List;

/**
 * 생성형 백엔드 응답의 형태별 변형.
 * <ul>
 *     <li>{@link Legacy}: 최상위 JSON 배열</li>
 *     <li>{@link Versioned}: {@code {"version": "...", "items": [...]}}</li>
 *     <li>{@link Envelope}: Gemini generateContent 봉투. 본문 text 안에 위 두 형태 중 하나가 들어 있다.</li>
 * </ul>
 */
public interface GenerativeReply {

    List<ReplyEntry> entries();

    record Legacy(List<ReplyEntry> entries) implements GenerativeReply {
    }

    record Versioned(String version, List<ReplyEntry> entries) implements GenerativeReply {
    }

    record Envelope(String modelVersion, GenerativeReply inner) implements GenerativeReply {

        @Override
        public List<ReplyEntry> entries() {
            return inner.entries();
        }
    }
}
