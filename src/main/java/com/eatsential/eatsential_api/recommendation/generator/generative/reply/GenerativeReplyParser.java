package com.eatsential.eatsential_api.recommendation.generator.generative.reply;

import com.eatsential.eatsential_api.recommendation.generator.GenerationFailedException;
import com.eatsential.eatsential_api.recommendation.generator.GenerationFailedException.Reason;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 생성형 백엔드 원문(JSON 문자열)을 {@link GenerativeReply} 로 해석한다.
 * 해석할 수 없는 응답은 {@link GenerationFailedException}(MALFORMED_REPLY) 로 알린다.
 */
@Component
@RequiredArgsConstructor
public class GenerativeReplyParser {

    private static final String[] ITEM_ARRAY_FIELDS = {"items", "recommendations", "data"};

    private final ObjectMapper objectMapper;

    public GenerativeReply parse(String raw) {
        return parse(raw, true);
    }

    private GenerativeReply parse(String raw, boolean allowEnvelope) {
        if (raw == null || raw.isBlank()) {
            throw malformed("empty body", null);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFence(raw));
        } catch (JsonProcessingException e) {
            throw malformed("not json: " + e.getOriginalMessage(), e);
        }

        if (root.isArray()) {
            return new GenerativeReply.Legacy(readEntries(root));
        }
        if (!root.isObject()) {
            throw malformed("unexpected root node: " + root.getNodeType(), null);
        }
        if (allowEnvelope && root.has("candidates")) {
            String text = extractEnvelopeText(root);
            return new GenerativeReply.Envelope(root.path("modelVersion").asText(null), parse(text, false));
        }
        for (String field : ITEM_ARRAY_FIELDS) {
            JsonNode items = root.get(field);
            if (items != null && items.isArray()) {
                return new GenerativeReply.Versioned(root.path("version").asText("v1"), readEntries(items));
            }
        }
        if (root.has("item_id")) {
            return new GenerativeReply.Legacy(List.of(readEntry(root)));
        }
        throw malformed("no recommendation items in reply", null);
    }

    private String extractEnvelopeText(JsonNode root) {
        for (JsonNode candidate : root.path("candidates")) {
            StringBuilder text = new StringBuilder();
            for (JsonNode part : candidate.path("content").path("parts")) {
                if (part.hasNonNull("text")) {
                    text.append(part.get("text").asText());
                }
            }
            if (!text.isEmpty()) {
                return text.toString();
            }
        }
        throw malformed("envelope without text parts", null);
    }

    private List<ReplyEntry> readEntries(JsonNode array) {
        List<ReplyEntry> entries = new ArrayList<>(array.size());
        for (JsonNode node : array) {
            if (!node.isObject()) {
                throw malformed("item is not an object: " + node.getNodeType(), null);
            }
            entries.add(readEntry(node));
        }
        return entries;
    }

    private ReplyEntry readEntry(JsonNode node) {
        JsonNode id = node.hasNonNull("item_id") ? node.get("item_id") : node.get("id");
        String itemId = (id == null || id.isNull() || id.isContainerNode()) ? null : id.asText().trim();

        return new ReplyEntry(
                (itemId == null || itemId.isEmpty()) ? null : itemId,
                textOrNull(node, "name"),
                readScore(node.get("score")),
                textOrNull(node, "explanation"),
                readAllergenIds(node.get("allergen_ids"))
        );
    }

    private Double readScore(JsonNode score) {
        if (score == null || score.isNull()) {
            return null;
        }
        if (score.isNumber()) {
            return score.asDouble();
        }
        if (score.isTextual()) {
            try {
                return Double.parseDouble(score.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private List<Long> readAllergenIds(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<Long> ids = new ArrayList<>();
        for (JsonNode id : node) {
            if (id.canConvertToLong()) {
                ids.add(id.asLong());
            }
        }
        return ids;
    }

    private String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return (value == null || value.isNull()) ? null : value.asText();
    }

    // 모델이 ```json ... ``` 으로 감싸서 돌려주는 경우
    private String stripCodeFence(String raw) {
        String trimmed = raw.trim();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstNewline = trimmed.indexOf('\n');
        int lastFence = trimmed.lastIndexOf("```");
        if (firstNewline < 0 || lastFence <= firstNewline) {
            return trimmed;
        }
        return trimmed.substring(firstNewline + 1, lastFence).trim();
    }

    private GenerationFailedException malformed(String detail, Throwable cause) {
        return new GenerationFailedException(Reason.MALFORMED_REPLY, "Malformed generative reply: " + detail, cause);
    }
}
