package com.eatsential.eatsential_api.recommendation.generator.generative;

import com.eatsential.eatsential_api.catalog.model.CatalogItem;
import com.eatsential.eatsential_api.recommendation.config.GenerativeProperties;
import com.eatsential.eatsential_api.recommendation.config.RecommendationProperties;
import com.eatsential.eatsential_api.recommendation.generator.CandidateGenerator;
import com.eatsential.eatsential_api.recommendation.generator.GenerationFailedException;
import com.eatsential.eatsential_api.recommendation.generator.GenerationFailedException.Reason;
import com.eatsential.eatsential_api.recommendation.generator.baseline.BaselineGenerator;
import com.eatsential.eatsential_api.recommendation.generator.generative.client.GenerativeClient;
import com.eatsential.eatsential_api.recommendation.generator.generative.reply.GenerativeReply;
import com.eatsential.eatsential_api.recommendation.generator.generative.reply.GenerativeReplyParser;
import com.eatsential.eatsential_api.recommendation.generator.generative.reply.ReplyEntry;
import com.eatsential.eatsential_api.recommendation.model.Candidate;
import com.eatsential.eatsential_api.recommendation.model.GenerationContext;
import com.eatsential.eatsential_api.recommendation.model.RecommendationMode;
import com.eatsential.eatsential_api.recommendation.model.RecommendationTarget;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 생성형(LLM) 생성기. 응답은 카탈로그에 있는 항목만 받아들이고 후보는 카탈로그 데이터로 다시 만든다.
 * 어떤 실패도 {@link GenerationFailedException} 으로만 알린다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GenerativeGenerator implements CandidateGenerator {

    static final int STUB_MAX_ITEMS = 5;
    private static final String DEFAULT_EXPLANATION = "Recommended for your profile";

    private final GenerativeClient generativeClient;
    private final GenerativeReplyParser replyParser;
    private final GenerativePromptBuilder promptBuilder;
    private final GenerativeProperties generativeProperties;
    private final RecommendationProperties recommendationProperties;

    @Override
    public RecommendationMode mode() {
        return RecommendationMode.LLM;
    }

    @Override
    public List<Candidate> generate(GenerationContext context) {
        List<Candidate> templates = templates(context);
        if (templates.isEmpty()) {
            throw new GenerationFailedException(Reason.EMPTY_REPLY, "No catalog items to rank");
        }

        if (generativeProperties.offline()) {
            return stubScores(templates);
        }

        String prompt = promptBuilder.build(
                context.target(), context.health(), context.filters(), templates, recommendationProperties.limit() * 2);
        GenerativeReply reply = replyParser.parse(generativeClient.generateContent(prompt));
        List<Candidate> candidates = normalize(reply, templates);
        log.debug("[Generative] normalized reply. variant={}, entries={}, accepted={}",
                reply.getClass().getSimpleName(), reply.entries().size(), candidates.size());
        return candidates;
    }

    /**
     * 응답 항목을 카탈로그 후보에 대응시킨다. 모르는 id 는 버리고, 중복 id 는 높은 점수 하나만 남긴다.
     */
    List<Candidate> normalize(GenerativeReply reply, List<Candidate> templates) {
        Map<String, Candidate> byId = new LinkedHashMap<>();
        templates.forEach(template -> byId.put(String.valueOf(template.itemId()), template));

        Map<String, Candidate> accepted = new LinkedHashMap<>();
        for (ReplyEntry entry : reply.entries()) {
            Candidate template = entry.itemId() == null ? null : byId.get(entry.itemId());
            if (template == null) {
                continue;
            }
            Set<Long> allergens = new HashSet<>(template.allergenIds());
            allergens.addAll(entry.allergenIds());

            Candidate candidate = template.toBuilder()
                    .score(entry.score() == null ? 0.0 : entry.score())
                    .explanation(entry.explanation() == null || entry.explanation().isBlank()
                            ? DEFAULT_EXPLANATION : entry.explanation().trim())
                    .allergenIds(allergens)
                    .meta(Map.of(Candidate.META_SOURCE, RecommendationMode.LLM.value()))
                    .build();

            accepted.merge(entry.itemId(), candidate,
                    (current, next) -> next.score() > current.score() ? next : current);
        }

        if (accepted.isEmpty()) {
            throw new GenerationFailedException(Reason.EMPTY_REPLY, "Generative reply named no known catalog item");
        }
        List<Candidate> candidates = new ArrayList<>(accepted.values());
        if (candidates.stream().allMatch(candidate -> candidate.score() == 0.0)) {
            throw new GenerationFailedException(Reason.DEGENERATE_SCORES, "All generative scores are zero");
        }
        candidates.sort(Comparator.comparingDouble(Candidate::score).reversed());
        return candidates;
    }

    /**
     * API 키가 없을 때: 식당별로 번갈아 뽑아 0.9, 0.8 ... 점수를 준다.
     */
    List<Candidate> stubScores(List<Candidate> templates) {
        Map<Long, Deque<Candidate>> byRestaurant = new LinkedHashMap<>();
        for (Candidate template : templates) {
            byRestaurant.computeIfAbsent(template.restaurantId(), id -> new ArrayDeque<>()).add(template);
        }

        List<Candidate> result = new ArrayList<>();
        double score = 0.9;
        while (result.size() < STUB_MAX_ITEMS && !byRestaurant.isEmpty()) {
            var iterator = byRestaurant.values().iterator();
            while (iterator.hasNext() && result.size() < STUB_MAX_ITEMS) {
                Deque<Candidate> queue = iterator.next();
                Candidate template = queue.poll();
                if (queue.isEmpty()) {
                    iterator.remove();
                }
                result.add(template.toBuilder()
                        .score(score)
                        .explanation("Offline generative ranking")
                        .meta(Map.of(Candidate.META_SOURCE, RecommendationMode.LLM.value()))
                        .build());
                score = Math.max(0.1, score - 0.1);
            }
        }
        return result;
    }

    private List<Candidate> templates(GenerationContext context) {
        List<Candidate> templates = new ArrayList<>();
        if (context.target() == RecommendationTarget.RESTAURANT) {
            for (List<CatalogItem> items : BaselineGenerator.groupByRestaurant(context.items()).values()) {
                templates.add(Candidate.fromRestaurant(items));
            }
        } else {
            context.items().forEach(item -> templates.add(Candidate.fromItem(item)));
        }
        int max = recommendationProperties.maxGenerativeCandidates();
        return templates.size() > max ? templates.subList(0, max) : templates;
    }
}
