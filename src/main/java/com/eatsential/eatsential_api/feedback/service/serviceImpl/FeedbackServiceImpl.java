package com.eatsential.eatsential_api.feedback.service.serviceImpl;

import com.eatsential.eatsential_api.feedback.dto.request.FeedbackSubmitRequest;
import com.eatsential.eatsential_api.feedback.dto.response.FeedbackResponse;
import com.eatsential.eatsential_api.feedback.entity.FeedbackItemType;
import com.eatsential.eatsential_api.feedback.entity.FeedbackType;
import com.eatsential.eatsential_api.feedback.entity.RecommendationFeedback;
import com.eatsential.eatsential_api.feedback.error.FeedbackErrorCode;
import com.eatsential.eatsential_api.feedback.model.FeedbackSnapshot;
import com.eatsential.eatsential_api.feedback.repository.RecommendationFeedbackRepository;
import com.eatsential.eatsential_api.feedback.service.FeedbackService;
import com.eatsential.eatsential_api.global.error.api.ApiException;
import com.eatsential.eatsential_api.global.error.api.FieldErrorData;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Slf4j
@Service
@RequiredArgsConstructor
public class FeedbackServiceImpl implements FeedbackService {

    private final RecommendationFeedbackRepository feedbackRepository;
    private final Clock clock;

    @Override
    @Transactional
    public FeedbackResponse submit(Long memberId, FeedbackSubmitRequest request) {
        List<FieldErrorData> errors = new ArrayList<>();
        FeedbackItemType itemType = FeedbackItemType.fromValue(request.itemType()).orElse(null);
        if (itemType == null) {
            errors.add(new FieldErrorData("item_type", "meal 또는 restaurant 이어야 합니다."));
        }
        FeedbackType feedbackType = FeedbackType.fromValue(request.feedbackType()).orElse(null);
        if (feedbackType == null) {
            errors.add(new FieldErrorData("feedback_type", "like 또는 dislike 이어야 합니다."));
        }
        if (!errors.isEmpty()) {
            throw new ApiException(FeedbackErrorCode.INVALID_FEEDBACK, errors);
        }

        RecommendationFeedback feedback = RecommendationFeedback.builder()
                .memberId(memberId)
                .itemId(request.itemId())
                .itemType(itemType)
                .feedbackType(feedbackType)
                .notes(request.notes())
                .createdAt(Instant.now(clock))
                .build();

        try {
            RecommendationFeedback saved = feedbackRepository.saveAndFlush(feedback);
            log.info("[Feedback] saved. memberId={}, itemType={}, itemId={}, feedbackType={}",
                    memberId, itemType.value(), request.itemId(), feedbackType.value());
            return FeedbackResponse.from(saved);
        } catch (DataAccessException e) {
            throw new ApiException(FeedbackErrorCode.FEEDBACK_STORE_FAILED, e.getMostSpecificCause().getMessage(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Map<Long, String> getLatestStates(Long memberId, List<Long> itemIds, String itemType) {
        FeedbackItemType type = FeedbackItemType.fromValue(itemType)
                .orElseThrow(() -> ApiException.ofField(
                        FeedbackErrorCode.INVALID_FEEDBACK, "item_type", "meal 또는 restaurant 이어야 합니다."));

        LinkedHashSet<Long> ids = new LinkedHashSet<>();
        if (itemIds != null) {
            itemIds.stream().filter(Objects::nonNull).forEach(ids::add);
        }
        if (ids.isEmpty()) {
            return Map.of();
        }

        FeedbackSnapshot snapshot;
        try {
            snapshot = FeedbackSnapshot.of(
                    feedbackRepository.findByMemberIdAndItemTypeAndItemIdInOrderByCreatedAtAscIdAsc(memberId, type, ids),
                    Map.of()
            );
        } catch (DataAccessException e) {
            throw new ApiException(FeedbackErrorCode.FEEDBACK_STORE_FAILED, e.getMostSpecificCause().getMessage(), e);
        }

        Map<Long, String> states = new LinkedHashMap<>();
        for (Long id : ids) {
            snapshot.latest(type, id).ifPresent(feedbackType -> states.put(id, feedbackType.value()));
        }
        return states;
    }

    @Override
    @Transactional(readOnly = true)
    public FeedbackSnapshot snapshot(Long memberId, Map<Long, Long> restaurantIdByItemId) {
        try {
            return FeedbackSnapshot.of(
                    feedbackRepository.findByMemberIdOrderByCreatedAtAscIdAsc(memberId),
                    restaurantIdByItemId
            );
        } catch (DataAccessException e) {
            // 싫어요 목록을 모르면 제외 보장을 할 수 없으므로 추천을 실패시킨다.
            throw new ApiException(FeedbackErrorCode.FEEDBACK_STORE_FAILED, e.getMostSpecificCause().getMessage(), e);
        }
    }
}
