package com.eatsential.eatsential_api.feedback.service;

import com.eatsential.eatsential_api.feedback.dto.request.FeedbackSubmitRequest;
import com.eatsential.eatsential_api.feedback.dto.response.FeedbackResponse;
import com.eatsential.eatsential_api.feedback.model.FeedbackSnapshot;

import java.util.List;
import java.util.Map;

public interface FeedbackService {

    FeedbackResponse submit(Long memberId, FeedbackSubmitRequest request);

    /**
     * 항목별 최신 피드백("like"/"dislike"). 피드백이 없는 항목은 결과에서 빠진다.
     */
    Map<Long, String> getLatestStates(Long memberId, List<Long> itemIds, String itemType);

    FeedbackSnapshot snapshot(Long memberId, Map<Long, Long> restaurantIdByItemId);
}
