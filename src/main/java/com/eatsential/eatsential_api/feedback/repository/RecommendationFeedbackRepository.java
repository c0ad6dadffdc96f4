package com.eatsential.eatsential_api.feedback.repository;

import com.eatsential.eatsential_api.feedback.entity.FeedbackItemType;
import com.eatsential.eatsential_api.feedback.entity.RecommendationFeedback;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface RecommendationFeedbackRepository extends JpaRepository<RecommendationFeedback, Long> {

    List<RecommendationFeedback> findByMemberIdOrderByCreatedAtAscIdAsc(Long memberId);

    List<RecommendationFeedback> findByMemberIdAndItemTypeAndItemIdInOrderByCreatedAtAscIdAsc(
            Long memberId,
            FeedbackItemType itemType,
            Collection<Long> itemIds
    );
}
