package com.eatsential.eatsential_api.feedback.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 추천 결과에 대한 좋아요/싫어요 기록. 수정 없이 append 만 하며,
 * (member, itemType, itemId) 별 최신 기록((createdAt, id) 기준)이 유효 상태다.
 */
@Entity
@Table(
        name = "recommendation_feedback",
        indexes = @Index(name = "idx_feedback_member_item", columnList = "member_id, item_type, item_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class RecommendationFeedback {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "recommendation_feedback_seq_gen")
    @SequenceGenerator(
            name = "recommendation_feedback_seq_gen",
            sequenceName = "recommendation_feedback_seq",
            allocationSize = 1
    )
    private Long id;

    @Column(name = "member_id", nullable = false)
    private Long memberId;

    @Column(name = "item_id", nullable = false)
    private Long itemId;

    @Enumerated(EnumType.STRING)
    @Column(name = "item_type", nullable = false, length = 20)
    private FeedbackItemType itemType;

    @Enumerated(EnumType.STRING)
    @Column(name = "feedback_type", nullable = false, length = 20)
    private FeedbackType feedbackType;

    @Column(length = 500)
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
