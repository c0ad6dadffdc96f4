package com.eatsential.eatsential_api.profile.entity;

import com.eatsential.eatsential_api.catalog.entity.Allergen;
import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "user_allergies")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class UserAllergy {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "user_allergies_seq_gen")
    @SequenceGenerator(name = "user_allergies_seq_gen", sequenceName = "user_allergies_seq", allocationSize = 1)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "health_profile_id", nullable = false)
    private HealthProfile healthProfile;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "allergen_id", nullable = false)
    private Allergen allergen;

    // 추천 안전 필터는 심각도와 무관하게 제외한다.
    @Enumerated(EnumType.STRING)
    @Column(length = 30)
    private AllergySeverity severity;
}
