package com.eatsential.eatsential_api.profile.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "dietary_preferences")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class DietaryPreference {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "dietary_preferences_seq_gen")
    @SequenceGenerator(name = "dietary_preferences_seq_gen", sequenceName = "dietary_preferences_seq", allocationSize = 1)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "health_profile_id", nullable = false)
    private HealthProfile healthProfile;

    @Enumerated(EnumType.STRING)
    @Column(name = "preference_type", nullable = false, length = 30)
    private PreferenceType preferenceType;

    @Column(name = "preference_name", nullable = false, length = 100)
    private String preferenceName;

    @Column(name = "is_strict", nullable = false)
    private boolean strict;
}
