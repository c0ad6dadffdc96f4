package com.eatsential.eatsential_api.profile.repository;

import com.eatsential.eatsential_api.profile.entity.HealthProfile;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface HealthProfileRepository extends JpaRepository<HealthProfile, Long> {

    @EntityGraph(attributePaths = {"allergies", "allergies.allergen", "dietaryPreferences"})
    Optional<HealthProfile> findByMemberId(Long memberId);
}
