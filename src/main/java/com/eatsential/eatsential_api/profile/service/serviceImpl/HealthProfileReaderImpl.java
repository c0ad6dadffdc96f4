package com.eatsential.eatsential_api.profile.service.serviceImpl;

import com.eatsential.eatsential_api.profile.entity.DietaryPreference;
import com.eatsential.eatsential_api.profile.entity.HealthProfile;
import com.eatsential.eatsential_api.profile.entity.PreferenceType;
import com.eatsential.eatsential_api.profile.entity.UserAllergy;
import com.eatsential.eatsential_api.profile.model.UserHealthContext;
import com.eatsential.eatsential_api.profile.repository.HealthProfileRepository;
import com.eatsential.eatsential_api.profile.service.HealthProfileReader;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class HealthProfileReaderImpl implements HealthProfileReader {

    private final HealthProfileRepository healthProfileRepository;

    @Override
    public UserHealthContext read(Long memberId) {
        return healthProfileRepository.findByMemberId(memberId)
                .map(this::toContext)
                .orElseGet(() -> UserHealthContext.empty(memberId));
    }

    private UserHealthContext toContext(HealthProfile profile) {
        Set<Long> allergenIds = profile.getAllergies().stream()
                .map(allergy -> allergy.getAllergen().getId())
                .collect(Collectors.toSet());

        Set<String> allergenNames = profile.getAllergies().stream()
                .map(UserAllergy::getAllergen)
                .map(allergen -> normalize(allergen.getName()))
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());

        Set<String> strictDiets = profile.getDietaryPreferences().stream()
                .filter(pref -> pref.getPreferenceType() == PreferenceType.DIET && pref.isStrict())
                .map(pref -> normalize(pref.getPreferenceName()))
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());

        Set<String> cuisines = profile.getDietaryPreferences().stream()
                .filter(pref -> pref.getPreferenceType() == PreferenceType.CUISINE)
                .map(DietaryPreference::getPreferenceName)
                .map(this::normalize)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());

        return new UserHealthContext(profile.getMemberId(), allergenIds, allergenNames, strictDiets, cuisines);
    }

    private String normalize(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
