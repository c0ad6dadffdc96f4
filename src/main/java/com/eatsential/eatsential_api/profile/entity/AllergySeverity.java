package com.eatsential.eatsential_api.profile.entity;

public enum AllergySeverity {
    MILD, MODERATE, SEVERE, LIFE_THREATENING
}
