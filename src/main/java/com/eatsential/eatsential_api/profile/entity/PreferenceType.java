package com.eatsential.eatsential_api.profile.entity;

public enum PreferenceType {
    DIET, CUISINE, INGREDIENT, PREPARATION
}
