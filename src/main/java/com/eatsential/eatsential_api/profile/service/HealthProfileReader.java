package com.eatsential.eatsential_api.profile.service;

import com.eatsential.eatsential_api.profile.model.UserHealthContext;

public interface HealthProfileReader {

    /**
     * 프로필이 없는 회원은 빈 컨텍스트(제약 없음)를 반환한다.
     */
    UserHealthContext read(Long memberId);
}
