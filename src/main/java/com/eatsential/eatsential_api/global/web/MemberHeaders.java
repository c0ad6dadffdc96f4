package com.eatsential.eatsential_api.global.web;

/**
 * 인증 게이트웨이가 검증 후 전달하는 호출자 식별 헤더.
 */
public final class MemberHeaders {

	public static final String MEMBER_ID = "X-Member-Id";

	private MemberHeaders() {
	}
}
