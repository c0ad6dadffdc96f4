package com.eatsential.eatsential_api.global.error.api;

import com.eatsential.eatsential_api.global.error.code.CommonErrorCode;
import com.eatsential.eatsential_api.recommendation.error.RecommendationErrorCode;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;

import static org.assertj.core.api.Assertions.assertThat;

class ApiExceptionTest {

    @Test
    void ofFieldCarriesSingleFieldError() {
        ApiException ex = ApiException.ofField(CommonErrorCode.VALIDATION_FAILED, "item_type", "필수값입니다.");

        assertThat(ex.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(ex).hasMessage(CommonErrorCode.VALIDATION_FAILED.getMessage());
        assertThat(ex.getErrors()).containsExactly(new FieldErrorData("item_type", "필수값입니다."));
        assertThat(ex.getData()).isNull();
    }

    @Test
    void storeFailureKeepsCauseForStackTrace() {
        // given: 저장소 장애
        DataAccessResourceFailureException cause = new DataAccessResourceFailureException("connection refused");

        // when
        ApiException ex = new ApiException(RecommendationErrorCode.CATALOG_UNAVAILABLE, "menu catalog unavailable", cause);

        // then: 응답 메시지는 에러 코드 메시지, 원인은 cause 로만 남는다.
        assertThat(ex.getStatus()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(ex).hasMessage(RecommendationErrorCode.CATALOG_UNAVAILABLE.getMessage());
        assertThat(ex).hasCause(cause);
        assertThat(ex.getErrors()).isNull();
        assertThat(ex.getData()).isEqualTo("menu catalog unavailable");
    }
}
