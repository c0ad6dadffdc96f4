package com.eatsential.eatsential_api.recommendation.controller;

import com.eatsential.eatsential_api.global.error.api.ErrorResponse;
import com.eatsential.eatsential_api.global.web.MemberHeaders;
import com.eatsential.eatsential_api.recommendation.dto.request.RecommendationRequest;
import com.eatsential.eatsential_api.recommendation.dto.response.RecommendationResponse;
import com.eatsential.eatsential_api.recommendation.service.RecommendationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Tag(name = "Recommendation", description = "식단/식당 추천 API")
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/recommendations")
public class RecommendationController {

    private final RecommendationService recommendationService;

    @Operation(
            summary = "메뉴 추천",
            description = "알레르기 성분이 포함된 메뉴는 항상 제외됩니다. 생성형 추천 실패 시 규칙 기반 결과가 fallback=true 로 반환됩니다."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "추천 성공"),
            @ApiResponse(responseCode = "400", description = "INVALID_FILTER / PARAMETER_MISSING",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "503", description = "CATALOG_UNAVAILABLE",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PostMapping("/meals")
    public ResponseEntity<RecommendationResponse> recommendMeals(
            @RequestHeader(MemberHeaders.MEMBER_ID) Long memberId,
            @RequestBody(required = false) @Valid RecommendationRequest request
    ) {
        return ResponseEntity.ok(recommendationService.recommendMeals(memberId, request));
    }

    @Operation(summary = "식당 추천")
    @PostMapping("/restaurants")
    public ResponseEntity<RecommendationResponse> recommendRestaurants(
            @RequestHeader(MemberHeaders.MEMBER_ID) Long memberId,
            @RequestBody(required = false) @Valid RecommendationRequest request
    ) {
        return ResponseEntity.ok(recommendationService.recommendRestaurants(memberId, request));
    }
}
