package com.eatsential.eatsential_api.feedback.controller;

import com.eatsential.eatsential_api.feedback.dto.request.FeedbackSubmitRequest;
import com.eatsential.eatsential_api.feedback.dto.response.FeedbackResponse;
import com.eatsential.eatsential_api.feedback.service.FeedbackService;
import com.eatsential.eatsential_api.global.error.api.ErrorResponse;
import com.eatsential.eatsential_api.global.web.MemberHeaders;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Tag(name = "Recommendation Feedback", description = "추천 좋아요/싫어요 API")
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/recommendations/feedback")
public class FeedbackController {

    private final FeedbackService feedbackService;

    @Operation(summary = "추천 피드백 등록", description = "같은 항목에 다시 등록하면 가장 최근 기록이 유효합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "등록 성공"),
            @ApiResponse(responseCode = "400", description = "INVALID_FEEDBACK / VALIDATION_FAILED",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "500", description = "FEEDBACK_STORE_FAILED",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PostMapping
    public ResponseEntity<FeedbackResponse> submitFeedback(
            @RequestHeader(MemberHeaders.MEMBER_ID) Long memberId,
            @RequestBody @Valid FeedbackSubmitRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(feedbackService.submit(memberId, request));
    }

    @Operation(summary = "항목별 최신 피드백 조회")
    @GetMapping
    public ResponseEntity<Map<Long, String>> getFeedback(
            @RequestHeader(MemberHeaders.MEMBER_ID) Long memberId,
            @RequestParam("item_ids") List<Long> itemIds,
            @RequestParam(value = "item_type", defaultValue = "meal") String itemType
    ) {
        return ResponseEntity.ok(feedbackService.getLatestStates(memberId, itemIds, itemType));
    }
}
