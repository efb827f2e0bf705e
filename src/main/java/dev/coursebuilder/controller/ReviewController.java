package dev.coursebuilder.controller;

import dev.coursebuilder.domain.valueobject.Identity;
import dev.coursebuilder.dto.request.SubmitReviewRequest;
import dev.coursebuilder.dto.response.ReviewListResponse;
import dev.coursebuilder.dto.response.ReviewResponse;
import dev.coursebuilder.service.ReviewAssignmentService;
import dev.coursebuilder.service.ReviewLifecycleService;
import dev.coursebuilder.service.ReviewQueryService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * The caller acting as a reviewer: request work, list assigned reviews, save reviews.
 */
@RestController
@RequestMapping("/units/{unitId}/reviews")
public class ReviewController {
    private final ReviewAssignmentService assignmentService;
    private final ReviewLifecycleService lifecycleService;
    private final ReviewQueryService queryService;

    public ReviewController(ReviewAssignmentService assignmentService,
                            ReviewLifecycleService lifecycleService,
                            ReviewQueryService queryService) {
        this.assignmentService = assignmentService;
        this.lifecycleService = lifecycleService;
        this.queryService = queryService;
    }

    @PostMapping
    public ResponseEntity<ReviewResponse> requestReview(@PathVariable String unitId, Identity reviewer) {
        return assignmentService.assignReviewer(reviewer.id(), unitId)
                .map(view -> ResponseEntity.status(HttpStatus.CREATED).body(ReviewResponse.from(view)))
                .orElse(ResponseEntity.noContent().build());
    }

    @GetMapping
    public ResponseEntity<ReviewListResponse> getReviews(@PathVariable String unitId, Identity reviewer) {
        return ResponseEntity.ok(ReviewListResponse.from(queryService.getReviewProgress(reviewer.id(), unitId)));
    }

    @PutMapping("/{studentId}")
    public ResponseEntity<ReviewResponse> submitReview(@PathVariable String unitId,
                                                       @PathVariable String studentId,
                                                       @RequestBody SubmitReviewRequest request,
                                                       Identity reviewer) {
        return ResponseEntity.ok(ReviewResponse.from(lifecycleService.submitReview(
                studentId, unitId, reviewer.id(), request.review(), request.isDraft())));
    }
}
