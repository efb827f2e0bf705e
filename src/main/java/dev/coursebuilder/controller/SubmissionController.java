package dev.coursebuilder.controller;

import dev.coursebuilder.domain.valueobject.Identity;
import dev.coursebuilder.dto.request.SubmitWorkRequest;
import dev.coursebuilder.dto.response.ReviewResponse;
import dev.coursebuilder.dto.response.StudentWorkResponse;
import dev.coursebuilder.service.ReviewAssignmentService;
import dev.coursebuilder.service.ReviewLifecycleService;
import dev.coursebuilder.service.ReviewQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * A student's own submission, plus admin management of the reviewers on any submission.
 */
@RestController
@RequestMapping("/units/{unitId}")
public class SubmissionController {
    private final ReviewLifecycleService lifecycleService;
    private final ReviewAssignmentService assignmentService;
    private final ReviewQueryService queryService;

    public SubmissionController(ReviewLifecycleService lifecycleService,
                                ReviewAssignmentService assignmentService,
                                ReviewQueryService queryService) {
        this.lifecycleService = lifecycleService;
        this.assignmentService = assignmentService;
        this.queryService = queryService;
    }

    @PutMapping("/submission")
    public ResponseEntity<StudentWorkResponse> submitWork(@PathVariable String unitId,
                                                          @RequestBody SubmitWorkRequest request,
                                                          Identity student) {
        return ResponseEntity.ok(StudentWorkResponse.from(
                lifecycleService.submitWork(student.id(), unitId, request.toAnswers())));
    }

    @GetMapping("/submission")
    public ResponseEntity<StudentWorkResponse> getSubmission(@PathVariable String unitId, Identity student) {
        return queryService.getStudentWork(student.id(), unitId)
                .map(StudentWorkResponse::from)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/submissions/{studentId}/reviewers/{reviewerId}")
    public ResponseEntity<ReviewResponse> addReviewer(@PathVariable String unitId,
                                                      @PathVariable String studentId,
                                                      @PathVariable String reviewerId) {
        return ResponseEntity.ok(ReviewResponse.from(assignmentService.addReviewer(studentId, unitId, reviewerId)));
    }

    @DeleteMapping("/submissions/{studentId}/reviewers/{reviewerId}")
    public ResponseEntity<Void> removeReviewer(@PathVariable String unitId,
                                               @PathVariable String studentId,
                                               @PathVariable String reviewerId) {
        assignmentService.removeReviewer(studentId, unitId, reviewerId);
        return ResponseEntity.noContent().build();
    }
}
