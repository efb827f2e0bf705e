package dev.coursebuilder.dto.response;

import dev.coursebuilder.domain.enums.ReviewProgress;
import dev.coursebuilder.service.ReviewQueryService.ProgressReport;
import java.util.List;

public record ReviewListResponse(
        String unitId, ReviewProgress progress, int minimumRequired, int completedCount,
        boolean hasUnstarted, boolean hasCompletedAll, List<ReviewResponse> reviews
) {
    public static ReviewListResponse from(ProgressReport report) {
        return new ReviewListResponse(report.unitId(), report.progress(), report.minimumRequired(),
                report.tally().completedCount(), report.tally().hasUnstarted(), report.tally().hasCompletedAll(),
                report.reviews().stream().map(ReviewResponse::from).toList());
    }
}
