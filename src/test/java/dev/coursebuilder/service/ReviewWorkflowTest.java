package dev.coursebuilder.service;

import dev.coursebuilder.domain.entity.Answer;
import dev.coursebuilder.domain.enums.ReviewProgress;
import dev.coursebuilder.domain.valueobject.ReviewView;
import dev.coursebuilder.domain.valueobject.StudentWork;
import dev.coursebuilder.exception.InvalidInputException;
import dev.coursebuilder.exception.ReviewerNotAssignedException;
import dev.coursebuilder.exception.WorkRecordNotFoundException;
import dev.coursebuilder.repository.WorkRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

/**
 * End-to-end review workflow through the services against the in-memory database.
 * The clock is mocked so assignment timestamps are under test control.
 */
@SpringBootTest
@ActiveProfiles("test")
class ReviewWorkflowTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired
    private ReviewLifecycleService lifecycleService;
    @Autowired
    private ReviewAssignmentService assignmentService;
    @Autowired
    private ReviewQueryService queryService;
    @Autowired
    private WorkRecordRepository repository;

    @MockitoBean
    private Clock clock;

    @BeforeEach
    void setUp() {
        repository.deleteAll();
        when(clock.instant()).thenReturn(T0);
    }

    private static List<Answer> answers(String... values) {
        return java.util.stream.IntStream.range(0, values.length)
                .mapToObj(i -> new Answer(i, values[i]))
                .toList();
    }

    @Nested
    @DisplayName("submission")
    class Submission {

        @Test
        @DisplayName("fresh work has no reviewers, so nobody has reviews for it")
        void submitThenNoReviews() {
            lifecycleService.submitWork("alice", "u1", answers("ans1", "ans2"));

            assertThat(queryService.getReviewsForReviewer("bob", "u1")).isEmpty();
            assertThat(queryService.getReviewsForReviewer("alice", "u1")).isEmpty();
        }

        @Test
        @DisplayName("stored answers come back in index order")
        void answersRoundTrip() {
            lifecycleService.submitWork("alice", "u1", answers("ans1", "ans2", "ans3"));

            StudentWork work = queryService.getStudentWork("alice", "u1").orElseThrow();
            assertThat(work.answerValues()).containsExactly("ans1", "ans2", "ans3");
            assertThat(work.reviewers()).isEmpty();
        }

        @Test
        @DisplayName("malformed answers are rejected and nothing is stored")
        void malformedAnswers() {
            assertThatThrownBy(() -> lifecycleService.submitWork("alice", "u1",
                    List.of(new Answer(0, "a"), new Answer(3, "b"))))
                    .isInstanceOf(InvalidInputException.class);

            assertThat(queryService.getStudentWork("alice", "u1")).isEmpty();
        }

        @Test
        @DisplayName("long essays are stored; oversized answers and ids are InvalidInput, not a conflict")
        void oversizedValues() {
            String essay = "e".repeat(20_000);
            lifecycleService.submitWork("alice", "u1", answers(essay));
            assertThat(queryService.getStudentWork("alice", "u1").orElseThrow().answerValues()).containsExactly(essay);

            assertThatThrownBy(() -> lifecycleService.submitWork("bob", "u1",
                    answers("x".repeat(Answer.MAX_VALUE_LENGTH + 1))))
                    .isInstanceOf(InvalidInputException.class);
            assertThatThrownBy(() -> lifecycleService.submitWork("bob", "u".repeat(65), answers("a")))
                    .isInstanceOf(InvalidInputException.class);
            assertThat(queryService.getStudentWork("bob", "u1")).isEmpty();
        }

        @Test
        @DisplayName("resubmitting overwrites the answers and drops the reviewers")
        void resubmission() {
            lifecycleService.submitWork("alice", "u1", answers("v1"));
            assignmentService.addReviewer("alice", "u1", "bob");

            lifecycleService.submitWork("alice", "u1", answers("v2", "v2b"));

            StudentWork work = queryService.getStudentWork("alice", "u1").orElseThrow();
            assertThat(work.answerValues()).containsExactly("v2", "v2b");
            assertThat(work.reviewers()).isEmpty();
        }
    }

    @Nested
    @DisplayName("reviewing")
    class Reviewing {

        @Test
        @DisplayName("assign, review and complete: progress with a minimum of one is COMPLETED")
        void fullScenario() {
            lifecycleService.submitWork("alice", "u1", answers("ans1", "ans2"));
            assignmentService.addReviewer("alice", "u1", "bob");

            List<ReviewView> reviews = queryService.getReviewsForReviewer("bob", "u1");
            assertThat(reviews).hasSize(1);
            assertThat(reviews.get(0).studentId()).isEqualTo("alice");
            assertThat(reviews.get(0).review()).isNull();
            assertThat(reviews.get(0).draft()).isTrue();
            assertThat(reviews.get(0).dateAdded()).isEqualTo(T0.getEpochSecond());
            assertThat(queryService.getReviewProgress("bob", "u1").progress()).isEqualTo(ReviewProgress.NOT_STARTED);

            lifecycleService.submitReview("alice", "u1", "bob", "Clear and correct.", false);

            ReviewQueryService.ProgressReport report = queryService.getReviewProgress("bob", "u1");
            assertThat(report.minimumRequired()).isEqualTo(1);
            assertThat(report.tally().completedCount()).isEqualTo(1);
            assertThat(report.progress()).isEqualTo(ReviewProgress.COMPLETED);
        }

        @Test
        @DisplayName("draft reviews keep the assignment time and do not count as completed")
        void draftReview() {
            lifecycleService.submitWork("alice", "u2", answers("a"));
            assignmentService.addReviewer("alice", "u2", "bob");
            when(clock.instant()).thenReturn(T0.plusSeconds(3600));

            ReviewView view = lifecycleService.submitReview("alice", "u2", "bob", "first thoughts", true);

            assertThat(view.dateAdded()).isEqualTo(T0.getEpochSecond());
            assertThat(view.review()).isEqualTo("first thoughts");
            ReviewQueryService.ProgressReport report = queryService.getReviewProgress("bob", "u2");
            assertThat(report.minimumRequired()).isEqualTo(2);
            assertThat(report.progress()).isEqualTo(ReviewProgress.NOT_STARTED);
        }

        @Test
        @DisplayName("adding the same reviewer twice yields one entry")
        void addReviewerIdempotent() {
            lifecycleService.submitWork("alice", "u1", answers("a"));
            assignmentService.addReviewer("alice", "u1", "bob");
            assignmentService.addReviewer("alice", "u1", "bob");

            assertThat(queryService.getStudentWork("alice", "u1").orElseThrow().reviewers()).containsOnlyKeys("bob");
            assertThat(queryService.getReviewsForReviewer("bob", "u1")).hasSize(1);
        }

        @Test
        @DisplayName("reviewing without an assignment is NotFound")
        void reviewWithoutAssignment() {
            lifecycleService.submitWork("alice", "u1", answers("a"));

            assertThatThrownBy(() -> lifecycleService.submitReview("alice", "u1", "mallory", "text", false))
                    .isInstanceOf(ReviewerNotAssignedException.class);
        }

        @Test
        @DisplayName("finalizing an empty review is InvalidInput and the draft survives")
        void finalizeEmptyReview() {
            lifecycleService.submitWork("alice", "u1", answers("a"));
            assignmentService.addReviewer("alice", "u1", "bob");

            assertThatThrownBy(() -> lifecycleService.submitReview("alice", "u1", "bob", null, false))
                    .isInstanceOf(InvalidInputException.class);
            assertThat(queryService.getReviewsForReviewer("bob", "u1").get(0).draft()).isTrue();
        }

        @Test
        @DisplayName("operations on missing work are NotFound")
        void missingWork() {
            assertThatThrownBy(() -> assignmentService.addReviewer("ghost", "u1", "bob"))
                    .isInstanceOf(WorkRecordNotFoundException.class);
            assertThatThrownBy(() -> lifecycleService.submitReview("ghost", "u1", "bob", "x", true))
                    .isInstanceOf(WorkRecordNotFoundException.class);
            assertThatThrownBy(() -> assignmentService.removeReviewer("ghost", "u1", "bob"))
                    .isInstanceOf(WorkRecordNotFoundException.class);
        }

        @Test
        @DisplayName("reviews are listed in assignment order regardless of submission order")
        void orderedByDateAdded() {
            lifecycleService.submitWork("sam", "u1", answers("s"));
            lifecycleService.submitWork("tom", "u1", answers("t"));
            lifecycleService.submitWork("uma", "u1", answers("u"));

            when(clock.instant()).thenReturn(T0.plusSeconds(300));
            assignmentService.addReviewer("sam", "u1", "rita");
            when(clock.instant()).thenReturn(T0.plusSeconds(100));
            assignmentService.addReviewer("uma", "u1", "rita");
            when(clock.instant()).thenReturn(T0.plusSeconds(200));
            assignmentService.addReviewer("tom", "u1", "rita");

            assertThat(queryService.getReviewsForReviewer("rita", "u1"))
                    .extracting(ReviewView::studentId)
                    .containsExactly("uma", "tom", "sam");
        }
    }

    @Nested
    @DisplayName("assignment")
    class Assignment {

        @Test
        @DisplayName("a second reviewer is steered to the other, less loaded submission")
        void spreadsLoad() {
            lifecycleService.submitWork("a1", "u1", answers("x"));
            lifecycleService.submitWork("a2", "u1", answers("y"));

            String first = assignmentService.assignReviewer("r1", "u1").orElseThrow().studentId();
            String second = assignmentService.assignNextSubmission("r2", "u1").orElseThrow();

            assertThat(first).isIn("a1", "a2");
            assertThat(second).isNotEqualTo(first).isIn("a1", "a2");
        }

        @Test
        @DisplayName("never hands reviewers their own work or work they already review")
        void eligibility() {
            lifecycleService.submitWork("rita", "u1", answers("mine"));
            lifecycleService.submitWork("sam", "u1", answers("s"));

            assertThat(assignmentService.assignReviewer("rita", "u1")).map(ReviewView::studentId).contains("sam");
            assertThat(assignmentService.assignNextSubmission("rita", "u1")).isEmpty();
            assertThat(assignmentService.assignReviewer("rita", "u1")).isEmpty();
        }

        @Test
        @DisplayName("submissions of other units are not candidates")
        void unitScoped() {
            lifecycleService.submitWork("sam", "u2", answers("s"));

            assertThat(assignmentService.assignNextSubmission("rita", "u1")).isEmpty();
        }

        @Test
        @DisplayName("assigning oneself directly is InvalidInput")
        void selfAssignment() {
            lifecycleService.submitWork("alice", "u1", answers("a"));

            assertThatThrownBy(() -> assignmentService.addReviewer("alice", "u1", "alice"))
                    .isInstanceOf(InvalidInputException.class);
        }

        @Test
        @DisplayName("removing a reviewer who was never assigned is NotFound and changes nothing")
        void removeUnassigned() {
            lifecycleService.submitWork("alice", "u1", answers("a"));
            assignmentService.addReviewer("alice", "u1", "bob");

            assertThatThrownBy(() -> assignmentService.removeReviewer("alice", "u1", "carol"))
                    .isInstanceOf(ReviewerNotAssignedException.class);
            assertThat(queryService.getStudentWork("alice", "u1").orElseThrow().reviewers()).containsOnlyKeys("bob");
        }

        @Test
        @DisplayName("removing a reviewer drops their review from their list")
        void removeAssigned() {
            lifecycleService.submitWork("alice", "u1", answers("a"));
            assignmentService.addReviewer("alice", "u1", "bob");

            assignmentService.removeReviewer("alice", "u1", "bob");

            assertThat(queryService.getReviewsForReviewer("bob", "u1")).isEmpty();
            assertThat(queryService.getStudentWork("alice", "u1").orElseThrow().reviewers()).isEmpty();
        }
    }
}
