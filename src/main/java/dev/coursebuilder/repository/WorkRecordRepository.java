package dev.coursebuilder.repository;

import dev.coursebuilder.domain.entity.WorkRecord;
import dev.coursebuilder.domain.entity.WorkRecordId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import java.util.List;

@Repository
public interface WorkRecordRepository extends JpaRepository<WorkRecord, WorkRecordId> {

    /**
     * Unit-scoped scan in a stable order: oldest submission first, then student id.
     * Reviewer entries are fetched with the records so the result can be inspected detached.
     */
    @Query("select w from WorkRecord w left join fetch w.reviewers where w.id.unitId = :unitId "
            + "order by w.submittedAt asc, w.id.studentId asc")
    List<WorkRecord> findAllByUnit(@Param("unitId") String unitId);

    @Query("select w from WorkRecord w join w.reviewers r where w.id.unitId = :unitId and key(r) = :reviewerId")
    List<WorkRecord> findAllByUnitAndReviewer(@Param("unitId") String unitId, @Param("reviewerId") String reviewerId);
}
