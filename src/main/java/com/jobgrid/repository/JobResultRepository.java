package com.jobgrid.repository;

import com.jobgrid.model.JobResult;
import com.jobgrid.model.JobResultStatus;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface JobResultRepository extends JpaRepository<JobResult, UUID> {

    /**
     * Aggregated status counters fetched in a single query.
     */
    interface StatusCounts {
        Long getPendingCount();

        Long getRunningCount();

        Long getCompletedCount();

        Long getErroredCount();

        Long getFailedCount();
    }

    @Query("""
            SELECT
                SUM(CASE WHEN r.status = com.jobgrid.model.JobResultStatus.PENDING THEN 1 ELSE 0 END) AS pendingCount,
                SUM(CASE WHEN r.status = com.jobgrid.model.JobResultStatus.RUNNING THEN 1 ELSE 0 END) AS runningCount,
                SUM(CASE WHEN r.status = com.jobgrid.model.JobResultStatus.COMPLETED THEN 1 ELSE 0 END) AS completedCount,
                SUM(CASE WHEN r.status = com.jobgrid.model.JobResultStatus.ERRORED THEN 1 ELSE 0 END) AS erroredCount,
                SUM(CASE WHEN r.status = com.jobgrid.model.JobResultStatus.FAILED THEN 1 ELSE 0 END) AS failedCount
            FROM JobResult r
            """)
    @QueryHints(@QueryHint(name = "org.hibernate.readOnly", value = "true"))
    StatusCounts countStatuses();

    List<JobResult> findByJobDefinitionIdOrderByDateCreatedDesc(UUID jobDefinitionId);

    @Query("SELECT r FROM JobResult r WHERE r.scheduledJob.id = :scheduledJobId ORDER BY r.dateCreated DESC")
    List<JobResult> findByScheduledJobId(@Param("scheduledJobId") UUID scheduledJobId);

    @Modifying
    @Transactional
    @Query("DELETE FROM JobResult r WHERE r.status IN :statuses AND r.dateDone < :threshold")
    int deleteByStatusInAndDateDoneBefore(@Param("statuses") Collection<JobResultStatus> statuses,
            @Param("threshold") OffsetDateTime threshold);
}
