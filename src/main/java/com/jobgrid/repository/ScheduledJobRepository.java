package com.jobgrid.repository;

import com.jobgrid.model.ScheduledJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ScheduledJobRepository extends JpaRepository<ScheduledJob, UUID> {

    /**
     * Enabled schedules that are approved or need no approval.
     */
    @Query("""
            SELECT s FROM ScheduledJob s
            WHERE s.enabled = true
              AND (s.approvalRequired = false OR s.approvedAt IS NOT NULL)
            ORDER BY s.name
            """)
    List<ScheduledJob> findSchedulable();

    @Query("""
            SELECT s FROM ScheduledJob s
            WHERE s.approvalRequired = true
              AND s.approvedAt IS NULL
            ORDER BY s.startTime
            """)
    List<ScheduledJob> findAwaitingApproval();

    Optional<ScheduledJob> findByName(String name);

    /**
     * Records one run in a single statement so concurrent dispatchers never lose an increment.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
            UPDATE ScheduledJob s
            SET s.totalRunCount = s.totalRunCount + 1,
                s.lastRunAt = :runAt
            WHERE s.id = :id
            """)
    int recordRun(@Param("id") UUID id, @Param("runAt") OffsetDateTime runAt);

    @Query("SELECT s.totalRunCount FROM ScheduledJob s WHERE s.id = :id")
    Optional<Integer> findTotalRunCount(@Param("id") UUID id);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("UPDATE ScheduledJob s SET s.enabled = false, s.lastRunAt = NULL WHERE s.id = :id")
    int disable(@Param("id") UUID id);
}
