package com.jobgrid.repository;

import com.jobgrid.model.JobLogEntry;
import com.jobgrid.model.LogLevel;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface JobLogEntryRepository extends JpaRepository<JobLogEntry, UUID> {

    List<JobLogEntry> findByJobResultIdOrderByCreatedAsc(UUID jobResultId);

    List<JobLogEntry> findByJobResultIdAndLogLevelOrderByCreatedAsc(UUID jobResultId, LogLevel logLevel);

    long countByJobResultId(UUID jobResultId);
}
