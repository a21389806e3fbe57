package com.jobgrid.repository;

import com.jobgrid.model.JobDefinition;
import com.jobgrid.model.JobHook;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface JobHookRepository extends JpaRepository<JobHook, UUID> {

    Optional<JobHook> findByName(String name);

    @Query("""
            SELECT h FROM JobHook h
            WHERE :contentType MEMBER OF h.contentTypes
              AND h.enabled = true
              AND h.typeCreate = true
            ORDER BY h.name
            """)
    List<JobHook> findEnabledForCreate(@Param("contentType") String contentType);

    @Query("""
            SELECT h FROM JobHook h
            WHERE :contentType MEMBER OF h.contentTypes
              AND h.enabled = true
              AND h.typeUpdate = true
            ORDER BY h.name
            """)
    List<JobHook> findEnabledForUpdate(@Param("contentType") String contentType);

    @Query("""
            SELECT h FROM JobHook h
            WHERE :contentType MEMBER OF h.contentTypes
              AND h.enabled = true
              AND h.typeDelete = true
            ORDER BY h.name
            """)
    List<JobHook> findEnabledForDelete(@Param("contentType") String contentType);

    @Query("""
            SELECT h FROM JobHook h
            WHERE :contentType MEMBER OF h.contentTypes
              AND h.job = :job
            """)
    List<JobHook> findByContentTypeAndJob(@Param("contentType") String contentType, @Param("job") JobDefinition job);
}
