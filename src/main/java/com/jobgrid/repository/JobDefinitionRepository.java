package com.jobgrid.repository;

import com.jobgrid.model.JobDefinition;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface JobDefinitionRepository extends JpaRepository<JobDefinition, UUID> {

    Optional<JobDefinition> findByModuleNameAndJobClassName(String moduleName, String jobClassName);

    Optional<JobDefinition> findByName(String name);

    List<JobDefinition> findByInstalledTrue();
}
