package com.jobgrid.model;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Runs a hook receiver job whenever an object of one of the listed content types changes.
 */
@Entity
@Table(name = "jobgrid_job_hooks")
public class JobHook {

    @Id
    private UUID id;

    @Column(nullable = false, unique = true)
    private String name;

    private boolean enabled = true;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "job_definition_id", nullable = false)
    private JobDefinition job;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "jobgrid_job_hook_content_types", joinColumns = @JoinColumn(name = "job_hook_id"))
    @Column(name = "content_type", nullable = false)
    private Set<String> contentTypes = new LinkedHashSet<>();

    @Column(name = "type_create")
    private boolean typeCreate = false;

    @Column(name = "type_update")
    private boolean typeUpdate = false;

    @Column(name = "type_delete")
    private boolean typeDelete = false;

    public JobHook() {
    }

    public JobHook(String name, JobDefinition job, Set<String> contentTypes) {
        this.id = UUID.randomUUID();
        this.name = name;
        this.job = job;
        setContentTypes(contentTypes);
    }

    public boolean handles(ObjectChangeAction action) {
        return switch (action) {
            case CREATE -> typeCreate;
            case UPDATE -> typeUpdate;
            case DELETE -> typeDelete;
        };
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public JobDefinition getJob() {
        return job;
    }

    public void setJob(JobDefinition job) {
        this.job = job;
    }

    public Set<String> getContentTypes() {
        return contentTypes;
    }

    public void setContentTypes(Set<String> contentTypes) {
        this.contentTypes = contentTypes == null ? new LinkedHashSet<>() : new LinkedHashSet<>(contentTypes);
    }

    public boolean isTypeCreate() {
        return typeCreate;
    }

    public void setTypeCreate(boolean typeCreate) {
        this.typeCreate = typeCreate;
    }

    public boolean isTypeUpdate() {
        return typeUpdate;
    }

    public void setTypeUpdate(boolean typeUpdate) {
        this.typeUpdate = typeUpdate;
    }

    public boolean isTypeDelete() {
        return typeDelete;
    }

    public void setTypeDelete(boolean typeDelete) {
        this.typeDelete = typeDelete;
    }

    @Override
    public String toString() {
        return name;
    }
}
