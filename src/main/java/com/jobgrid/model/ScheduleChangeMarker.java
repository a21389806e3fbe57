package com.jobgrid.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;

/**
 * Single row recording when the set of scheduled jobs last changed.
 */
@Entity
@Table(name = "jobgrid_schedule_changes")
public class ScheduleChangeMarker {

    public static final short IDENT = 1;

    @Id
    private short ident = IDENT;

    @Column(name = "last_update", nullable = false)
    private OffsetDateTime lastUpdate;

    public ScheduleChangeMarker() {
    }

    public ScheduleChangeMarker(OffsetDateTime lastUpdate) {
        this.lastUpdate = lastUpdate;
    }

    public short getIdent() {
        return ident;
    }

    public OffsetDateTime getLastUpdate() {
        return lastUpdate;
    }

    public void setLastUpdate(OffsetDateTime lastUpdate) {
        this.lastUpdate = lastUpdate;
    }
}
