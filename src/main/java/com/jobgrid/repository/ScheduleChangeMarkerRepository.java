package com.jobgrid.repository;

import com.jobgrid.model.ScheduleChangeMarker;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ScheduleChangeMarkerRepository extends JpaRepository<ScheduleChangeMarker, Short> {
}
