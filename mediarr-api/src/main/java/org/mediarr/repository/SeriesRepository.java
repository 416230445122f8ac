package org.mediarr.repository;

import org.mediarr.model.entity.SeriesEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SeriesRepository extends JpaRepository<SeriesEntity, Long> {

    List<SeriesEntity> findByMonitoredTrueOrderByTitleAsc();
}
