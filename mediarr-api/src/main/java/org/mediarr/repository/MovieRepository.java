package org.mediarr.repository;

import org.mediarr.model.entity.MovieEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MovieRepository extends JpaRepository<MovieEntity, Long> {

    List<MovieEntity> findByMonitoredTrueOrderByTitleAsc();

    List<MovieEntity> findByMonitoredTrueAndHasFileFalse();

    List<MovieEntity> findByMonitoredTrueAndHasFileTrue();
}
