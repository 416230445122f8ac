package org.mediarr.repository;

import org.mediarr.model.entity.EpisodeEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface EpisodeRepository extends JpaRepository<EpisodeEntity, Long> {

    Optional<EpisodeEntity> findBySeriesIdAndSeasonNumberAndEpisodeNumber(Long seriesId, int seasonNumber, int episodeNumber);

    List<EpisodeEntity> findBySeriesIdAndSeasonNumberOrderByEpisodeNumberAsc(Long seriesId, int seasonNumber);

    @Query("""
            SELECT e FROM EpisodeEntity e, SeriesEntity s
            WHERE e.seriesId = s.id
            AND s.monitored = true
            AND e.monitored = true
            AND e.hasFile = false
            AND (e.airDate IS NULL OR e.airDate <= :today)
            ORDER BY e.seriesId, e.seasonNumber, e.episodeNumber
            """)
    List<EpisodeEntity> findMissingAired(@Param("today") LocalDate today);

    @Query("""
            SELECT e FROM EpisodeEntity e, SeriesEntity s
            WHERE e.seriesId = s.id
            AND s.monitored = true
            AND e.monitored = true
            AND e.hasFile = true
            ORDER BY e.seriesId, e.seasonNumber, e.episodeNumber
            """)
    List<EpisodeEntity> findMonitoredWithFile();
}
