package org.mediarr.repository;

import org.mediarr.model.entity.DownloadEntity;
import org.mediarr.model.enums.DownloadStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface DownloadRepository extends JpaRepository<DownloadEntity, Long> {

    List<DownloadEntity> findByStatusInOrderByCreatedAtAsc(Collection<DownloadStatus> statuses);

    List<DownloadEntity> findAllByOrderByCreatedAtDesc();

    Optional<DownloadEntity> findFirstByMovieIdAndStatusIn(Long movieId, Collection<DownloadStatus> statuses);

    @Query("""
            SELECT d FROM DownloadEntity d
            WHERE d.seriesId = :seriesId
            AND d.seasonNumber = :season
            AND (d.episodeNumber = :episode OR d.episodeNumber IS NULL)
            AND d.status IN :statuses
            """)
    List<DownloadEntity> findActiveForEpisode(@Param("seriesId") Long seriesId,
                                              @Param("season") Integer season,
                                              @Param("episode") Integer episode,
                                              @Param("statuses") Collection<DownloadStatus> statuses);

    List<DownloadEntity> findBySeriesIdAndSeasonNumberAndStatusIn(Long seriesId, Integer seasonNumber, Collection<DownloadStatus> statuses);

    boolean existsByDownloadUrlAndStatusIn(String downloadUrl, Collection<DownloadStatus> statuses);
}
