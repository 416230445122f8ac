package org.mediarr.repository;

import org.mediarr.model.entity.ReleaseBlacklistEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public interface ReleaseBlacklistRepository extends JpaRepository<ReleaseBlacklistEntity, Long> {

    List<ReleaseBlacklistEntity> findAllByOrderByCreatedAtDesc();

    @Query("""
            SELECT COUNT(b) > 0 FROM ReleaseBlacklistEntity b
            WHERE b.movieId = :movieId
            AND LOWER(b.releaseTitle) = LOWER(:title)
            """)
    boolean existsForMovie(@Param("movieId") Long movieId, @Param("title") String title);

    @Query("""
            SELECT COUNT(b) > 0 FROM ReleaseBlacklistEntity b
            WHERE b.seriesId = :seriesId
            AND b.seasonNumber = :season
            AND ((:episode IS NULL AND b.episodeNumber IS NULL) OR b.episodeNumber = :episode)
            AND LOWER(b.releaseTitle) = LOWER(:title)
            """)
    boolean existsForEpisode(@Param("seriesId") Long seriesId,
                             @Param("season") Integer season,
                             @Param("episode") Integer episode,
                             @Param("title") String title);

    @Query("SELECT LOWER(b.releaseTitle) FROM ReleaseBlacklistEntity b WHERE b.movieId = :movieId")
    List<String> findTitlesForMovie(@Param("movieId") Long movieId);

    @Query("""
            SELECT LOWER(b.releaseTitle) FROM ReleaseBlacklistEntity b
            WHERE b.seriesId = :seriesId
            AND b.seasonNumber = :season
            AND (b.episodeNumber = :episode OR b.episodeNumber IS NULL)
            """)
    List<String> findTitlesForEpisode(@Param("seriesId") Long seriesId,
                                      @Param("season") Integer season,
                                      @Param("episode") Integer episode);

    @Modifying
    @Transactional
    int deleteByMovieId(Long movieId);

    @Modifying
    @Transactional
    int deleteBySeriesId(Long seriesId);
}
