package org.mediarr.repository;

import org.mediarr.model.entity.RssReleaseEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface RssReleaseRepository extends JpaRepository<RssReleaseEntity, Long> {

    boolean existsByIndexerIdAndGuid(Long indexerId, String guid);

    Optional<RssReleaseEntity> findByIndexerIdAndGuid(Long indexerId, String guid);

    List<RssReleaseEntity> findAllByOrderByCreatedAtDesc(Pageable pageable);

    long countByProcessedTrue();

    long countByGrabbedTrue();

    @Modifying
    @Query("DELETE FROM RssReleaseEntity r WHERE r.createdAt < :cutoff")
    int deleteCreatedBefore(@Param("cutoff") LocalDateTime cutoff);
}
