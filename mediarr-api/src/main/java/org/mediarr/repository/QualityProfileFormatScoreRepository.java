package org.mediarr.repository;

import org.mediarr.model.entity.QualityProfileFormatScoreEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface QualityProfileFormatScoreRepository extends JpaRepository<QualityProfileFormatScoreEntity, Long> {

    List<QualityProfileFormatScoreEntity> findByQualityProfileId(Long qualityProfileId);

    Optional<QualityProfileFormatScoreEntity> findByQualityProfileIdAndCustomFormatId(Long qualityProfileId, Long customFormatId);
}
