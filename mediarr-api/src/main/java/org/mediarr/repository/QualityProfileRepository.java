package org.mediarr.repository;

import org.mediarr.model.entity.QualityProfileEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface QualityProfileRepository extends JpaRepository<QualityProfileEntity, Long> {
}
