package org.mediarr.repository;

import org.mediarr.model.entity.ExclusionEntity;
import org.mediarr.model.enums.MediaKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ExclusionRepository extends JpaRepository<ExclusionEntity, Long> {

    boolean existsByExternalIdAndMediaKind(Long externalId, MediaKind mediaKind);
}
