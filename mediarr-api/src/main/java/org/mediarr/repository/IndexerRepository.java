package org.mediarr.repository;

import org.mediarr.model.entity.IndexerEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface IndexerRepository extends JpaRepository<IndexerEntity, Long> {

    List<IndexerEntity> findByEnabledTrueAndEnableRssTrueOrderByPriorityAscIdAsc();

    List<IndexerEntity> findByEnabledTrueAndEnableAutomaticSearchTrueOrderByPriorityAscIdAsc();

    List<IndexerEntity> findByEnabledTrueAndEnableInteractiveSearchTrueOrderByPriorityAscIdAsc();
}
