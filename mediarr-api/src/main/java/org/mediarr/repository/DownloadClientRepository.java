package org.mediarr.repository;

import org.mediarr.model.entity.DownloadClientEntity;
import org.mediarr.model.enums.DownloadClientType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DownloadClientRepository extends JpaRepository<DownloadClientEntity, Long> {

    List<DownloadClientEntity> findByEnabledTrueOrderByPriorityAscIdAsc();

    Optional<DownloadClientEntity> findFirstByTypeAndEnabledTrueOrderByPriorityAscIdAsc(DownloadClientType type);
}
