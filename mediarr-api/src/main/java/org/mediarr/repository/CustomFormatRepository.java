package org.mediarr.repository;

import org.mediarr.model.entity.CustomFormatEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CustomFormatRepository extends JpaRepository<CustomFormatEntity, Long> {

    Optional<CustomFormatEntity> findByExternalId(String externalId);

    Optional<CustomFormatEntity> findByNameIgnoreCase(String name);
}
