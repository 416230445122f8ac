package org.mediarr.service.indexer;

import org.mediarr.model.dto.Release;
import org.mediarr.model.entity.IndexerEntity;
import org.mediarr.model.enums.IndexerKind;

import java.util.List;
import java.util.Map;

public interface IndexerDriver {

    IndexerKind getKind();

    /**
     * Issues one rate-limited API call with the given query parameters and returns the normalized releases.
     */
    List<Release> query(IndexerEntity indexer, Map<String, String> params);

    boolean testConnection(IndexerEntity indexer);
}
