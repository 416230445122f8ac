package org.mediarr.service.indexer;

import org.mediarr.model.enums.DownloadProtocol;

@FunctionalInterface
public interface ProtocolResolver {

    DownloadProtocol resolve(String downloadUrl, Integer seeders, Double downloadVolumeFactor);
}
