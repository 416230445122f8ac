package org.mediarr.service.indexer;

import org.mediarr.config.AppProperties;
import org.mediarr.model.enums.DownloadProtocol;
import org.mediarr.model.enums.IndexerKind;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;

@Component
public class TorznabIndexerDriver extends AbstractNabIndexerDriver {

    public TorznabIndexerDriver(HttpClient httpClient, IndexerRateLimiter rateLimiter,
                                IndexerResponseParser responseParser, AppProperties appProperties) {
        super(httpClient, rateLimiter, responseParser, appProperties);
    }

    @Override
    public IndexerKind getKind() {
        return IndexerKind.TORZNAB;
    }

    /**
     * Torznab aggregators sometimes proxy usenet results: an NZB link, or a result without any
     * swarm or freeleech data, is treated as usenet.
     */
    @Override
    public DownloadProtocol resolve(String downloadUrl, Integer seeders, Double downloadVolumeFactor) {
        if (downloadUrl != null && downloadUrl.toLowerCase().contains(".nzb")) {
            return DownloadProtocol.USENET;
        }
        if (seeders == null && downloadVolumeFactor == null
                && (downloadUrl == null || !downloadUrl.startsWith("magnet:"))) {
            return DownloadProtocol.USENET;
        }
        return DownloadProtocol.TORRENT;
    }
}
