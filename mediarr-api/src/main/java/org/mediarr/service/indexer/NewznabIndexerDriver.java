package org.mediarr.service.indexer;

import org.mediarr.config.AppProperties;
import org.mediarr.model.enums.DownloadProtocol;
import org.mediarr.model.enums.IndexerKind;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;

@Component
public class NewznabIndexerDriver extends AbstractNabIndexerDriver {

    public NewznabIndexerDriver(HttpClient httpClient, IndexerRateLimiter rateLimiter,
                                IndexerResponseParser responseParser, AppProperties appProperties) {
        super(httpClient, rateLimiter, responseParser, appProperties);
    }

    @Override
    public IndexerKind getKind() {
        return IndexerKind.NEWZNAB;
    }

    @Override
    public DownloadProtocol resolve(String downloadUrl, Integer seeders, Double downloadVolumeFactor) {
        return DownloadProtocol.USENET;
    }
}
