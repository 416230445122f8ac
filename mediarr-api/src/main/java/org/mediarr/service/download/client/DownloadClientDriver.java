package org.mediarr.service.download.client;

import org.mediarr.model.dto.AddDownloadResult;
import org.mediarr.model.dto.ClientDownload;
import org.mediarr.model.entity.DownloadClientEntity;
import org.mediarr.model.enums.DownloadClientType;

import java.util.List;

public interface DownloadClientDriver {

    DownloadClientType getType();

    /**
     * Submits a release. The returned handle may be null when the client does not report one synchronously.
     */
    AddDownloadResult add(DownloadClientEntity client, String url, String title, String category, String savePath);

    List<ClientDownload> list(DownloadClientEntity client, String category);

    boolean remove(DownloadClientEntity client, String handle, boolean deleteFiles);

    boolean testConnection(DownloadClientEntity client);
}
