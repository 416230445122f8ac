package org.mediarr.service.download.client;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.mediarr.exception.ApiError;
import org.mediarr.model.dto.AddDownloadRequest;
import org.mediarr.model.dto.AddDownloadResult;
import org.mediarr.model.dto.ClientDownload;
import org.mediarr.model.entity.DownloadClientEntity;
import org.mediarr.model.enums.DownloadClientType;
import org.mediarr.model.enums.DownloadProtocol;
import org.mediarr.model.enums.MediaKind;
import org.mediarr.repository.DownloadClientRepository;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
public class DownloadClientService {

    private final DownloadClientRepository downloadClientRepository;
    private final Map<DownloadClientType, DownloadClientDriver> drivers = new EnumMap<>(DownloadClientType.class);

    public DownloadClientService(DownloadClientRepository downloadClientRepository, List<DownloadClientDriver> clientDrivers) {
        this.downloadClientRepository = downloadClientRepository;
        clientDrivers.forEach(driver -> drivers.put(driver.getType(), driver));
    }

    public AddDownloadResult addDownload(AddDownloadRequest request) {
        DownloadProtocol protocol = request.getProtocol() != null ? request.getProtocol() : inferProtocol(request.getUrl());
        Optional<DownloadClientEntity> client = selectClient(request.getClientId(), protocol);
        if (client.isEmpty()) {
            log.warn("No download client available for {} release '{}'", protocol, request.getTitle());
            return AddDownloadResult.failure("No enabled download client available for " + protocol);
        }
        DownloadClientEntity selected = client.get();
        try {
            return driver(selected).add(selected, request.getUrl(), request.getTitle(),
                    categoryFor(selected, request.getMediaKind()), request.getSavePath());
        } catch (Exception e) {
            log.error("Download client {} failed to add '{}': {}", selected.getName(), request.getTitle(), e.getMessage());
            return AddDownloadResult.failure(e.getMessage());
        }
    }

    public List<ClientDownload> listActive(Long clientId, String category) {
        DownloadClientEntity client = getClient(clientId);
        return driver(client).list(client, category);
    }

    public List<ClientDownload> listActive(DownloadClientEntity client) {
        return driver(client).list(client, null);
    }

    public boolean remove(Long clientId, String handle, boolean deleteFiles) {
        DownloadClientEntity client = getClient(clientId);
        return driver(client).remove(client, handle, deleteFiles);
    }

    public boolean testClient(Long clientId) {
        DownloadClientEntity client = getClient(clientId);
        return driver(client).testConnection(client);
    }

    public List<DownloadClientEntity> getEnabledClients() {
        return downloadClientRepository.findByEnabledTrueOrderByPriorityAscIdAsc();
    }

    public Optional<DownloadClientEntity> findClient(Long clientId) {
        return clientId == null ? Optional.empty() : downloadClientRepository.findById(clientId);
    }

    /**
     * Explicit client first, then the highest-priority client speaking the release's protocol,
     * then any enabled client.
     */
    Optional<DownloadClientEntity> selectClient(Long clientId, DownloadProtocol protocol) {
        if (clientId != null) {
            return downloadClientRepository.findById(clientId).filter(DownloadClientEntity::isEnabled);
        }
        Optional<DownloadClientEntity> byProtocol = downloadClientRepository
                .findFirstByTypeAndEnabledTrueOrderByPriorityAscIdAsc(DownloadClientType.forProtocol(protocol));
        if (byProtocol.isPresent()) {
            return byProtocol;
        }
        return getEnabledClients().stream().findFirst();
    }

    static DownloadProtocol inferProtocol(String url) {
        String lower = StringUtils.defaultString(url).toLowerCase();
        if (lower.contains(".nzb") || lower.contains("getnzb") || lower.contains("t=get")) {
            return DownloadProtocol.USENET;
        }
        return DownloadProtocol.TORRENT;
    }

    static String categoryFor(DownloadClientEntity client, MediaKind mediaKind) {
        boolean movie = mediaKind == MediaKind.MOVIE;
        String specific = movie ? client.getCategoryMovies() : client.getCategoryTv();
        if (StringUtils.isNotBlank(specific)) {
            return specific;
        }
        if (StringUtils.isNotBlank(client.getCategory())) {
            return client.getCategory();
        }
        if (client.getType() == DownloadClientType.QBITTORRENT) {
            return movie ? "movies" : "tv";
        }
        return null;
    }

    private DownloadClientEntity getClient(Long clientId) {
        return downloadClientRepository.findById(clientId)
                .orElseThrow(() -> ApiError.DOWNLOAD_CLIENT_NOT_FOUND.createException(clientId));
    }

    private DownloadClientDriver driver(DownloadClientEntity client) {
        DownloadClientDriver driver = drivers.get(client.getType());
        if (driver == null) {
            throw new DownloadClientException("Unsupported download client type: " + client.getType());
        }
        return driver;
    }
}
