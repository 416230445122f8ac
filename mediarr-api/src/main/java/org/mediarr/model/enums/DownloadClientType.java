package org.mediarr.model.enums;

import lombok.Getter;

@Getter
public enum DownloadClientType {
    QBITTORRENT(DownloadProtocol.TORRENT),
    SABNZBD(DownloadProtocol.USENET);

    private final DownloadProtocol protocol;

    DownloadClientType(DownloadProtocol protocol) {
        this.protocol = protocol;
    }

    public static DownloadClientType forProtocol(DownloadProtocol protocol) {
        return protocol == DownloadProtocol.USENET ? SABNZBD : QBITTORRENT;
    }
}
