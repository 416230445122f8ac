package org.mediarr.model.enums;

public enum DownloadProtocol {
    TORRENT,
    USENET
}
