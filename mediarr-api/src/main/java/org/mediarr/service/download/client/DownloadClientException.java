package org.mediarr.service.download.client;

public class DownloadClientException extends RuntimeException {

    public DownloadClientException(String message) {
        super(message);
    }

    public DownloadClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
