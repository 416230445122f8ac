package org.mediarr.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ApiError {
    GENERIC_BAD_REQUEST(HttpStatus.BAD_REQUEST, "%s"),
    INDEXER_NOT_FOUND(HttpStatus.NOT_FOUND, "Indexer not found with ID: %s"),
    INDEXER_ERROR(HttpStatus.BAD_GATEWAY, "Indexer %s failed: %s"),
    DOWNLOAD_NOT_FOUND(HttpStatus.NOT_FOUND, "Download not found with ID: %s"),
    DOWNLOAD_CLIENT_NOT_FOUND(HttpStatus.NOT_FOUND, "Download client not found with ID: %s"),
    NO_DOWNLOAD_CLIENT(HttpStatus.SERVICE_UNAVAILABLE, "No enabled download client available for %s"),
    DOWNLOAD_CLIENT_ERROR(HttpStatus.BAD_GATEWAY, "Download client rejected the release: %s"),
    MOVIE_NOT_FOUND(HttpStatus.NOT_FOUND, "Movie not found with ID: %s"),
    EPISODE_NOT_FOUND(HttpStatus.NOT_FOUND, "Episode S%02dE%02d not found for series %s"),
    QUALITY_PROFILE_NOT_FOUND(HttpStatus.NOT_FOUND, "Quality profile not found with ID: %s"),
    CUSTOM_FORMAT_INVALID(HttpStatus.BAD_REQUEST, "Invalid custom format: %s"),
    ACTIVE_DOWNLOAD_EXISTS(HttpStatus.CONFLICT, "An active download already exists for %s"),
    RELEASE_ALREADY_DOWNLOADING(HttpStatus.CONFLICT, "Release is already downloading: %s"),
    RELEASE_BLACKLISTED(HttpStatus.CONFLICT, "Release is blacklisted: %s"),
    BLACKLIST_ENTRY_NOT_FOUND(HttpStatus.NOT_FOUND, "Blacklist entry not found with ID: %s"),
    IMPORT_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "Import failed: %s"),
    TASK_NOT_FOUND(HttpStatus.NOT_FOUND, "No task registered for type: %s");

    private final HttpStatus status;
    private final String message;

    ApiError(HttpStatus status, String message) {
        this.status = status;
        this.message = message;
    }

    public APIException createException(Object... details) {
        String formattedMessage = (details.length > 0) ? String.format(message, details) : message;
        return new APIException(formattedMessage, this.status);
    }
}
