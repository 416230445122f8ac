package org.mediarr.model.enums;

import lombok.Getter;

@Getter
public enum TaskType {
    DOWNLOAD_SYNC("Download Sync", "Poll download clients and advance download state"),
    RSS_SYNC("RSS Sync", "Fetch indexer RSS feeds and grab matching releases"),
    MISSING_SEARCH("Missing Search", "Search indexers for monitored items without a file"),
    CUTOFF_UNMET_SEARCH("Cutoff Unmet Search", "Search indexers for upgrades below the profile cutoff");

    private final String name;
    private final String description;

    TaskType(String name, String description) {
        this.name = name;
        this.description = description;
    }
}
