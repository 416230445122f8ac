package org.mediarr.config;

import lombok.Getter;
import lombok.Setter;
import org.mediarr.model.enums.PropersPreference;
import org.mediarr.service.release.TitleMatchOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {
    private String version;
    private Indexer indexer = new Indexer();
    private Rss rss = new Rss();
    private Download download = new Download();
    private Matching matching = new Matching();
    private Scheduling scheduling = new Scheduling();
    private Import importer = new Import();

    @Getter
    @Setter
    public static class Indexer {
        private long globalMinIntervalMs = 1000;
        private long perIndexerMinIntervalMs = 3000;
        private long searchMinIntervalMs = 2000;
        private int requestTimeoutSeconds = 30;
        private int rssLimit = 100;
        private int defaultPriority = 50;
    }

    @Getter
    @Setter
    public static class Rss {
        private int cacheRetentionDays = 7;
    }

    @Getter
    @Setter
    public static class Download {
        private boolean redownloadFailed = true;
        private boolean autoImport = true;
        private int handleDiscoveryAttempts = 3;
        private long handleDiscoveryDelayMs = 1000;
        private long handleDiscoveryTimeoutMinutes = 30;
        private PropersPreference propersRepacks = PropersPreference.PREFER_AND_UPGRADE;
    }

    /**
     * Title matching strictness per call site. Each caller historically used its own
     * thresholds, so they stay separate rather than being folded into one profile.
     */
    @Getter
    @Setter
    public static class Matching {
        private TitleMatchOptions rss = TitleMatchOptions.rssDefaults();
        private TitleMatchOptions autoSearch = TitleMatchOptions.autoSearchDefaults();
        private TitleMatchOptions indexerFilter = TitleMatchOptions.indexerFilterDefaults();
    }

    @Getter
    @Setter
    public static class Scheduling {
        private boolean enabled = true;
        private long downloadSyncIntervalMs = 5000;
        private long rssSyncIntervalMs = 900000;
        private long missingSearchIntervalMs = 3600000;
        private long cutoffSearchIntervalMs = 21600000;
    }

    @Getter
    @Setter
    public static class Import {
        private String moviesRoot = "/media/movies";
        private String seriesRoot = "/media/tv";
        private boolean useHardlinks = false;
    }
}
