package org.mediarr.service.importer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.mediarr.config.AppProperties;
import org.mediarr.exception.ApiError;
import org.mediarr.model.dto.ClientDownload;
import org.mediarr.model.dto.ImportResult;
import org.mediarr.model.dto.ImportedFile;
import org.mediarr.model.dto.ParsedEpisode;
import org.mediarr.model.dto.WantedItem;
import org.mediarr.model.entity.DownloadEntity;
import org.mediarr.model.enums.MediaKind;
import org.mediarr.model.enums.Quality;
import org.mediarr.service.library.LibraryService;
import org.mediarr.service.release.ReleaseParser;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Places the video files of a completed download into the library and records them on the target.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImportService {

    static final Set<String> VIDEO_EXTENSIONS = Set.of(".mkv", ".mp4", ".avi", ".m4v", ".wmv", ".mov", ".ts", ".m2ts");

    private final LibraryService libraryService;
    private final AppProperties appProperties;

    public ImportResult importDownload(DownloadEntity download, ClientDownload clientItem) {
        Path source = resolveSourcePath(download, clientItem)
                .orElseThrow(() -> ApiError.IMPORT_FAILED.createException("Download output not found for '" + download.getTitle() + "'"));
        List<Path> videos = findVideoFiles(source);
        if (videos.isEmpty()) {
            throw ApiError.IMPORT_FAILED.createException("No video files found in " + source);
        }
        log.info("[Import] Importing '{}' from {} ({} video file(s))", download.getTitle(), source, videos.size());

        List<ImportedFile> imported = download.getMediaKind() == MediaKind.MOVIE
                ? List.of(importMovie(download, videos.get(0)))
                : importEpisodes(download, videos);
        if (imported.isEmpty()) {
            throw ApiError.IMPORT_FAILED.createException("No file matched a wanted episode for '" + download.getTitle() + "'");
        }
        return new ImportResult(imported);
    }

    Optional<Path> resolveSourcePath(DownloadEntity download, ClientDownload clientItem) {
        List<Path> candidates = new ArrayList<>();
        if (clientItem != null) {
            if (StringUtils.isNotBlank(clientItem.getContentPath())) {
                candidates.add(Path.of(clientItem.getContentPath()));
            }
            if (StringUtils.isNotBlank(clientItem.getSavePath()) && StringUtils.isNotBlank(clientItem.getName())) {
                candidates.add(Path.of(clientItem.getSavePath(), clientItem.getName()));
            }
        }
        if (StringUtils.isNotBlank(download.getSavePath())) {
            candidates.add(Path.of(download.getSavePath(), download.getTitle()));
            candidates.add(Path.of(download.getSavePath()));
        }
        return candidates.stream().filter(Files::exists).findFirst();
    }

    /**
     * Video files under the path, largest first. Sample clips are skipped.
     */
    List<Path> findVideoFiles(Path source) {
        if (Files.isRegularFile(source)) {
            return isVideo(source) ? List.of(source) : List.of();
        }
        try (Stream<Path> walk = Files.walk(source)) {
            return walk.filter(Files::isRegularFile)
                    .filter(ImportService::isVideo)
                    .filter(p -> !p.getFileName().toString().toLowerCase(Locale.ROOT).contains("sample"))
                    .sorted(Comparator.comparingLong(ImportService::sizeOf).reversed())
                    .toList();
        } catch (IOException e) {
            log.error("[Import] Failed to scan {}", source, e);
            throw ApiError.IMPORT_FAILED.createException("Failed to scan " + source + ": " + e.getMessage());
        }
    }

    private ImportedFile importMovie(DownloadEntity download, Path video) {
        Path destination = transfer(video, libraryService.movieFolder(download.getMovieId()));
        ImportedFile file = describe(download, video, destination, null);
        libraryService.markMovieFile(download.getMovieId(), file);
        return file;
    }

    private List<ImportedFile> importEpisodes(DownloadEntity download, List<Path> videos) {
        List<ImportedFile> imported = new ArrayList<>();
        boolean seasonPack = download.getMediaKind() == MediaKind.SEASON;
        for (Path video : videos) {
            Optional<ParsedEpisode> parsed = ReleaseParser.parseEpisode(video.getFileName().toString());
            int season;
            int episode;
            if (parsed.isPresent()) {
                season = parsed.get().season();
                episode = parsed.get().episode();
            } else if (!seasonPack && videos.size() == 1) {
                season = download.getSeasonNumber();
                episode = download.getEpisodeNumber();
            } else {
                log.debug("[Import] No episode number in {}, skipping", video.getFileName());
                continue;
            }

            if (season != download.getSeasonNumber() || (!seasonPack && episode != download.getEpisodeNumber())) {
                log.debug("[Import] {} does not belong to {}", video.getFileName(), download.getTitle());
                continue;
            }
            Optional<WantedItem> wanted = libraryService.findEpisode(download.getSeriesId(), season, episode);
            if (wanted.isEmpty() || (seasonPack && !wanted.get().isMonitored())) {
                log.debug("[Import] Skipping S{}E{} of series {}: not in library or not monitored", season, episode, download.getSeriesId());
                continue;
            }

            Path destination = transfer(video, libraryService.seasonFolder(download.getSeriesId(), season));
            ImportedFile file = describe(download, video, destination, new ParsedEpisode(season, episode));
            libraryService.markEpisodeFile(download.getSeriesId(), season, episode, file);
            imported.add(file);
            if (!seasonPack) {
                break;
            }
        }
        return imported;
    }

    private Path transfer(Path source, Path folder) {
        Path destination = folder.resolve(source.getFileName().toString());
        try {
            Files.createDirectories(folder);
            if (appProperties.getImporter().isUseHardlinks()) {
                Files.deleteIfExists(destination);
                Files.createLink(destination, source);
            } else {
                Files.copy(source, destination, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("[Import] Placed {} at {}", source, destination);
            return destination;
        } catch (IOException e) {
            log.error("[Import] Failed to place {} at {}", source, destination, e);
            throw ApiError.IMPORT_FAILED.createException("Failed to place " + source.getFileName() + ": " + e.getMessage());
        }
    }

    private ImportedFile describe(DownloadEntity download, Path source, Path destination, ParsedEpisode episode) {
        String fileName = source.getFileName().toString();
        Quality quality = ReleaseParser.detectQuality(fileName);
        if (quality == Quality.UNKNOWN) {
            quality = ReleaseParser.detectQuality(download.getTitle());
        }
        String group = ReleaseParser.parseReleaseGroup(fileName);
        return ImportedFile.builder()
                .sourcePath(source.toString())
                .path(destination.toString())
                .size(sizeOf(source))
                .quality(quality == Quality.UNKNOWN && download.getQuality() != null ? download.getQuality() : quality.getLabel())
                .videoCodec(ReleaseParser.parseVideoCodec(fileName))
                .audioCodec(ReleaseParser.parseAudioCodec(fileName))
                .releaseGroup(group != null ? group : ReleaseParser.parseReleaseGroup(download.getTitle()))
                .proper(ReleaseParser.isProper(fileName) || ReleaseParser.isProper(download.getTitle()))
                .repack(ReleaseParser.isRepack(fileName) || ReleaseParser.isRepack(download.getTitle()))
                .season(episode != null ? episode.season() : null)
                .episode(episode != null ? episode.episode() : null)
                .build();
    }

    private static boolean isVideo(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot >= 0 && VIDEO_EXTENSIONS.contains(name.substring(dot));
    }

    private static long sizeOf(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            return 0L;
        }
    }
}
