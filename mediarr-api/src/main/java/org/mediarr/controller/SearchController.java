package org.mediarr.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import org.mediarr.mapper.DownloadMapper;
import org.mediarr.model.dto.Download;
import org.mediarr.model.dto.GrabResult;
import org.mediarr.model.dto.Release;
import org.mediarr.model.dto.request.GrabRequest;
import org.mediarr.model.enums.SearchType;
import org.mediarr.service.download.GrabService;
import org.mediarr.service.indexer.IndexerService;
import org.mediarr.service.search.AutoSearchService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@AllArgsConstructor
@RestController
@RequestMapping("/api/v1/search")
@Tag(name = "Search", description = "Interactive indexer search and manual grabs")
public class SearchController {

    private final IndexerService indexerService;
    private final GrabService grabService;
    private final AutoSearchService autoSearchService;
    private final DownloadMapper downloadMapper;

    @Operation(summary = "Search movies", description = "Query every interactive-search indexer for a movie title.")
    @GetMapping("/movie")
    public ResponseEntity<List<Release>> searchMovie(
            @Parameter(description = "Movie title") @RequestParam String title,
            @Parameter(description = "Release year") @RequestParam(required = false) Integer year) {
        return ResponseEntity.ok(indexerService.searchMovies(title, year, SearchType.INTERACTIVE));
    }

    @Operation(summary = "Search TV", description = "Query every interactive-search indexer for a series, season or episode.")
    @GetMapping("/tv")
    public ResponseEntity<List<Release>> searchTv(
            @Parameter(description = "Series title") @RequestParam String title,
            @Parameter(description = "Season number") @RequestParam(required = false) Integer season,
            @Parameter(description = "Episode number") @RequestParam(required = false) Integer episode) {
        return ResponseEntity.ok(indexerService.searchTv(title, season, episode, SearchType.INTERACTIVE));
    }

    @Operation(summary = "Grab a release", description = "Send a chosen release to a download client. Conflicts return 409.")
    @PostMapping("/grab")
    public ResponseEntity<Download> grab(@RequestBody @Valid GrabRequest request) {
        Download download = downloadMapper.toDto(grabService.grabInteractive(request.toRelease(), request.toTarget(), request.getClientId()));
        return ResponseEntity.status(HttpStatus.CREATED).body(download);
    }

    @Operation(summary = "Automatic movie search", description = "Search for a movie and grab the best acceptable release.")
    @PostMapping("/movie/{movieId}/auto")
    public ResponseEntity<Map<String, Object>> autoSearchMovie(
            @PathVariable Long movieId,
            @Parameter(description = "Search even if the cutoff is met") @RequestParam(defaultValue = "false") boolean forceUpgrade) {
        return ResponseEntity.ok(toResponse(autoSearchService.searchAndGrabMovie(movieId, forceUpgrade)));
    }

    @Operation(summary = "Automatic episode search", description = "Search for an episode and grab the best acceptable release.")
    @PostMapping("/series/{seriesId}/season/{season}/episode/{episode}/auto")
    public ResponseEntity<Map<String, Object>> autoSearchEpisode(@PathVariable Long seriesId, @PathVariable int season, @PathVariable int episode) {
        return ResponseEntity.ok(toResponse(autoSearchService.searchAndGrabEpisode(seriesId, season, episode)));
    }

    @Operation(summary = "Automatic season search", description = "Search for a season pack, falling back to missing episodes.")
    @PostMapping("/series/{seriesId}/season/{season}/auto")
    public ResponseEntity<Map<String, Object>> autoSearchSeason(@PathVariable Long seriesId, @PathVariable int season) {
        return ResponseEntity.ok(toResponse(autoSearchService.searchAndGrabSeason(seriesId, season)));
    }

    private Map<String, Object> toResponse(Optional<GrabResult> result) {
        if (result.isEmpty()) {
            return Map.of("grabbed", false, "message", "No acceptable release found");
        }
        GrabResult grab = result.get();
        if (grab.download() == null) {
            return Map.of("grabbed", grab.isGrabbed(), "outcome", grab.outcome(), "message", String.valueOf(grab.message()));
        }
        return Map.of("grabbed", grab.isGrabbed(), "outcome", grab.outcome(), "message", String.valueOf(grab.message()),
                "download", downloadMapper.toDto(grab.download()));
    }
}
