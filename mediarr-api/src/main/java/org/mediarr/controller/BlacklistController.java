package org.mediarr.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.AllArgsConstructor;
import org.mediarr.mapper.BlacklistMapper;
import org.mediarr.model.dto.BlacklistEntry;
import org.mediarr.service.download.BlacklistService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@AllArgsConstructor
@RestController
@RequestMapping("/api/v1/blacklist")
@Tag(name = "Blacklist", description = "Releases that will not be grabbed again")
public class BlacklistController {

    private final BlacklistService blacklistService;
    private final BlacklistMapper blacklistMapper;

    @Operation(summary = "List blacklist entries")
    @GetMapping
    public ResponseEntity<List<BlacklistEntry>> getBlacklist() {
        return ResponseEntity.ok(blacklistMapper.toDtos(blacklistService.getAll()));
    }

    @Operation(summary = "Remove a blacklist entry")
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> removeEntry(@PathVariable Long id) {
        blacklistService.remove(id);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Clear a movie's blacklist")
    @DeleteMapping("/movie/{movieId}")
    public ResponseEntity<Map<String, Integer>> clearMovie(@PathVariable Long movieId) {
        return ResponseEntity.ok(Map.of("removed", blacklistService.clearForMovie(movieId)));
    }

    @Operation(summary = "Clear a series' blacklist")
    @DeleteMapping("/series/{seriesId}")
    public ResponseEntity<Map<String, Integer>> clearSeries(@PathVariable Long seriesId) {
        return ResponseEntity.ok(Map.of("removed", blacklistService.clearForSeries(seriesId)));
    }
}
