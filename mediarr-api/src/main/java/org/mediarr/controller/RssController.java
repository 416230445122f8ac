package org.mediarr.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.AllArgsConstructor;
import org.mediarr.mapper.RssReleaseMapper;
import org.mediarr.model.dto.CachedRelease;
import org.mediarr.model.dto.RssCacheStats;
import org.mediarr.service.rss.RssCacheService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@AllArgsConstructor
@RestController
@RequestMapping("/api/v1/rss")
@Tag(name = "RSS", description = "Cached RSS feed items")
public class RssController {

    private final RssCacheService rssCacheService;
    private final RssReleaseMapper rssReleaseMapper;

    @Operation(summary = "Recent feed items", description = "Most recently cached RSS items across all indexers.")
    @GetMapping("/releases")
    public ResponseEntity<List<CachedRelease>> getRecentReleases(@Parameter(description = "Maximum items") @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(rssReleaseMapper.toDtos(rssCacheService.recent(limit)));
    }

    @Operation(summary = "Cache statistics")
    @GetMapping("/stats")
    public ResponseEntity<RssCacheStats> getStats() {
        return ResponseEntity.ok(rssCacheService.stats());
    }
}
