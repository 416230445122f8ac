package org.mediarr.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.AllArgsConstructor;
import org.mediarr.mapper.DownloadMapper;
import org.mediarr.model.dto.Download;
import org.mediarr.model.dto.ImportResult;
import org.mediarr.service.download.DownloadService;
import org.mediarr.service.download.DownloadSyncService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@AllArgsConstructor
@RestController
@RequestMapping("/api/v1/downloads")
@Tag(name = "Downloads", description = "Tracked downloads and their lifecycle")
public class DownloadController {

    private final DownloadService downloadService;
    private final DownloadSyncService downloadSyncService;
    private final DownloadMapper downloadMapper;

    @Operation(summary = "List downloads", description = "All downloads, newest first.")
    @GetMapping
    public ResponseEntity<List<Download>> getDownloads(@Parameter(description = "Only non-terminal downloads") @RequestParam(defaultValue = "false") boolean activeOnly) {
        return ResponseEntity.ok(downloadMapper.toDtos(activeOnly ? downloadService.getActiveDownloads() : downloadService.getDownloads()));
    }

    @Operation(summary = "Get a download")
    @GetMapping("/{id}")
    public ResponseEntity<Download> getDownload(@PathVariable Long id) {
        return ResponseEntity.ok(downloadMapper.toDto(downloadService.getDownload(id)));
    }

    @Operation(summary = "Cancel a download", description = "Remove the download from its client and delete the record.")
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> cancelDownload(
            @PathVariable Long id,
            @Parameter(description = "Also delete downloaded files") @RequestParam(defaultValue = "false") boolean deleteFiles) {
        downloadService.cancel(id, deleteFiles);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Import a completed download", description = "Import a download that completed while auto-import was disabled.")
    @PostMapping("/{id}/import")
    public ResponseEntity<ImportResult> importDownload(@PathVariable Long id) {
        return ResponseEntity.ok(downloadSyncService.importCompleted(id));
    }
}
