package org.mediarr.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.AllArgsConstructor;
import org.mediarr.service.download.client.DownloadClientService;
import org.mediarr.service.indexer.IndexerService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@AllArgsConstructor
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Connections", description = "Connectivity checks for indexers and download clients")
public class IndexerController {

    private final IndexerService indexerService;
    private final DownloadClientService downloadClientService;

    @Operation(summary = "Test an indexer", description = "Request the indexer's capabilities document.")
    @PostMapping("/indexers/{id}/test")
    public ResponseEntity<Map<String, Boolean>> testIndexer(@PathVariable Long id) {
        return ResponseEntity.ok(Map.of("success", indexerService.testIndexer(id)));
    }

    @Operation(summary = "Test a download client")
    @PostMapping("/download-clients/{id}/test")
    public ResponseEntity<Map<String, Boolean>> testDownloadClient(@PathVariable Long id) {
        return ResponseEntity.ok(Map.of("success", downloadClientService.testClient(id)));
    }
}
