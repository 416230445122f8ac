package org.mediarr.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.AllArgsConstructor;
import org.mediarr.model.entity.CustomFormatEntity;
import org.mediarr.model.enums.FormatMediaType;
import org.mediarr.service.customformat.CustomFormatImportService;
import org.mediarr.service.customformat.CustomFormatService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@AllArgsConstructor
@RestController
@RequestMapping("/api/v1/custom-formats")
@Tag(name = "Custom Formats", description = "Custom format import and scoring")
public class CustomFormatController {

    private final CustomFormatImportService customFormatImportService;
    private final CustomFormatService customFormatService;

    @Operation(summary = "Import a custom format", description = "Import a TRaSH-guides style custom format JSON document.")
    @PostMapping(value = "/import", consumes = "application/json")
    public ResponseEntity<CustomFormatEntity> importFormat(
            @RequestBody String json,
            @Parameter(description = "Media type the format applies to") @RequestParam(defaultValue = "BOTH") FormatMediaType mediaType,
            @Parameter(description = "Profile that receives the default score") @RequestParam(required = false) Long profileId) {
        return ResponseEntity.ok(customFormatImportService.importFormat(json, mediaType, profileId));
    }

    @Operation(summary = "Set a format score for a profile")
    @PutMapping("/{formatId}/scores/{profileId}")
    public ResponseEntity<Map<String, Integer>> setScore(@PathVariable Long formatId, @PathVariable Long profileId, @RequestParam int score) {
        return ResponseEntity.ok(Map.of("score", customFormatService.setScore(profileId, formatId, score).getScore()));
    }
}
