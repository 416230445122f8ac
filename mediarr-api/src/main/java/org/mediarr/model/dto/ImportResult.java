package org.mediarr.model.dto;

import java.util.List;

public record ImportResult(List<ImportedFile> files) {

    public boolean isEmpty() {
        return files == null || files.isEmpty();
    }
}
