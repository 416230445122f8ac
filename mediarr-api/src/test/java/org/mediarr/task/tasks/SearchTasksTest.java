package org.mediarr.task.tasks;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mediarr.model.dto.WantedItem;
import org.mediarr.model.dto.request.TaskCreateRequest;
import org.mediarr.model.dto.response.TaskCreateResponse;
import org.mediarr.model.enums.TaskType;
import org.mediarr.service.library.LibraryService;
import org.mediarr.service.search.AutoSearchService;
import org.mediarr.task.TaskStatus;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SearchTasksTest {

    @Mock
    private AutoSearchService autoSearchService;

    @Mock
    private LibraryService libraryService;

    private MissingSearchTask missingSearchTask;
    private CutoffUnmetSearchTask cutoffUnmetSearchTask;

    @BeforeEach
    void setUp() {
        missingSearchTask = new MissingSearchTask(autoSearchService, libraryService);
        cutoffUnmetSearchTask = new CutoffUnmetSearchTask(autoSearchService);
    }

    @Test
    void missingSearch_shouldReportGrabbedCount() {
        when(autoSearchService.searchAllMissing()).thenReturn(1);

        TaskCreateResponse response = missingSearchTask.execute(new TaskCreateRequest());

        assertEquals(TaskType.MISSING_SEARCH, response.getTaskType());
        assertEquals(TaskStatus.COMPLETED, response.getStatus());
        assertEquals("Grabbed 1 release", response.getMessage());
    }

    @Test
    void missingSearch_metadataCountsMoviesAndEpisodes() {
        when(libraryService.findMissingMovies()).thenReturn(List.of(WantedItem.builder().build()));
        when(libraryService.findMissingEpisodes()).thenReturn(List.of(WantedItem.builder().build(), WantedItem.builder().build()));

        assertEquals("Missing items: 3", missingSearchTask.getMetadata());
    }

    @Test
    void cutoffSearch_shouldReportUpgrades() {
        when(autoSearchService.searchCutoffUnmet()).thenReturn(0);

        TaskCreateResponse response = cutoffUnmetSearchTask.execute(new TaskCreateRequest());

        assertEquals(TaskType.CUTOFF_UNMET_SEARCH, response.getTaskType());
        assertEquals("Grabbed 0 upgrades", response.getMessage());
        assertNull(cutoffUnmetSearchTask.getMetadata());
    }

    @Test
    void cutoffSearch_shouldReturnFailed_whenSearchThrows() {
        when(autoSearchService.searchCutoffUnmet()).thenThrow(new IllegalStateException("no indexers"));

        assertEquals(TaskStatus.FAILED, cutoffUnmetSearchTask.execute(new TaskCreateRequest()).getStatus());
    }
}
