package org.mediarr.service.activity;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.mediarr.model.entity.ActivityLogEntity;
import org.mediarr.model.entity.DownloadEntity;
import org.mediarr.model.enums.ActivityEventType;
import org.mediarr.repository.ActivityLogRepository;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class ActivityLogService {

    private final ActivityLogRepository activityLogRepository;
    private final ObjectMapper objectMapper;

    public void log(ActivityEventType eventType, DownloadEntity download, String message) {
        log(eventType, download, message, Map.of());
    }

    public void log(ActivityEventType eventType, DownloadEntity download, String message, Map<String, Object> extra) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("title", download.getTitle());
        details.put("quality", download.getQuality());
        details.put("indexer", download.getIndexer());
        details.put("size", download.getSize());
        if (download.getSeasonNumber() != null) {
            details.put("season", download.getSeasonNumber());
        }
        if (download.getEpisodeNumber() != null) {
            details.put("episode", download.getEpisodeNumber());
        }
        details.putAll(extra);
        write(ActivityLogEntity.builder()
                .eventType(eventType)
                .movieId(download.getMovieId())
                .seriesId(download.getSeriesId())
                .downloadId(download.getId())
                .message(message)
                .details(toJson(details))
                .build());
    }

    public Page<ActivityLogEntity> getActivity(Pageable pageable) {
        return activityLogRepository.findAllByOrderByCreatedAtDesc(pageable);
    }

    private void write(ActivityLogEntity entity) {
        try {
            activityLogRepository.save(entity);
        } catch (Exception e) {
            log.warn("Failed to write activity log: type={}, message={}", entity.getEventType(), entity.getMessage(), e);
        }
    }

    private String toJson(Map<String, Object> details) {
        try {
            return objectMapper.writeValueAsString(details);
        } catch (Exception e) {
            log.debug("Failed to serialize activity details: {}", e.getMessage());
            return null;
        }
    }
}
