package org.mediarr.service.notification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.mediarr.model.dto.Notification;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Fire-and-forget notifications. Delivery happens on the async executor and never fails the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final ApplicationEventPublisher eventPublisher;

    @Async
    public void notify(Notification notification) {
        try {
            log.info("Notification [{}] {}: {}", notification.getEvent(), notification.getTitle(), notification.getMessage());
            eventPublisher.publishEvent(new NotificationPublishedEvent(this, notification));
        } catch (Exception e) {
            log.warn("Failed to deliver notification {}: {}", notification.getEvent(), e.getMessage(), e);
        }
    }
}
