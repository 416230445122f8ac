package org.mediarr.service.notification;

import lombok.Getter;
import org.mediarr.model.dto.Notification;
import org.springframework.context.ApplicationEvent;

@Getter
public class NotificationPublishedEvent extends ApplicationEvent {

    private final transient Notification notification;

    public NotificationPublishedEvent(Object source, Notification notification) {
        super(source);
        this.notification = notification;
    }
}
