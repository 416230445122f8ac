package org.mediarr.model.dto;

import lombok.Builder;
import lombok.Value;
import org.mediarr.model.enums.MediaKind;
import org.mediarr.model.enums.NotificationEvent;

@Value
@Builder
public class Notification {
    NotificationEvent event;
    String title;
    String message;
    MediaKind mediaType;
    String mediaTitle;
}
