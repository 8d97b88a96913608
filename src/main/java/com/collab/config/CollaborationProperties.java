package com.collab.config;

import com.collab.model.SessionSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "collab")
public class CollaborationProperties {
    private int defaultMaxMembers = 10;
    private boolean defaultAllowGuests = true;
    private boolean defaultReadOnly = false;

    // Pending-operation log bounds
    private int logCapacity = 100;
    private int logRetain = 50;

    private int outboundQueueCapacity = 256;
    private int dispatchThreads = 4;

    private List<String> palette = new ArrayList<>(List.of(
            "#FF6B6B", "#4ECDC4", "#45B7D1", "#F9CA24", "#6C5CE7",
            "#A8E6CF", "#FFD93D", "#FCB1A6", "#B2DFDB", "#D4A5A5"
    ));

    public SessionSettings defaultSettings() {
        return SessionSettings.builder()
                .maxMembers(defaultMaxMembers)
                .allowGuests(defaultAllowGuests)
                .readOnly(defaultReadOnly)
                .build();
    }
}
