package com.whispers.api.inboxes;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Builds the public address of an inbox, {@code {app.baseUrl}/inboxes/{id}}. Clients never
 * supply it.
 */
@Component
public class InboxUrls {

    private final String baseUrl;

    InboxUrls(@Value("${app.baseUrl}") String baseUrl) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public String urlFor(UUID inboxId) {
        return baseUrl + "/inboxes/" + inboxId;
    }

    public String baseUrl() {
        return baseUrl;
    }
}
