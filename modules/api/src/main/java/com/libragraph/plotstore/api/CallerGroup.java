package com.libragraph.plotstore.api;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.HttpHeaders;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Reads the caller's group from the header set by the upstream auth component.
 * A missing or blank header means no group.
 */
@ApplicationScoped
public class CallerGroup {

    @ConfigProperty(name = "plotstore.api.group-header", defaultValue = "X-Plotstore-Group")
    String headerName;

    public String from(HttpHeaders headers) {
        String value = headers.getHeaderString(headerName);
        return value == null || value.isBlank() ? null : value.trim();
    }
}
