package com.docsight.research.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Text extracted from one URL and the path that produced it.
 */
public record AcquiredContent(
        String url,
        String text,
        String title,
        AcquisitionMethod method
) {
    @JsonIgnore
    public boolean hasContent() {
        return text != null && !text.isBlank();
    }
}
