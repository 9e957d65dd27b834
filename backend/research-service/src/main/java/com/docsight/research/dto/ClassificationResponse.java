package com.docsight.research.dto;

import com.docsight.research.model.ConfidenceLevel;

public record ClassificationResponse(String url, boolean verified, ConfidenceLevel confidence) {
}
