package com.docsight.research.render;

/**
 * DOM snapshot taken after client-side scripts settled.
 */
public record RenderedPage(String url, String html, String title) {
}
