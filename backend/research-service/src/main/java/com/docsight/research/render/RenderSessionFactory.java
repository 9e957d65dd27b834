package com.docsight.research.render;

/**
 * Opens a fresh {@link RenderSession}. Sessions are never pooled or shared between
 * concurrent acquisitions.
 */
public interface RenderSessionFactory {

    RenderSession open();
}
