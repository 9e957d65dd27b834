package com.docsight.research.render;

import java.time.Duration;

/**
 * A disposable, resource-heavy browser session able to execute client-side scripts.
 *
 * Sessions are opened for a single acquisition and must be closed on every exit
 * path; callers use try-with-resources.
 */
public interface RenderSession extends AutoCloseable {

    /**
     * Navigates to {@code url} and waits for network idle.
     */
    RenderedPage render(String url, Duration timeout);

    /**
     * Releases the browser. Must not throw.
     */
    @Override
    void close();
}
