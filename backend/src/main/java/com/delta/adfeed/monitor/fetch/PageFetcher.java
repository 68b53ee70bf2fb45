package com.delta.adfeed.monitor.fetch;

/**
 * Retrieves the rendered HTML of a listing page.
 */
public interface PageFetcher {
    String fetch(String url) throws PageFetchException;
}
