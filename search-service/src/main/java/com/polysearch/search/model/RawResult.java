package com.polysearch.search.model;

/**
 * One hit as returned by a single provider call. {@code snippet} may be null.
 */
public record RawResult(String title, String url, String snippet) {

    public RawResult {
        title = title == null ? "" : title;
        url = url == null ? "" : url;
    }
}
