package com.polysearch.search.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class SearchResult {
    private String title;
    private String url;
    private String snippet;
    private List<String> sources = new ArrayList<>();

    public SearchResult() {
    }

    public SearchResult(String title, String url, String snippet, List<String> sources) {
        this.title = title;
        this.url = url;
        this.snippet = snippet;
        this.sources = sources == null ? new ArrayList<>() : new ArrayList<>(sources);
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getSnippet() {
        return snippet;
    }

    public void setSnippet(String snippet) {
        this.snippet = snippet;
    }

    public List<String> getSources() {
        return sources;
    }

    public void setSources(List<String> sources) {
        this.sources = sources;
    }

    public SearchResult copy() {
        return new SearchResult(title, url, snippet, sources);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SearchResult that)) {
            return false;
        }
        return Objects.equals(title, that.title) && Objects.equals(url, that.url) && Objects.equals(snippet, that.snippet) && Objects.equals(sources, that.sources);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, url, snippet, sources);
    }
}
