package com.polysearch.search.model;

import com.polysearch.search.cache.CacheConfig;

import java.util.LinkedHashMap;
import java.util.Map;

public class SearchRequest {
    private String query;
    private Integer page;
    private Integer perPage;
    private CacheConfig cacheOverride;
    private Map<String, String> extra = new LinkedHashMap<>();

    public SearchRequest() {
    }

    public SearchRequest(String query, Integer page, Integer perPage) {
        this.query = query;
        this.page = page;
        this.perPage = perPage;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public Integer getPage() {
        return page;
    }

    public void setPage(Integer page) {
        this.page = page;
    }

    public Integer getPerPage() {
        return perPage;
    }

    public void setPerPage(Integer perPage) {
        this.perPage = perPage;
    }

    public CacheConfig getCacheOverride() {
        return cacheOverride;
    }

    public void setCacheOverride(CacheConfig cacheOverride) {
        this.cacheOverride = cacheOverride;
    }

    public Map<String, String> getExtra() {
        return extra;
    }

    public void setExtra(Map<String, String> extra) {
        this.extra = extra == null ? new LinkedHashMap<>() : extra;
    }
}
