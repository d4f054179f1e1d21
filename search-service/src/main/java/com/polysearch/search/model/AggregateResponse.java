package com.polysearch.search.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class AggregateResponse {
    private List<SearchResult> results = new ArrayList<>();
    private Integer totalResults;
    private Pagination pagination;

    public AggregateResponse() {
    }

    public AggregateResponse(List<SearchResult> results, Integer totalResults, Pagination pagination) {
        this.results = results == null ? new ArrayList<>() : results;
        this.totalResults = totalResults;
        this.pagination = pagination;
    }

    public static AggregateResponse empty(int page, int perPage) {
        return new AggregateResponse(new ArrayList<>(), 0, new Pagination(page, perPage));
    }

    public List<SearchResult> getResults() {
        return results;
    }

    public void setResults(List<SearchResult> results) {
        this.results = results;
    }

    public Integer getTotalResults() {
        return totalResults;
    }

    public void setTotalResults(Integer totalResults) {
        this.totalResults = totalResults;
    }

    public Pagination getPagination() {
        return pagination;
    }

    public void setPagination(Pagination pagination) {
        this.pagination = pagination;
    }

    /**
     * Deep copy; the cache hands these out so callers never share state with a stored entry.
     */
    public AggregateResponse copy() {
        List<SearchResult> resultsCopy = new ArrayList<>();
        if (results != null) {
            for (SearchResult r : results) {
                resultsCopy.add(r.copy());
            }
        }
        Pagination paginationCopy = pagination == null ? null
                : new Pagination(pagination.getPage(), pagination.getPerPage());
        return new AggregateResponse(resultsCopy, totalResults, paginationCopy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AggregateResponse that)) {
            return false;
        }
        return Objects.equals(results, that.results) && Objects.equals(totalResults, that.totalResults) && Objects.equals(pagination, that.pagination);
    }

    @Override
    public int hashCode() {
        return Objects.hash(results, totalResults, pagination);
    }
}
