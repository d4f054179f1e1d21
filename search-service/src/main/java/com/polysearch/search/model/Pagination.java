package com.polysearch.search.model;

import java.util.Objects;

public class Pagination {
    private int page;
    private int perPage;

    public Pagination() {
    }

    public Pagination(int page, int perPage) {
        this.page = page;
        this.perPage = perPage;
    }

    public int getPage() {
        return page;
    }

    public void setPage(int page) {
        this.page = page;
    }

    public int getPerPage() {
        return perPage;
    }

    public void setPerPage(int perPage) {
        this.perPage = perPage;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Pagination that)) {
            return false;
        }
        return page == that.page && perPage == that.perPage;
    }

    @Override
    public int hashCode() {
        return Objects.hash(page, perPage);
    }
}
