package org.tfregistry.scmclient.model;

/**
 * Page navigation for paginated SCM reads. Pages are 1-based.
 */
public record Pagination(int page, int pageSize) {

    public static final Pagination DEFAULT = new Pagination(1, 30);

    public Pagination {
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1");
        }
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be >= 1");
        }
    }
}
