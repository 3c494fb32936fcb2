package org.tfregistry.scmclient.model;

import java.util.List;

/**
 * One page of repositories.
 *
 * @param totalCount total across all pages, null if the provider does not report it
 */
public record ScmRepositoryPage(
        List<ScmRepository> repositories,
        Integer totalCount,
        boolean hasMore,
        int nextPage
) {
    public ScmRepositoryPage {
        repositories = repositories == null ? List.of() : List.copyOf(repositories);
    }
}
