package org.tfregistry.scmclient;

import org.tfregistry.core.model.scm.EScmProviderType;
import org.tfregistry.scmclient.model.AccessToken;
import org.tfregistry.scmclient.model.Pagination;
import org.tfregistry.scmclient.model.ScmBranch;
import org.tfregistry.scmclient.model.ScmRepositoryPage;
import org.tfregistry.scmclient.model.ScmTag;

import java.io.IOException;
import java.util.List;

/**
 * Speaks one SCM provider's OAuth and REST dialect.
 * Implementations are created per request by {@link ScmConnectorFactory} from {@link ConnectorSettings}.
 * <p>
 * Rejections from the provider API are reported as {@link ScmApiException} carrying the HTTP status;
 * transport failures surface as {@link IOException}.
 */
public interface ScmConnector {

    EScmProviderType getProviderType();

    /**
     * Build the URL the user's browser is sent to for consent.
     * @param state opaque value echoed back to the callback
     * @param scopes requested scopes, empty for the provider's defaults
     */
    String authorizationEndpoint(String state, List<String> scopes);

    /**
     * Exchange an authorization code for a credential.
     */
    AccessToken completeAuthorization(String code) throws IOException;

    /**
     * Obtain a fresh access token. The returned refresh token may be empty when the provider does not rotate it.
     */
    AccessToken renewToken(String refreshToken) throws IOException;

    ScmRepositoryPage fetchRepositories(AccessToken token, Pagination pagination) throws IOException;

    ScmRepositoryPage searchRepositories(AccessToken token, String query, Pagination pagination) throws IOException;

    List<ScmTag> fetchTags(AccessToken token, String owner, String repo, Pagination pagination) throws IOException;

    List<ScmBranch> fetchBranches(AccessToken token, String owner, String repo, Pagination pagination) throws IOException;
}
