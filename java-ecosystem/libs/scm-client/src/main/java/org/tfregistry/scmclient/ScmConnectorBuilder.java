package org.tfregistry.scmclient;

import org.tfregistry.core.model.scm.EScmProviderType;

/**
 * Creates connectors for a single provider type. Register implementations as Spring beans.
 */
public interface ScmConnectorBuilder {

    EScmProviderType getProviderType();

    ScmConnector build(ConnectorSettings settings);
}
