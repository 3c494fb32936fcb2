package org.tfregistry.scmclient;

import org.tfregistry.core.model.scm.EScmProviderType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Selects the {@link ScmConnectorBuilder} registered for a provider type.
 */
@Component
public class ScmConnectorFactory {

    private static final Logger log = LoggerFactory.getLogger(ScmConnectorFactory.class);

    private final Map<EScmProviderType, ScmConnectorBuilder> builders;

    @Autowired
    public ScmConnectorFactory(ObjectProvider<ScmConnectorBuilder> builders) {
        this(builders.orderedStream().toList());
    }

    public ScmConnectorFactory(List<ScmConnectorBuilder> builders) {
        Map<EScmProviderType, ScmConnectorBuilder> byType = new EnumMap<>(EScmProviderType.class);
        for (ScmConnectorBuilder builder : builders) {
            ScmConnectorBuilder previous = byType.putIfAbsent(builder.getProviderType(), builder);
            if (previous != null) {
                throw new IllegalStateException("Duplicate SCM connector builder for provider type: "
                        + builder.getProviderType().getId());
            }
        }
        this.builders = Collections.unmodifiableMap(byType);
        log.info("SCM connectors registered for provider types: {}", this.builders.keySet());
    }

    /**
     * @throws ScmClientException when the settings are incomplete or no builder is registered for the type
     */
    public ScmConnector create(ConnectorSettings settings) {
        settings.validate();
        ScmConnectorBuilder builder = builders.get(settings.providerType());
        if (builder == null) {
            throw new ScmClientException("SCM provider not supported: " + settings.providerType().getId());
        }
        return builder.build(settings);
    }
}
