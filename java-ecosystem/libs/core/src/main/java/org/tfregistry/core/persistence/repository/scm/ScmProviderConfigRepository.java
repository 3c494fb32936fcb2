package org.tfregistry.core.persistence.repository.scm;

import org.tfregistry.core.model.scm.ScmProviderConfig;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ScmProviderConfigRepository extends JpaRepository<ScmProviderConfig, UUID> {

    List<ScmProviderConfig> findAllByOrderByNameAsc();

    /**
     * Providers visible to an organization: its own plus the global ones.
     */
    @Query("SELECT p FROM ScmProviderConfig p WHERE p.organizationId = :organizationId " +
           "OR p.organizationId IS NULL ORDER BY p.name ASC")
    List<ScmProviderConfig> findVisibleToOrganization(@Param("organizationId") UUID organizationId);
}
