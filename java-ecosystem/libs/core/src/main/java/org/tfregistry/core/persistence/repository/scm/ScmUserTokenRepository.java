package org.tfregistry.core.persistence.repository.scm;

import org.tfregistry.core.model.scm.ScmUserToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ScmUserTokenRepository extends JpaRepository<ScmUserToken, UUID> {

    Optional<ScmUserToken> findByUserIdAndProviderId(UUID userId, UUID providerId);

    @Modifying
    @Transactional
    @Query("DELETE FROM ScmUserToken t WHERE t.userId = :userId AND t.providerId = :providerId")
    int deleteByUserIdAndProviderId(@Param("userId") UUID userId, @Param("providerId") UUID providerId);

    @Modifying
    @Transactional
    @Query("DELETE FROM ScmUserToken t WHERE t.providerId = :providerId")
    int deleteByProviderId(@Param("providerId") UUID providerId);
}
