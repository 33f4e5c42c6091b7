package org.rostilos.reviewpilot.core.persistence.repository.config;

import org.rostilos.reviewpilot.core.model.config.RepositoryConfig;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface RepositoryConfigRepository extends JpaRepository<RepositoryConfig, Long> {

    @EntityGraph(attributePaths = {"gitLabAccount", "defaultModel"})
    Optional<RepositoryConfig> findFirstByGitLabProjectIdAndActiveTrue(Long gitLabProjectId);

    @EntityGraph(attributePaths = {"gitLabAccount", "defaultModel"})
    @Query("SELECT c FROM RepositoryConfig c WHERE c.id = :id")
    Optional<RepositoryConfig> findByIdWithAccount(@Param("id") Long id);
}
