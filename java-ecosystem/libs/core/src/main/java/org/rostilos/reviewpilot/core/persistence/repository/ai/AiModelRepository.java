package org.rostilos.reviewpilot.core.persistence.repository.ai;

import org.rostilos.reviewpilot.core.model.ai.AiModel;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AiModelRepository extends JpaRepository<AiModel, Long> {

    Optional<AiModel> findFirstByDefaultModelTrueAndActiveTrue();
}
