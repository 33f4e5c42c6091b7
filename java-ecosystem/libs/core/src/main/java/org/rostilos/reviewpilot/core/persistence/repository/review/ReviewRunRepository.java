package org.rostilos.reviewpilot.core.persistence.repository.review;

import org.rostilos.reviewpilot.core.model.review.ReviewRun;
import org.rostilos.reviewpilot.core.model.review.ReviewStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Optional;

@Repository
public interface ReviewRunRepository extends JpaRepository<ReviewRun, Long> {

    @EntityGraph(attributePaths = {
            "repository",
            "repository.gitLabAccount",
            "repository.defaultModel"
    })
    @Query("SELECT r FROM ReviewRun r WHERE r.id = :id")
    Optional<ReviewRun> findByIdWithRepository(@Param("id") Long id);

    /**
     * Pending runs of the same merge request created after {@code since}; used to drop
     * webhook re-deliveries.
     */
    @Query("SELECT COUNT(r) > 0 FROM ReviewRun r WHERE r.repository.id = :repositoryId " +
            "AND r.mergeRequestIid = :iid AND r.status = :status AND r.createdAt > :since")
    boolean existsRecentRun(@Param("repositoryId") Long repositoryId,
                            @Param("iid") long mergeRequestIid,
                            @Param("status") ReviewStatus status,
                            @Param("since") OffsetDateTime since);

    boolean existsByRepositoryIdAndCommitSha(Long repositoryId, String commitSha);

    @EntityGraph(attributePaths = {"repository"})
    @Query("SELECT r FROM ReviewRun r WHERE (:repositoryId IS NULL OR r.repository.id = :repositoryId) " +
            "AND (:status IS NULL OR r.status = :status)")
    Page<ReviewRun> findFiltered(@Param("repositoryId") Long repositoryId,
                                 @Param("status") ReviewStatus status,
                                 Pageable pageable);
}
