package org.rostilos.reviewpilot.core.persistence.repository.review;

import org.rostilos.reviewpilot.core.model.review.ReviewFinding;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ReviewFindingRepository extends JpaRepository<ReviewFinding, Long> {

    List<ReviewFinding> findByReviewRunIdOrderByIdAsc(Long reviewRunId);

    List<ReviewFinding> findByReviewRunIdAndPostedFalseOrderByIdAsc(Long reviewRunId);

    long countByReviewRunId(Long reviewRunId);

    @Modifying
    @Query("DELETE FROM ReviewFinding f WHERE f.reviewRun.id = :reviewRunId")
    int deleteByReviewRunId(@Param("reviewRunId") Long reviewRunId);
}
