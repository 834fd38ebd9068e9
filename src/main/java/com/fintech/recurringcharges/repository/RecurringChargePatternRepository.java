package com.fintech.recurringcharges.repository;

import com.fintech.recurringcharges.entity.PatternStatus;
import com.fintech.recurringcharges.entity.RecurrenceFrequency;
import com.fintech.recurringcharges.entity.RecurringChargePattern;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for recurring charge patterns.
 * Status changes are written through the entity and checked against its version column.
 */
@Repository
public interface RecurringChargePatternRepository extends JpaRepository<RecurringChargePattern, String> {

    List<RecurringChargePattern> findByUserIdOrderByConfidenceScoreDesc(String userId);

    Page<RecurringChargePattern> findByUserIdAndStatus(String userId, PatternStatus status, Pageable pageable);

    List<RecurringChargePattern> findByUserIdAndStatus(String userId, PatternStatus status);

    /**
     * Patterns the categorization collaborator may consult.
     */
    List<RecurringChargePattern> findByUserIdAndStatusAndActiveTrue(String userId, PatternStatus status);

    /**
     * Used to skip re-saving a draft that an earlier run already produced.
     * Rejected patterns count as existing so they are not proposed again.
     */
    boolean existsByUserIdAndMerchantPatternAndFrequency(String userId, String merchantPattern,
                                                          RecurrenceFrequency frequency);

    long countByStatus(PatternStatus status);

    @Query("SELECT p.status, COUNT(p) FROM RecurringChargePattern p WHERE p.userId = :userId GROUP BY p.status")
    List<Object[]> getStatusCounts(@Param("userId") String userId);
}
