package com.giftcard.fraudguard.persistence.repository;

import com.giftcard.fraudguard.persistence.entity.FraudLogEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface FraudLogRepository extends JpaRepository<FraudLogEntity, String> {

    List<FraudLogEntity> findByOrderByTimestampDescIdDesc(Pageable pageable);

    List<FraudLogEntity> findByMerchantIdOrderByTimestampDescIdDesc(String merchantId, Pageable pageable);

    /** Rows at or after {@code since} that no cluster has claimed yet, newest first. */
    @Query("SELECT f FROM FraudLogEntity f WHERE f.timestamp >= :since AND NOT EXISTS " +
            "(SELECT p.id FROM ClusterPatternEntity p WHERE p.fraudLogId = f.id) " +
            "ORDER BY f.timestamp DESC, f.id DESC")
    List<FraudLogEntity> findUnclusteredSince(@Param("since") Instant since, Pageable pageable);

    long countByBlockedTrue();

    long countByTimestampGreaterThanEqual(Instant since);

    @Query("SELECT COUNT(DISTINCT f.ipAddress) FROM FraudLogEntity f WHERE f.timestamp >= :since")
    long countDistinctIpSince(@Param("since") Instant since);

    /** Rows of {@code [failureReason, count]}, most frequent first. */
    @Query("SELECT f.failureReason, COUNT(f) FROM FraudLogEntity f WHERE f.timestamp >= :since " +
            "GROUP BY f.failureReason ORDER BY COUNT(f) DESC")
    List<Object[]> countByReasonSince(@Param("since") Instant since);

    @Query("SELECT f.timestamp FROM FraudLogEntity f WHERE f.timestamp >= :since")
    List<Instant> findTimestampsSince(@Param("since") Instant since);
}
