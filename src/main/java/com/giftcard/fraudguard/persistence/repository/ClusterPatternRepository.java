package com.giftcard.fraudguard.persistence.repository;

import com.giftcard.fraudguard.persistence.entity.ClusterPatternEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface ClusterPatternRepository extends JpaRepository<ClusterPatternEntity, String> {

    List<ClusterPatternEntity> findByClusterIdOrderByEventTimestampAscIdAsc(String clusterId);

    @Query("SELECT p.fraudLogId FROM ClusterPatternEntity p WHERE p.eventTimestamp >= :since")
    List<String> findAssignedFraudLogIdsSince(@Param("since") Instant since);

    long countByClusterId(String clusterId);
}
