package com.giftcard.fraudguard.persistence.repository;

import com.giftcard.fraudguard.persistence.entity.FraudClusterEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface FraudClusterRepository extends JpaRepository<FraudClusterEntity, String> {

    List<FraudClusterEntity> findByOrderByUpdatedAtDescIdAsc(Pageable pageable);

    /** Clusters still open for merging: their newest member is not older than {@code since}. */
    List<FraudClusterEntity> findByLastSeenAtGreaterThanEqualOrderByCreatedAtAscIdAsc(Instant since);

    long countByCreatedAtGreaterThanEqual(Instant since);

    @Query("SELECT AVG(c.severity) FROM FraudClusterEntity c")
    Double averageSeverity();

    /** Rows of {@code [patternType, count]}. */
    @Query("SELECT c.patternType, COUNT(c) FROM FraudClusterEntity c GROUP BY c.patternType")
    List<Object[]> countPerPatternType();
}
