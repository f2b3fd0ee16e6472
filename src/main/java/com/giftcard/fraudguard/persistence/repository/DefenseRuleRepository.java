package com.giftcard.fraudguard.persistence.repository;

import com.giftcard.fraudguard.domain.DefenseRuleOrigin;
import com.giftcard.fraudguard.domain.DefenseTarget;
import com.giftcard.fraudguard.persistence.entity.DefenseRuleEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface DefenseRuleRepository extends JpaRepository<DefenseRuleEntity, String> {

    List<DefenseRuleEntity> findByActiveTrueAndExpiresAtAfter(Instant now);

    Optional<DefenseRuleEntity> findFirstByTargetAndRuleValueAndActiveTrueAndExpiresAtAfterOrderByExpiresAtDesc(
            DefenseTarget target, String ruleValue, Instant now);

    List<DefenseRuleEntity> findByOrderByCreatedAtDescIdDesc(Pageable pageable);

    List<DefenseRuleEntity> findByOriginOrderByCreatedAtDescIdDesc(DefenseRuleOrigin origin, Pageable pageable);

    long countByLastTriggeredAtGreaterThanEqual(Instant since);

    @Modifying
    @Query("UPDATE DefenseRuleEntity r SET r.hitCount = r.hitCount + :hits, r.lastTriggeredAt = :at WHERE r.id = :id")
    int addHits(@Param("id") String id, @Param("hits") long hits, @Param("at") Instant at);
}
