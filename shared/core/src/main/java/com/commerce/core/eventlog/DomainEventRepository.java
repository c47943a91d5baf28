package com.commerce.core.eventlog;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface DomainEventRepository extends JpaRepository<DomainEvent, UUID> {

    List<DomainEvent> findByAggregateIdAndVersionGreaterThanEqualOrderByVersionAsc(UUID aggregateId, long fromVersion);

    @Query("SELECT COALESCE(MAX(e.version), 0) FROM DomainEvent e WHERE e.aggregateId = :aggregateId")
    long findLatestVersion(@Param("aggregateId") UUID aggregateId);
}
