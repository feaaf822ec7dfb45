package dev.changeguard.repository;

import dev.changeguard.domain.entity.ValidationRequest;
import dev.changeguard.domain.enums.ValidationStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ValidationRequestRepository extends JpaRepository<ValidationRequest, UUID> {

    Optional<ValidationRequest> findByChangeId(String changeId);

    List<ValidationRequest> findByStatusAndCreatedAtAfterOrderByCreatedAtDesc(
            ValidationStatus status, Instant since, Pageable pageable);

    List<ValidationRequest> findByComponentTypeOrderByCreatedAtDesc(String componentType, Pageable pageable);

    @Query("select r.status, count(r) from ValidationRequest r where r.createdAt >= :since group by r.status")
    List<Object[]> countByStatusSince(@Param("since") Instant since);

    @Query(value = """
            select verdict ->> 'overallStatus', count(*)
              from change_validations
             where status = 'COMPLETED' and created_at >= :since
             group by verdict ->> 'overallStatus'
            """, nativeQuery = true)
    List<Object[]> countByVerdictSince(@Param("since") Instant since);

    @Query("""
            select avg(r.processingDurationMs) from ValidationRequest r
             where r.status = dev.changeguard.domain.enums.ValidationStatus.COMPLETED and r.createdAt >= :since
            """)
    Double averageProcessingMsSince(@Param("since") Instant since);
}
