package com.confidentialpayroll.infrastructure.persistence;

import com.confidentialpayroll.domain.model.DecryptionContext;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Spring Data JPA repository for decryption contexts.
 */
@Repository
public interface SpringDataDecryptionContextRepository extends JpaRepository<DecryptionContext, Long> {

    List<DecryptionContext> findByBatchIdOrderByRequestedAtAsc(long batchId);

    /**
     * @param cutoff Requests made before this instant
     * @return Unprocessed contexts, oldest first
     */
    @Query("SELECT d FROM DecryptionContext d WHERE d.processed = false AND d.requestedAt < :cutoff ORDER BY d.requestedAt")
    List<DecryptionContext> findPendingRequestedBefore(@Param("cutoff") Instant cutoff);
}
