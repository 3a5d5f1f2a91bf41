package com.confidentialpayroll.domain.repository;

import com.confidentialpayroll.domain.model.DecryptionContext;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Pending-request table keyed by oracle request id.
 */
public interface DecryptionContextRepository {

    Optional<DecryptionContext> findByRequestId(long requestId);

    boolean existsByRequestId(long requestId);

    /**
     * Contexts of one batch ordered by request time.
     */
    List<DecryptionContext> findByBatchId(long batchId);

    /**
     * Unprocessed contexts requested before the given instant.
     */
    List<DecryptionContext> findPendingRequestedBefore(Instant cutoff);

    void save(DecryptionContext context);
}
