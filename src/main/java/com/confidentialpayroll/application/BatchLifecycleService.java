package com.confidentialpayroll.application;

import com.confidentialpayroll.application.exceptions.LifecycleException;
import com.confidentialpayroll.application.exceptions.ResourceNotFoundException;
import com.confidentialpayroll.config.PerformanceConfiguration.BusinessMetrics;
import com.confidentialpayroll.domain.model.Batch;
import com.confidentialpayroll.domain.model.ProtocolEvent;
import com.confidentialpayroll.domain.repository.BatchRepository;
import com.confidentialpayroll.infrastructure.audit.ProtocolEventRecorder;
import com.confidentialpayroll.infrastructure.security.AccessControl;
import com.confidentialpayroll.infrastructure.security.CallerContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Batch Lifecycle Manager.
 *
 * <p>Owns the monotonically increasing batch id. At most one batch is open at any time:
 * opening a new batch while the current one is still open closes the current one first.
 *
 * @author Security Team
 * @since 1.0.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BatchLifecycleService {

    private final BatchRepository batchRepository;
    private final AccessControl accessControl;
    private final ProtocolEventRecorder eventRecorder;
    private final ProtocolStateGuard stateGuard;
    private final BusinessMetrics businessMetrics;
    private final Clock clock;

    /**
     * Open batch {@code currentBatchId + 1}.
     *
     * @param caller Must hold the admin capability
     * @return The new open batch
     */
    public Batch openBatch(CallerContext caller) {
        return stateGuard.execute("openBatch", () -> {
            accessControl.requireAdmin(caller);
            accessControl.requireNotPaused();

            Instant now = clock.instant();
            Optional<Batch> current = batchRepository.findCurrent();

            if (current.isPresent() && current.get().isOpen()) {
                log.info("Batch {} still open when opening its successor; closing it", current.get().getId());
                closeAndRecord(current.get(), now);
            }

            long nextId = current.map(batch -> batch.getId() + 1).orElse(1L);
            Batch batch = Batch.open(nextId, now);
            batchRepository.save(batch);

            eventRecorder.record(new ProtocolEvent.BatchOpened(nextId, caller.getPrincipal(), now));
            businessMetrics.recordBatchOpened();

            log.info("Batch opened: id={}, by={}", nextId, caller.getPrincipal());
            return batch;
        });
    }

    /**
     * Close the current batch.
     *
     * @throws LifecycleException {@code INVALID_BATCH_STATE} if no batch exists or the current one is closed
     */
    public Batch closeBatch(CallerContext caller) {
        return stateGuard.execute("closeBatch", () -> {
            accessControl.requireAdmin(caller);
            accessControl.requireNotPaused();

            Batch current = batchRepository.findCurrent()
                .orElseThrow(() -> LifecycleException.invalidBatchState("No batch has been opened"));
            if (!current.isOpen()) {
                throw LifecycleException.invalidBatchState("Batch " + current.getId() + " is already closed");
            }

            closeAndRecord(current, clock.instant());

            log.info("Batch closed: id={}, contributors={}, by={}",
                current.getId(), current.getContributorCount(), caller.getPrincipal());
            return current;
        });
    }

    /**
     * @return Id of the current batch, 0 before the first batch is opened
     */
    public long currentBatchId() {
        return batchRepository.findCurrent().map(Batch::getId).orElse(0L);
    }

    public Batch getCurrentBatch() {
        return batchRepository.findCurrent()
            .orElseThrow(() -> new ResourceNotFoundException("No batch has been opened"));
    }

    public Batch getBatch(long batchId) {
        return batchRepository.findById(batchId)
            .orElseThrow(() -> new ResourceNotFoundException("Batch not found: " + batchId));
    }

    public List<Batch> listBatches() {
        return batchRepository.findAll();
    }

    private void closeAndRecord(Batch batch, Instant now) {
        batch.close(now);
        batchRepository.save(batch);

        eventRecorder.record(new ProtocolEvent.BatchClosed(batch.getId(), batch.getContributorCount(), now));
        businessMetrics.recordBatchClosed(batch.getContributorCount());
    }
}
