package com.confidentialpayroll.infrastructure.persistence;

import com.confidentialpayroll.domain.model.DecryptionContext;
import com.confidentialpayroll.domain.repository.DecryptionContextRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Component
@Transactional
@RequiredArgsConstructor
@Slf4j
public class DecryptionContextRepositoryAdapter implements DecryptionContextRepository {

    private final SpringDataDecryptionContextRepository springDataRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<DecryptionContext> findByRequestId(long requestId) {
        return springDataRepository.findById(requestId);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsByRequestId(long requestId) {
        return springDataRepository.existsById(requestId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<DecryptionContext> findByBatchId(long batchId) {
        return springDataRepository.findByBatchIdOrderByRequestedAtAsc(batchId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<DecryptionContext> findPendingRequestedBefore(Instant cutoff) {
        return springDataRepository.findPendingRequestedBefore(cutoff);
    }

    @Override
    public void save(DecryptionContext context) {
        springDataRepository.save(context);

        log.debug("Decryption context persisted: requestId={}, batchId={}, processed={}",
            context.getRequestId(), context.getBatchId(), context.isProcessed());
    }
}
