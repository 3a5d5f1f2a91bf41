package com.confidentialpayroll.infrastructure.persistence;

import com.confidentialpayroll.domain.model.EncryptedRecord;
import com.confidentialpayroll.domain.model.Identity;
import com.confidentialpayroll.domain.repository.EncryptedRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Component
@Transactional
@RequiredArgsConstructor
@Slf4j
public class EncryptedRecordRepositoryAdapter implements EncryptedRecordRepository {

    private final SpringDataEncryptedRecordRepository springDataRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<EncryptedRecord> findByIdentity(Identity identity) {
        return springDataRepository.findById(identity.value());
    }

    @Override
    public void save(EncryptedRecord record) {
        springDataRepository.save(record);

        log.debug("Encrypted record persisted: identity={}, batchId={}",
            record.getIdentity(), record.getLastBatchId());
    }
}
