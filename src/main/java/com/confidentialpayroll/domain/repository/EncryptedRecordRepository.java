package com.confidentialpayroll.domain.repository;

import com.confidentialpayroll.domain.model.EncryptedRecord;
import com.confidentialpayroll.domain.model.Identity;

import java.util.Optional;

/**
 * Encrypted record store, one record per identity.
 */
public interface EncryptedRecordRepository {

    Optional<EncryptedRecord> findByIdentity(Identity identity);

    /**
     * Create or overwrite.
     */
    void save(EncryptedRecord record);
}
