package com.confidentialpayroll.infrastructure.persistence;

import com.confidentialpayroll.domain.model.EncryptedRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Spring Data JPA repository for encrypted records, keyed by normalized identity.
 */
@Repository
public interface SpringDataEncryptedRecordRepository extends JpaRepository<EncryptedRecord, String> {
}
