package com.confidentialpayroll.interfaces.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Stored ciphertext handles of one contributor. Never carries plaintext.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EncryptedRecordResponse {

    private String identity;
    private String salaryHandle;
    private String scoreHandle;
    private Long lastBatchId;
    private String submittedBy;
    private Instant updatedAt;
}
