package com.confidentialpayroll.interfaces.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Decryption request state. Totals are present once processed, rendered as unsigned decimals.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecryptionContextResponse {

    private Long requestId;
    private Long batchId;
    private String commitment;
    private boolean processed;
    private String requestedBy;
    private Instant requestedAt;
    private Instant processedAt;
    private String totalSalary;
    private String totalBonus;
}
