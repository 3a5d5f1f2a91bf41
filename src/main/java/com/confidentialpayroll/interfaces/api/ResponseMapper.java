package com.confidentialpayroll.interfaces.api;

import com.confidentialpayroll.domain.model.Batch;
import com.confidentialpayroll.domain.model.Ciphertext;
import com.confidentialpayroll.domain.model.DecryptedTotals;
import com.confidentialpayroll.domain.model.DecryptionContext;
import com.confidentialpayroll.domain.model.EncryptedRecord;
import com.confidentialpayroll.domain.model.Identity;
import com.confidentialpayroll.interfaces.api.dto.BatchResponse;
import com.confidentialpayroll.interfaces.api.dto.CiphertextResponse;
import com.confidentialpayroll.interfaces.api.dto.DecryptedTotalsResponse;
import com.confidentialpayroll.interfaces.api.dto.DecryptionContextResponse;
import com.confidentialpayroll.interfaces.api.dto.EncryptedRecordResponse;

import java.util.HexFormat;
import java.util.Optional;

/**
 * Maps domain objects to API responses.
 */
final class ResponseMapper {

    private ResponseMapper() {}

    static BatchResponse toResponse(Batch batch) {
        return BatchResponse.builder()
            .id(batch.getId())
            .open(batch.isOpen())
            .contributors(batch.getContributors().stream().map(Identity::value).toList())
            .contributorCount(batch.getContributorCount())
            .openedAt(batch.getOpenedAt())
            .closedAt(batch.getClosedAt())
            .build();
    }

    static CiphertextResponse toResponse(Ciphertext ciphertext) {
        return CiphertextResponse.builder()
            .handle(ciphertext.toBase64())
            .build();
    }

    static EncryptedRecordResponse toResponse(EncryptedRecord record) {
        return EncryptedRecordResponse.builder()
            .identity(record.getIdentity().value())
            .salaryHandle(record.getSalary().toBase64())
            .scoreHandle(record.getScore().toBase64())
            .lastBatchId(record.getLastBatchId())
            .submittedBy(record.getSubmittedBy().value())
            .updatedAt(record.getUpdatedAt())
            .build();
    }

    static DecryptionContextResponse toResponse(DecryptionContext context) {
        Optional<DecryptedTotals> totals = context.getTotals();
        return DecryptionContextResponse.builder()
            .requestId(context.getRequestId())
            .batchId(context.getBatchId())
            .commitment(HexFormat.of().formatHex(context.getCommitment()))
            .processed(context.isProcessed())
            .requestedBy(context.getRequestedBy().value())
            .requestedAt(context.getRequestedAt())
            .processedAt(context.getProcessedAt())
            .totalSalary(totals.map(t -> Long.toUnsignedString(t.totalSalary())).orElse(null))
            .totalBonus(totals.map(t -> Long.toUnsignedString(t.totalBonus())).orElse(null))
            .build();
    }

    static DecryptedTotalsResponse toResponse(long requestId, DecryptedTotals totals) {
        return DecryptedTotalsResponse.builder()
            .requestId(requestId)
            .totalSalary(Long.toUnsignedString(totals.totalSalary()))
            .totalBonus(Long.toUnsignedString(totals.totalBonus()))
            .build();
    }
}
