package com.confidentialpayroll.domain.model;

import java.time.Instant;

/**
 * Event emitted by a successful protocol transition.
 *
 * <p>Events never carry plaintext contributor values. The only cleartext ever emitted is
 * the verified aggregate in {@link DecryptionCompleted}.
 */
public interface ProtocolEvent {

    /**
     * Stable event name used by the audit ledger.
     */
    String getType();

    long getBatchId();

    Instant getOccurredAt();

    record BatchOpened(
        long batchId,
        Identity openedBy,
        Instant occurredAt
    ) implements ProtocolEvent {
        @Override
        public String getType() {
            return "BatchOpened";
        }

        @Override
        public long getBatchId() {
            return batchId;
        }

        @Override
        public Instant getOccurredAt() {
            return occurredAt;
        }
    }

    record BatchClosed(
        long batchId,
        int contributorCount,
        Instant occurredAt
    ) implements ProtocolEvent {
        @Override
        public String getType() {
            return "BatchClosed";
        }

        @Override
        public long getBatchId() {
            return batchId;
        }

        @Override
        public Instant getOccurredAt() {
            return occurredAt;
        }
    }

    record ContributionSubmitted(
        Identity identity,
        long batchId,
        String salaryHandle,
        String scoreHandle,
        Identity submittedBy,
        Instant occurredAt
    ) implements ProtocolEvent {
        @Override
        public String getType() {
            return "ContributionSubmitted";
        }

        @Override
        public long getBatchId() {
            return batchId;
        }

        @Override
        public Instant getOccurredAt() {
            return occurredAt;
        }
    }

    record DecryptionRequested(
        long requestId,
        long batchId,
        String commitment,
        Identity requestedBy,
        Instant occurredAt
    ) implements ProtocolEvent {
        @Override
        public String getType() {
            return "DecryptionRequested";
        }

        @Override
        public long getBatchId() {
            return batchId;
        }

        @Override
        public Instant getOccurredAt() {
            return occurredAt;
        }
    }

    record DecryptionCompleted(
        long requestId,
        long batchId,
        long totalSalary,
        long totalBonus,
        Instant occurredAt
    ) implements ProtocolEvent {
        @Override
        public String getType() {
            return "DecryptionCompleted";
        }

        @Override
        public long getBatchId() {
            return batchId;
        }

        @Override
        public Instant getOccurredAt() {
            return occurredAt;
        }
    }
}
