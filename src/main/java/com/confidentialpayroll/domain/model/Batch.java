package com.confidentialpayroll.domain.model;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Time-boxed collection of contributions.
 *
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>Ids start at 1 and grow by exactly 1 per opened batch</li>
 *   <li>{@code Open -> Closed} only; a closed batch never reopens</li>
 *   <li>An identity appears in the contributor list at most once</li>
 *   <li>Contributor order is insertion order and is stable across reads</li>
 * </ul>
 *
 * @author Security Team
 * @since 1.0.0
 */
@Entity
@Table(name = "batches")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
public class Batch {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "is_open", nullable = false)
    private boolean open;

    @Getter(AccessLevel.NONE)
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "batch_contributors", joinColumns = @JoinColumn(name = "batch_id"))
    @OrderColumn(name = "contributor_order")
    @Column(name = "identity", nullable = false, length = 128)
    private List<String> contributors = new ArrayList<>();

    @Column(name = "opened_at", nullable = false, updatable = false)
    private Instant openedAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    private Batch(long id, Instant openedAt) {
        this.id = id;
        this.open = true;
        this.openedAt = openedAt;
    }

    /**
     * Open a new batch.
     *
     * @param id Batch id, must be at least 1
     * @param openedAt Opening time
     * @return Open batch with no contributors
     */
    public static Batch open(long id, Instant openedAt) {
        if (id < 1) {
            throw new IllegalArgumentException("Batch id must be >= 1: " + id);
        }
        return new Batch(id, openedAt);
    }

    /**
     * Freeze the batch.
     *
     * @throws IllegalStateException if already closed
     */
    public void close(Instant at) {
        if (!open) {
            throw new IllegalStateException("Batch " + id + " is already closed");
        }
        this.open = false;
        this.closedAt = at;
    }

    public boolean hasContributed(Identity identity) {
        return contributors.contains(identity.value());
    }

    /**
     * Append a contributor.
     *
     * @throws IllegalStateException if the batch is closed or the identity already contributed
     */
    public void addContributor(Identity identity) {
        if (!open) {
            throw new IllegalStateException("Batch " + id + " is closed");
        }
        if (hasContributed(identity)) {
            throw new IllegalStateException(identity + " already contributed to batch " + id);
        }
        contributors.add(identity.value());
    }

    /**
     * Contributors in insertion order.
     */
    public List<Identity> getContributors() {
        return contributors.stream().map(Identity::of).toList();
    }

    public int getContributorCount() {
        return contributors.size();
    }
}
