package com.confidentialpayroll.domain.repository;

import com.confidentialpayroll.domain.model.Batch;

import java.util.List;
import java.util.Optional;

/**
 * Batch registry.
 *
 * <p>The current batch is the one with the highest id. Batches are never deleted.
 *
 * @author Security Team
 * @since 1.0.0
 */
public interface BatchRepository {

    Optional<Batch> findById(long id);

    /**
     * @return Batch with the highest id, empty before the first batch is opened
     */
    Optional<Batch> findCurrent();

    /**
     * All batches ordered by id.
     */
    List<Batch> findAll();

    void save(Batch batch);
}
