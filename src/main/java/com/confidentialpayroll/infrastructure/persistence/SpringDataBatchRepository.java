package com.confidentialpayroll.infrastructure.persistence;

import com.confidentialpayroll.domain.model.Batch;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for batches.
 */
@Repository
public interface SpringDataBatchRepository extends JpaRepository<Batch, Long> {

    Optional<Batch> findTopByOrderByIdDesc();

    List<Batch> findAllByOrderByIdAsc();
}
