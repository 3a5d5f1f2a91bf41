package com.confidentialpayroll.infrastructure.persistence;

import com.confidentialpayroll.domain.model.Batch;
import com.confidentialpayroll.domain.repository.BatchRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Adapter implementing the domain {@link BatchRepository} with Spring Data JPA.
 */
@Component
@Transactional
@RequiredArgsConstructor
@Slf4j
public class BatchRepositoryAdapter implements BatchRepository {

    private final SpringDataBatchRepository springDataRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<Batch> findById(long id) {
        return springDataRepository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Batch> findCurrent() {
        return springDataRepository.findTopByOrderByIdDesc();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Batch> findAll() {
        return springDataRepository.findAllByOrderByIdAsc();
    }

    @Override
    public void save(Batch batch) {
        springDataRepository.save(batch);

        log.debug("Batch persisted: id={}, open={}, contributors={}",
            batch.getId(), batch.isOpen(), batch.getContributorCount());
    }
}
