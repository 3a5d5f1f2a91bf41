package com.confidentialpayroll.infrastructure.persistence;

import com.confidentialpayroll.domain.model.CooldownState;
import com.confidentialpayroll.domain.model.Identity;
import com.confidentialpayroll.domain.repository.CooldownRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Component
@Transactional
@RequiredArgsConstructor
public class CooldownRepositoryAdapter implements CooldownRepository {

    private final SpringDataCooldownRepository springDataRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<CooldownState> findByIdentity(Identity identity) {
        return springDataRepository.findById(identity.value());
    }

    @Override
    public void save(CooldownState state) {
        springDataRepository.save(state);
    }
}
