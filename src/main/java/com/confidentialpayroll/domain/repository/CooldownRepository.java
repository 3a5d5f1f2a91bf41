package com.confidentialpayroll.domain.repository;

import com.confidentialpayroll.domain.model.CooldownState;
import com.confidentialpayroll.domain.model.Identity;

import java.util.Optional;

public interface CooldownRepository {

    Optional<CooldownState> findByIdentity(Identity identity);

    void save(CooldownState state);
}
