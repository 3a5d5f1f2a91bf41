package com.confidentialpayroll.support;

import com.confidentialpayroll.domain.model.CooldownState;
import com.confidentialpayroll.domain.model.Identity;
import com.confidentialpayroll.domain.repository.CooldownRepository;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public class InMemoryCooldownRepository implements CooldownRepository {

    private final Map<Identity, CooldownState> states = new HashMap<>();

    @Override
    public Optional<CooldownState> findByIdentity(Identity identity) {
        return Optional.ofNullable(states.get(identity));
    }

    @Override
    public void save(CooldownState state) {
        states.put(state.getIdentity(), state);
    }
}
