package com.confidentialpayroll.infrastructure.persistence;

import com.confidentialpayroll.domain.model.CooldownState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SpringDataCooldownRepository extends JpaRepository<CooldownState, String> {
}
