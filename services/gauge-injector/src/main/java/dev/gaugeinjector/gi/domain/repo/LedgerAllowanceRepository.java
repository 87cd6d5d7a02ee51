package dev.gaugeinjector.gi.domain.repo;

import org.springframework.data.jpa.repository.JpaRepository;

import dev.gaugeinjector.gi.domain.entity.LedgerAllowance;
import dev.gaugeinjector.gi.domain.entity.LedgerAllowanceId;

public interface LedgerAllowanceRepository extends JpaRepository<LedgerAllowance, LedgerAllowanceId> {
}
