package dev.gaugeinjector.gi.domain.repo;

import org.springframework.data.jpa.repository.JpaRepository;

import dev.gaugeinjector.gi.domain.entity.LedgerBalance;
import dev.gaugeinjector.gi.domain.entity.LedgerBalanceId;

public interface LedgerBalanceRepository extends JpaRepository<LedgerBalance, LedgerBalanceId> {
}
