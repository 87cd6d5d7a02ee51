package dev.gaugeinjector.gi.domain.repo;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import dev.gaugeinjector.gi.domain.entity.InjectorSettings;
import jakarta.persistence.LockModeType;

@Repository
public interface InjectorSettingsRepository extends JpaRepository<InjectorSettings, Integer> {

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("select s from InjectorSettings s where s.id = :id")
  Optional<InjectorSettings> lockById(@Param("id") Integer id);
}
