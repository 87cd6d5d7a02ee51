package dev.gaugeinjector.gi.domain.repo;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import dev.gaugeinjector.gi.domain.entity.GaugeSchedule;

@Repository
public interface GaugeScheduleRepository extends JpaRepository<GaugeSchedule, String> {

  // the watch list, in submission order
  List<GaugeSchedule> findByActiveTrueOrderByListPositionAsc();

  long countByActiveTrue();
}
