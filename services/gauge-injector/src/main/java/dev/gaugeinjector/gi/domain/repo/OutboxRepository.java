package dev.gaugeinjector.gi.domain.repo;

import java.time.OffsetDateTime;
import java.util.List;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import dev.gaugeinjector.gi.domain.entity.Outbox;

public interface OutboxRepository extends JpaRepository<Outbox, Long> {

  @Query("""
      select o from Outbox o
      where o.sentAt is null
        and (o.lastError is null or o.lastError not like 'DEAD:%')
      order by o.createdAt asc, o.id asc
      """)
  List<Outbox> fetchUnsentOrdered(Pageable page);

  @Query("""
      select count(o) from Outbox o
      where o.sentAt is null and o.lastError like 'DEAD:%'
      """)
  long countDeadMessages();

  @Modifying
  @Query("delete from Outbox o where o.sentAt is not null and o.sentAt < :cutoff")
  int deleteSentBefore(@Param("cutoff") OffsetDateTime cutoff);
}
