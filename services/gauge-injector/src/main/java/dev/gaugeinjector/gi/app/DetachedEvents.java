package dev.gaugeinjector.gi.app;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.fasterxml.jackson.databind.node.ObjectNode;

import dev.gaugeinjector.gi.domain.enums.InjectorEventType;
import lombok.RequiredArgsConstructor;

/**
 * Writes events in REQUIRES_NEW transactions so failure and rejection events
 * are not rolled back with the operation that raised them.
 */
@Service
@RequiredArgsConstructor
public class DetachedEvents {
  private final InjectorEvents events;

  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public void emit(InjectorEventType type, ObjectNode data) {
    events.emit(type, data);
  }
}
