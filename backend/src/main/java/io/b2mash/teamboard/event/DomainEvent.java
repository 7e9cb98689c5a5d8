package io.b2mash.teamboard.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Base interface for events published via Spring's ApplicationEventPublisher. Implementations are
 * records holding ids and plain values only, never JPA entities, so they stay valid after the
 * publishing transaction has committed and its persistence context is closed.
 */
public sealed interface DomainEvent permits TaskNotificationEvent {

  String eventType();

  String entityType();

  UUID entityId();

  UUID actorMemberId();

  Instant occurredAt();

  Map<String, Object> details();
}
