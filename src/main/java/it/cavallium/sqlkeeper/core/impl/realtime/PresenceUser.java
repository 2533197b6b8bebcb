package it.cavallium.sqlkeeper.core.impl.realtime;

import java.time.Instant;
import java.util.Map;

/**
 * A user present on a channel
 * @param state user-defined attributes, merged on every re-track
 */
public record PresenceUser(String userId, Map<String, Object> state, Instant joinedAt, Instant lastSeenAt) {}
