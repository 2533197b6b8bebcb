package it.cavallium.sqlkeeper.core.impl.realtime;

import java.time.Instant;
import org.jetbrains.annotations.Nullable;

/**
 * @param event the only event delivered to this subscriber, or null for every event of the channel
 */
public record BroadcastSubscriber(String id, String channel, @Nullable String event, Instant subscribedAt) {}
