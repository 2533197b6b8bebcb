package it.cavallium.sqlkeeper.core.impl.realtime;

import java.time.Instant;
import org.jetbrains.annotations.Nullable;

public record BroadcastEvent(String channel,
		String event,
		@Nullable Object payload,
		Instant timestamp,
		@Nullable String senderId) {}
