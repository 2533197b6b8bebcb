package it.cavallium.sqlkeeper.core.impl.realtime;

import org.jetbrains.annotations.Nullable;

@FunctionalInterface
public interface ChannelAuthorizer {

	boolean isAllowed(String channel, @Nullable String userId);
}
