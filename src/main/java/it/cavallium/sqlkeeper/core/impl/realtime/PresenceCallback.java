package it.cavallium.sqlkeeper.core.impl.realtime;

/**
 * Notified when a single user joins or leaves a channel
 */
@FunctionalInterface
public interface PresenceCallback {

	void onPresence(String channel, PresenceUser user);
}
