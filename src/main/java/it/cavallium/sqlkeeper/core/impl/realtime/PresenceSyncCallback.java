package it.cavallium.sqlkeeper.core.impl.realtime;

import java.util.List;

/**
 * Notified with the full user list of a channel after any change
 */
@FunctionalInterface
public interface PresenceSyncCallback {

	void onSync(String channel, List<PresenceUser> users);
}
