package it.cavallium.sqlkeeper.core.impl.realtime;

import it.cavallium.sqlkeeper.core.impl.Timers;
import java.io.Closeable;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory presence per channel. Users are evicted by a heartbeat sweep once they have not been tracked for longer
 * than the presence timeout. Nothing is persisted.
 */
public class PresenceTracker implements Closeable {

	private final Clock clock;
	private final Logger logger;
	private final Map<String, ChannelPresence> channels = new LinkedHashMap<>();
	private Duration heartbeat;
	private Duration timeout;
	private ScheduledExecutorService timer;
	private ScheduledFuture<?> heartbeatTask;

	public PresenceTracker(RealtimeSettings settings) {
		this(settings, Clock.systemUTC());
	}

	public PresenceTracker(RealtimeSettings settings, Clock clock) {
		this.clock = clock;
		this.heartbeat = settings.presenceHeartbeat();
		this.timeout = settings.presenceTimeout();
		this.logger = LoggerFactory.getLogger("db.realtime.presence");
	}

	private ChannelPresence channel(String channel) {
		return channels.computeIfAbsent(channel, c -> new ChannelPresence());
	}

	public PresenceUser track(String channel, String userId) {
		return track(channel, userId, Map.of());
	}

	/**
	 * Mark a user as present. Tracking a user again merges {@code state} into the previous one and refreshes it.
	 */
	public synchronized PresenceUser track(String channel, String userId, Map<String, Object> state) {
		startHeartbeat();
		var presence = channel(channel);
		var now = clock.instant();
		var existing = presence.users.get(userId);
		PresenceUser user;
		if (existing != null) {
			var merged = new LinkedHashMap<>(existing.state());
			merged.putAll(state);
			user = new PresenceUser(userId, Collections.unmodifiableMap(merged), existing.joinedAt(), now);
			presence.users.put(userId, user);
		} else {
			user = new PresenceUser(userId, Collections.unmodifiableMap(new LinkedHashMap<>(state)), now, now);
			presence.users.put(userId, user);
			for (PresenceCallback callback : presence.onJoin) {
				notifyPresence(callback, channel, user);
			}
		}
		fireSync(channel, presence);
		return user;
	}

	public synchronized void untrack(String channel, String userId) {
		var presence = channels.get(channel);
		if (presence == null) {
			return;
		}
		var user = presence.users.remove(userId);
		if (user == null) {
			return;
		}
		for (PresenceCallback callback : presence.onLeave) {
			notifyPresence(callback, channel, user);
		}
		fireSync(channel, presence);
		dropIfUnused(channel, presence);
	}

	public synchronized List<PresenceUser> getState(String channel) {
		var presence = channels.get(channel);
		return presence == null ? List.of() : List.copyOf(presence.users.values());
	}

	public synchronized void onJoin(String channel, PresenceCallback callback) {
		channel(channel).onJoin.add(callback);
		startHeartbeat();
	}

	public synchronized void onLeave(String channel, PresenceCallback callback) {
		channel(channel).onLeave.add(callback);
		startHeartbeat();
	}

	public synchronized void onSync(String channel, PresenceSyncCallback callback) {
		channel(channel).onSync.add(callback);
		startHeartbeat();
	}

	/**
	 * Change the heartbeat period and the idle timeout. A running heartbeat is restarted with the new period.
	 */
	public synchronized void configure(@Nullable Duration heartbeat, @Nullable Duration timeout) {
		if (heartbeat != null) {
			this.heartbeat = heartbeat;
		}
		if (timeout != null) {
			this.timeout = timeout;
		}
		if (heartbeatTask != null) {
			heartbeatTask.cancel(false);
			heartbeatTask = null;
			startHeartbeat();
		}
	}

	/**
	 * @return channels with at least one user
	 */
	public synchronized List<PresenceChannel> getChannels() {
		var result = new ArrayList<PresenceChannel>();
		for (Map.Entry<String, ChannelPresence> entry : channels.entrySet()) {
			if (!entry.getValue().users.isEmpty()) {
				result.add(new PresenceChannel(entry.getKey(), entry.getValue().users.size()));
			}
		}
		return result;
	}

	/**
	 * Evict the users idle for longer than the timeout. This is the body of the heartbeat.
	 * @return the number of evicted users
	 */
	public synchronized int sweep() {
		var now = clock.instant();
		int evicted = 0;
		for (var iterator = channels.entrySet().iterator(); iterator.hasNext(); ) {
			var entry = iterator.next();
			var channel = entry.getKey();
			var presence = entry.getValue();
			var expired = new ArrayList<PresenceUser>();
			for (var users = presence.users.values().iterator(); users.hasNext(); ) {
				var user = users.next();
				if (Duration.between(user.lastSeenAt(), now).compareTo(timeout) > 0) {
					expired.add(user);
					users.remove();
				}
			}
			for (PresenceUser user : expired) {
				for (PresenceCallback callback : presence.onLeave) {
					notifyPresence(callback, channel, user);
				}
			}
			if (!expired.isEmpty()) {
				logger.debug("Evicted {} idle user(s) from {}", expired.size(), channel);
				fireSync(channel, presence);
				evicted += expired.size();
			}
			if (presence.isUnused()) {
				iterator.remove();
			}
		}
		return evicted;
	}

	/**
	 * Forget every channel and stop the heartbeat
	 */
	public synchronized void reset() {
		channels.clear();
		if (heartbeatTask != null) {
			heartbeatTask.cancel(false);
			heartbeatTask = null;
		}
	}

	@Override
	public void close() {
		ScheduledExecutorService timerToStop;
		synchronized (this) {
			reset();
			timerToStop = timer;
			timer = null;
		}
		if (timerToStop != null) {
			Timers.shutdown(timerToStop);
		}
	}

	private void startHeartbeat() {
		if (heartbeatTask != null) {
			return;
		}
		if (timer == null) {
			timer = Timers.newTimer("presence-heartbeat");
		}
		long periodMs = Math.max(1, heartbeat.toMillis());
		heartbeatTask = timer.scheduleAtFixedRate(() -> {
			try {
				sweep();
			} catch (RuntimeException e) {
				logger.error("Presence sweep failed", e);
			}
		}, periodMs, periodMs, TimeUnit.MILLISECONDS);
	}

	private void dropIfUnused(String channel, ChannelPresence presence) {
		if (presence.isUnused()) {
			channels.remove(channel);
		}
	}

	private void fireSync(String channel, ChannelPresence presence) {
		var users = List.copyOf(presence.users.values());
		for (PresenceSyncCallback callback : presence.onSync) {
			try {
				callback.onSync(channel, users);
			} catch (RuntimeException e) {
				logger.warn("Presence sync callback failed on {}", channel, e);
			}
		}
	}

	private void notifyPresence(PresenceCallback callback, String channel, PresenceUser user) {
		try {
			callback.onPresence(channel, user);
		} catch (RuntimeException e) {
			logger.warn("Presence callback failed on {} for {}", channel, user.userId(), e);
		}
	}

	private static final class ChannelPresence {

		final Map<String, PresenceUser> users = new LinkedHashMap<>();
		final List<PresenceCallback> onJoin = new CopyOnWriteArrayList<>();
		final List<PresenceCallback> onLeave = new CopyOnWriteArrayList<>();
		final List<PresenceSyncCallback> onSync = new CopyOnWriteArrayList<>();

		boolean isUnused() {
			return users.isEmpty() && onJoin.isEmpty() && onLeave.isEmpty() && onSync.isEmpty();
		}
	}
}
