package it.cavallium.sqlkeeper.core.impl.realtime;

import it.cavallium.sqlkeeper.core.common.SqlKeeperException;
import it.cavallium.sqlkeeper.core.common.SqlKeeperException.SqlKeeperErrorType;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory publish/subscribe on named channels, with an optional authorization check per channel
 */
public class BroadcastHub {

	private final Clock clock;
	private final Logger logger;
	private final Map<String, List<Entry>> subscriptions = new LinkedHashMap<>();
	private final Map<String, ChannelAuthorizer> authorizers = new LinkedHashMap<>();
	private long subscriptionCounter;

	public BroadcastHub() {
		this(Clock.systemUTC());
	}

	public BroadcastHub(Clock clock) {
		this.clock = clock;
		this.logger = LoggerFactory.getLogger("db.realtime.broadcast");
	}

	public int send(String channel, String event, @Nullable Object payload) {
		return send(channel, event, payload, null);
	}

	/**
	 * Deliver an event to the subscribers of a channel
	 * @return the number of subscribers that received it without failing
	 */
	public int send(String channel, String event, @Nullable Object payload, @Nullable String senderId) {
		List<Entry> targets;
		synchronized (this) {
			var entries = subscriptions.get(channel);
			if (entries == null || entries.isEmpty()) {
				return 0;
			}
			targets = List.copyOf(entries);
		}
		var broadcastEvent = new BroadcastEvent(channel, event, payload, clock.instant(), senderId);
		int delivered = 0;
		for (Entry entry : targets) {
			if (entry.info.event() != null && !entry.info.event().equals(event)) {
				continue;
			}
			try {
				entry.callback.onEvent(broadcastEvent);
				delivered++;
			} catch (RuntimeException e) {
				logger.warn("Subscriber {} failed on {}/{}", entry.info.id(), channel, event, e);
			}
		}
		return delivered;
	}

	public String subscribe(String channel, BroadcastCallback callback) {
		return subscribe(channel, null, callback);
	}

	/**
	 * @param event deliver only this event, or every event when null
	 * @return the subscription id
	 */
	public synchronized String subscribe(String channel, @Nullable String event, BroadcastCallback callback) {
		if (callback == null) {
			throw SqlKeeperException.of(SqlKeeperErrorType.INVALID_ARGUMENT, "A callback is required to subscribe to " + channel);
		}
		var now = clock.instant();
		var id = "sub_" + (++subscriptionCounter) + "_" + Long.toString(now.toEpochMilli(), 36);
		subscriptions.computeIfAbsent(channel, c -> new ArrayList<>())
				.add(new Entry(new BroadcastSubscriber(id, channel, event, now), callback));
		return id;
	}

	/**
	 * Remove one subscription, or every subscription of the channel when {@code subscriptionId} is null
	 */
	public synchronized void unsubscribe(String channel, @Nullable String subscriptionId) {
		if (subscriptionId == null) {
			subscriptions.remove(channel);
			return;
		}
		var entries = subscriptions.get(channel);
		if (entries == null) {
			return;
		}
		entries.removeIf(entry -> entry.info.id().equals(subscriptionId));
		if (entries.isEmpty()) {
			subscriptions.remove(channel);
		}
	}

	public void unsubscribe(String channel) {
		unsubscribe(channel, null);
	}

	public synchronized List<BroadcastSubscriber> getSubscribers(String channel) {
		var entries = subscriptions.get(channel);
		if (entries == null) {
			return List.of();
		}
		var result = new ArrayList<BroadcastSubscriber>(entries.size());
		for (Entry entry : entries) {
			result.add(entry.info);
		}
		return result;
	}

	public synchronized void setAuth(String channel, ChannelAuthorizer authorizer) {
		authorizers.put(channel, authorizer);
	}

	public synchronized void removeAuth(String channel) {
		authorizers.remove(channel);
	}

	/**
	 * @return true when the channel has no authorizer or the authorizer allows the user
	 */
	public boolean checkAuth(String channel, @Nullable String userId) {
		ChannelAuthorizer authorizer;
		synchronized (this) {
			authorizer = authorizers.get(channel);
		}
		return authorizer == null || authorizer.isAllowed(channel, userId);
	}

	public synchronized List<String> getChannels() {
		return List.copyOf(subscriptions.keySet());
	}

	public synchronized void reset() {
		subscriptions.clear();
		authorizers.clear();
		subscriptionCounter = 0;
	}

	private record Entry(BroadcastSubscriber info, BroadcastCallback callback) {}
}
