package it.cavallium.sqlkeeper.core.impl.realtime;

import static it.cavallium.sqlkeeper.core.common.Utils.quoteIdentifier;

import it.cavallium.sqlkeeper.core.common.DatabaseAdapter;
import it.cavallium.sqlkeeper.core.common.SqlKeeperException;
import it.cavallium.sqlkeeper.core.common.SqlKeeperException.SqlKeeperErrorType;
import it.cavallium.sqlkeeper.core.common.cdc.CdcCallback;
import it.cavallium.sqlkeeper.core.common.cdc.CdcChange;
import it.cavallium.sqlkeeper.core.common.cdc.CdcEventType;
import it.cavallium.sqlkeeper.core.common.cdc.CdcFilter;
import it.cavallium.sqlkeeper.core.common.cdc.CdcSubscription;
import it.cavallium.sqlkeeper.core.impl.SchemaCatalog;
import it.cavallium.sqlkeeper.core.impl.Timers;
import java.io.Closeable;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

/**
 * Change-data-capture by polling.
 * <p>
 * Every cycle reads the watched tables, compares them with the previous snapshot and emits the differences as
 * {@link CdcChange}s. Writes that cancel each other out between two cycles are not observed, and several updates of
 * the same row between two cycles are seen as one.
 * <p>
 * The polling timer starts with the first active subscription and stops when none is left.
 */
public class CdcEngine implements Closeable {

	private final DatabaseAdapter adapter;
	private final Clock clock;
	private final Logger logger;
	private final Map<String, Subscription> subscriptions = new LinkedHashMap<>();
	private final Map<String, TableSnapshot> snapshots = new ConcurrentHashMap<>();
	private final ReentrantLock pollLock = new ReentrantLock();
	private long subscriptionCounter;
	private long pollIntervalMs;
	private ScheduledExecutorService timer;
	private ScheduledFuture<?> pollTask;

	public CdcEngine(DatabaseAdapter adapter, RealtimeSettings settings) {
		this(adapter, settings, Clock.systemUTC());
	}

	public CdcEngine(DatabaseAdapter adapter, RealtimeSettings settings, Clock clock) {
		this.adapter = adapter;
		this.clock = clock;
		this.pollIntervalMs = Math.max(RealtimeSettings.MIN_POLL_INTERVAL.toMillis(), settings.pollInterval().toMillis());
		this.logger = LoggerFactory.getLogger("db.realtime.cdc");
	}

	public String subscribe(String table, CdcEventType event, CdcCallback callback) {
		return subscribe(table, event, callback, null);
	}

	/**
	 * @param filter {@code column=operator.value}; a malformed filter is ignored
	 * @return the subscription id
	 */
	public synchronized String subscribe(String table, CdcEventType event, CdcCallback callback, @Nullable String filter) {
		if (table == null || table.isBlank()) {
			throw SqlKeeperException.of(SqlKeeperErrorType.INVALID_ARGUMENT, "Table name is required");
		}
		var parsedFilter = CdcFilter.parse(filter);
		if (filter != null && !filter.isEmpty() && parsedFilter == null) {
			logger.warn("Ignoring malformed filter \"{}\" on table {}", filter, table);
		}
		var now = clock.instant();
		var id = "cdc_" + (++subscriptionCounter) + "_" + Long.toString(now.toEpochMilli(), 36);
		subscriptions.put(id, new Subscription(id, table, event, callback, parsedFilter, now));
		logger.debug("Subscribed {} to {} on {}", id, event, table);
		startPolling();
		return id;
	}

	/**
	 * Remove a subscription. Every snapshot is dropped, so the next cycle starts from a fresh baseline.
	 */
	public synchronized void unsubscribe(String id) {
		if (subscriptions.remove(id) != null) {
			logger.debug("Unsubscribed {}", id);
		}
		snapshots.clear();
		stopPollingIfIdle();
	}

	public synchronized void pause(String id) {
		var subscription = subscriptions.get(id);
		if (subscription != null) {
			subscription.active = false;
		}
		stopPollingIfIdle();
	}

	public synchronized void resume(String id) {
		var subscription = subscriptions.get(id);
		if (subscription != null) {
			subscription.active = true;
			startPolling();
		}
	}

	public synchronized List<CdcSubscription> getSubscriptions() {
		var result = new ArrayList<CdcSubscription>(subscriptions.size());
		for (Subscription subscription : subscriptions.values()) {
			result.add(subscription.toInfo());
		}
		return result;
	}

	/**
	 * Change the delay between two cycles. Values below {@link RealtimeSettings#MIN_POLL_INTERVAL} are raised to it.
	 */
	public synchronized void setPollInterval(long ms) {
		pollIntervalMs = Math.max(RealtimeSettings.MIN_POLL_INTERVAL.toMillis(), ms);
		if (pollTask != null) {
			pollTask.cancel(false);
			pollTask = null;
			startPolling();
		}
	}

	public synchronized long getPollInterval() {
		return pollIntervalMs;
	}

	public synchronized boolean isPolling() {
		return pollTask != null;
	}

	/**
	 * Changes of a table as a stream. The subscription is created on subscribe and removed on cancel.
	 */
	public Flux<CdcChange> changes(String table, CdcEventType event, @Nullable String filter) {
		return Flux.create(sink -> {
			var id = subscribe(table, event, sink::next, filter);
			sink.onDispose(() -> unsubscribe(id));
		}, FluxSink.OverflowStrategy.BUFFER);
	}

	public Flux<CdcChange> changes(String table, CdcEventType event) {
		return changes(table, event, null);
	}

	private void startPolling() {
		if (pollTask != null || !hasActiveSubscriptions()) {
			return;
		}
		if (timer == null) {
			timer = Timers.newTimer("cdc-poll");
		}
		pollTask = timer.scheduleWithFixedDelay(this::scheduledPoll, pollIntervalMs, pollIntervalMs, TimeUnit.MILLISECONDS);
	}

	private void stopPollingIfIdle() {
		if (pollTask != null && !hasActiveSubscriptions()) {
			pollTask.cancel(false);
			pollTask = null;
		}
	}

	private boolean hasActiveSubscriptions() {
		for (Subscription subscription : subscriptions.values()) {
			if (subscription.active) {
				return true;
			}
		}
		return false;
	}

	private void scheduledPoll() {
		try {
			poll();
		} catch (RuntimeException e) {
			logger.error("Change polling failed", e);
		}
	}

	/**
	 * Run one cycle now. Cycles never overlap.
	 */
	public void poll() {
		Map<String, List<Subscription>> byTable = new LinkedHashMap<>();
		synchronized (this) {
			for (Subscription subscription : subscriptions.values()) {
				if (subscription.active) {
					byTable.computeIfAbsent(subscription.table, t -> new ArrayList<>()).add(subscription);
				}
			}
		}
		if (byTable.isEmpty()) {
			return;
		}
		pollLock.lock();
		try {
			for (Map.Entry<String, List<Subscription>> entry : byTable.entrySet()) {
				pollTable(entry.getKey(), entry.getValue());
			}
		} finally {
			pollLock.unlock();
		}
	}

	private void pollTable(String table, List<Subscription> tableSubscriptions) {
		var snapshot = snapshots.get(table);
		List<Map<String, Object>> rows;
		try {
			rows = adapter.query("SELECT * FROM " + quoteIdentifier(table)).rows();
		} catch (SqlKeeperException e) {
			logger.debug("Can't poll table {}: {}", table, e.getMessage());
			if (snapshot == null) {
				// the table may not exist yet, its first rows will be reported as inserts
				snapshots.put(table, TableSnapshot.of(table, SchemaCatalog.DEFAULT_PRIMARY_KEY, List.of()));
			}
			return;
		}
		if (snapshot == null) {
			String primaryKey;
			try {
				primaryKey = SchemaCatalog.detectPrimaryKey(adapter, table);
			} catch (SqlKeeperException e) {
				primaryKey = SchemaCatalog.DEFAULT_PRIMARY_KEY;
			}
			snapshots.put(table, TableSnapshot.of(table, primaryKey, rows));
			logger.debug("Snapshot of {} taken: {} rows, key {}", table, rows.size(), primaryKey);
			return;
		}
		for (CdcChange change : snapshot.advance(rows, clock.instant())) {
			dispatch(tableSubscriptions, change);
		}
	}

	private void dispatch(List<Subscription> tableSubscriptions, CdcChange change) {
		var targetRow = change.targetRow();
		for (Subscription subscription : tableSubscriptions) {
			if (!subscription.active || !subscription.event.matches(change.type())) {
				continue;
			}
			if (subscription.filter != null && targetRow != null && !subscription.filter.matches(targetRow)) {
				continue;
			}
			try {
				subscription.callback.onChange(change);
			} catch (RuntimeException e) {
				logger.warn("Subscriber {} failed on {} of {}", subscription.id, change.type(), change.table(), e);
			}
		}
	}

	/**
	 * Drop every subscription and snapshot and stop polling
	 */
	public synchronized void reset() {
		subscriptions.clear();
		snapshots.clear();
		subscriptionCounter = 0;
		if (pollTask != null) {
			pollTask.cancel(false);
			pollTask = null;
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

	private static final class Subscription {

		final String id;
		final String table;
		final CdcEventType event;
		final CdcCallback callback;
		final @Nullable CdcFilter filter;
		final Instant createdAt;
		volatile boolean active = true;

		Subscription(String id, String table, CdcEventType event, CdcCallback callback, @Nullable CdcFilter filter,
				Instant createdAt) {
			this.id = id;
			this.table = table;
			this.event = event;
			this.callback = callback;
			this.filter = filter;
			this.createdAt = createdAt;
		}

		CdcSubscription toInfo() {
			return new CdcSubscription(id, table, event, filter != null ? filter.toString() : null, createdAt, active);
		}
	}
}
