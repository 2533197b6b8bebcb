package it.cavallium.sqlkeeper.core.impl.backup;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;

/**
 * A running backup schedule. It lives only in memory.
 */
public class ScheduleHandle {

	private final CronInterval interval;
	private final Clock clock;
	private final Logger logger;
	private ScheduledFuture<?> future;
	private boolean running = true;
	private @Nullable Instant lastRun;
	private @Nullable Instant nextRun;

	ScheduleHandle(CronInterval interval, Clock clock, Logger logger) {
		this.interval = interval;
		this.clock = clock;
		this.logger = logger;
		this.nextRun = clock.instant().plus(interval.interval());
	}

	synchronized void attach(ScheduledFuture<?> future) {
		this.future = future;
		if (!running) {
			future.cancel(false);
		}
	}

	synchronized void onTick() {
		var now = clock.instant();
		lastRun = now;
		nextRun = running ? now.plus(interval.interval()) : null;
	}

	/**
	 * Cancel the schedule. Calling it again has no effect.
	 */
	public synchronized void stop() {
		if (!running) {
			return;
		}
		running = false;
		nextRun = null;
		if (future != null) {
			future.cancel(false);
		}
		logger.info("Backup schedule stopped: {}", interval.cron());
	}

	public synchronized boolean isRunning() {
		return running;
	}

	public synchronized @Nullable Instant nextRun() {
		return nextRun;
	}

	public synchronized @Nullable Instant lastRun() {
		return lastRun;
	}

	public String cron() {
		return interval.cron();
	}

	public long intervalMs() {
		return interval.intervalMs();
	}
}
