package it.cavallium.sqlkeeper.core.impl;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Background timers. Timer threads are daemons, so a forgotten timer never keeps the process alive.
 */
public final class Timers {

	private Timers() {
	}

	public static ScheduledExecutorService newTimer(String name) {
		var threadFactory = new ThreadFactoryBuilder()
				.setDaemon(true)
				.setNameFormat(name + "-%d")
				.build();
		var executor = new ScheduledThreadPoolExecutor(1, threadFactory);
		executor.setRemoveOnCancelPolicy(true);
		executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
		return executor;
	}

	public static void shutdown(ScheduledExecutorService executor) {
		executor.shutdown();
		try {
			if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
				executor.shutdownNow();
			}
		} catch (InterruptedException e) {
			executor.shutdownNow();
			Thread.currentThread().interrupt();
		}
	}
}
