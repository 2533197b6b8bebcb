package it.cavallium.sqlkeeper.core.impl.backup;

import it.cavallium.sqlkeeper.core.common.SqlKeeperException;
import it.cavallium.sqlkeeper.core.common.SqlKeeperException.SqlKeeperErrorType;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.regex.Pattern;

/**
 * Fixed interval approximation of a cron expression.
 * <p>
 * Recognized shapes: {@code * * * * *} (every minute), {@code *}{@code /N * * * *} (every N minutes),
 * {@code 0 * * * *} (hourly), {@code 0 *}{@code /N * * *} (every N hours), {@code M H * * *} (daily) and
 * {@code M H * * D} (weekly). Any other five-field expression runs daily.
 */
public record CronInterval(String cron, Duration interval) {

	private static final Pattern EVERY_N = Pattern.compile("^\\*/(\\d+)$");
	private static final Pattern NUMBER = Pattern.compile("^\\d+$");

	public static CronInterval parse(String cron) {
		var parts = cron.trim().split("\\s+");
		if (parts.length != 5) {
			throw SqlKeeperException.of(SqlKeeperErrorType.INVALID_CRON,
					"Invalid cron expression: \"" + cron + "\". Expected 5 parts (min hour dom mon dow)");
		}
		var minute = parts[0];
		var hour = parts[1];
		var dom = parts[2];
		var month = parts[3];
		var dow = parts[4];
		boolean anyDay = dom.equals("*") && month.equals("*");

		var everyMinutes = EVERY_N.matcher(minute);
		if (everyMinutes.matches() && hour.equals("*") && anyDay && dow.equals("*")) {
			return new CronInterval(cron, step(everyMinutes.group(1), ChronoUnit.MINUTES, cron));
		}
		if (minute.equals("*") && hour.equals("*") && anyDay && dow.equals("*")) {
			return new CronInterval(cron, Duration.ofMinutes(1));
		}
		if (minute.equals("0") && hour.equals("*") && anyDay && dow.equals("*")) {
			return new CronInterval(cron, Duration.ofHours(1));
		}
		var everyHours = EVERY_N.matcher(hour);
		if (minute.equals("0") && everyHours.matches() && anyDay && dow.equals("*")) {
			return new CronInterval(cron, step(everyHours.group(1), ChronoUnit.HOURS, cron));
		}
		if (NUMBER.matcher(minute).matches() && NUMBER.matcher(hour).matches() && anyDay && dow.equals("*")) {
			return new CronInterval(cron, Duration.ofDays(1));
		}
		if (NUMBER.matcher(minute).matches() && NUMBER.matcher(hour).matches() && anyDay && NUMBER.matcher(dow).matches()) {
			return new CronInterval(cron, Duration.ofDays(7));
		}
		return new CronInterval(cron, Duration.ofDays(1));
	}

	private static Duration step(String value, ChronoUnit unit, String cron) {
		long n;
		Duration interval;
		try {
			n = Long.parseLong(value);
			interval = Duration.of(n, unit);
			// must fit the millisecond scheduler
			interval.toMillis();
		} catch (NumberFormatException | ArithmeticException e) {
			throw SqlKeeperException.of(SqlKeeperErrorType.INVALID_CRON, "Step out of range in cron expression: \"" + cron + "\"", e);
		}
		if (n <= 0) {
			throw SqlKeeperException.of(SqlKeeperErrorType.INVALID_CRON, "Invalid step in cron expression: \"" + cron + "\"");
		}
		return interval;
	}

	public long intervalMs() {
		return interval.toMillis();
	}
}
