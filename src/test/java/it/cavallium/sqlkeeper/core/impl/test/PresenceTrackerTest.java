package it.cavallium.sqlkeeper.core.impl.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import it.cavallium.sqlkeeper.core.impl.realtime.PresenceChannel;
import it.cavallium.sqlkeeper.core.impl.realtime.PresenceTracker;
import it.cavallium.sqlkeeper.core.impl.realtime.PresenceUser;
import it.cavallium.sqlkeeper.core.impl.realtime.RealtimeSettings;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PresenceTrackerTest {

	private MutableClock clock;
	private PresenceTracker presence;

	@BeforeEach
	void setUp() {
		clock = new MutableClock(Instant.parse("2024-08-01T12:00:00Z"));
		// sweeps are driven by hand
		presence = new PresenceTracker(RealtimeSettings.defaults().withPresence(Duration.ofHours(1), Duration.ofSeconds(60)),
				clock);
	}

	@AfterEach
	void tearDown() {
		presence.close();
	}

	private static List<String> userIds(List<PresenceUser> users) {
		return users.stream().map(PresenceUser::userId).toList();
	}

	@Test
	void trackAndUntrack() {
		var joins = new ArrayList<String>();
		var leaves = new ArrayList<String>();
		var syncs = new ArrayList<List<String>>();
		presence.onJoin("room", (channel, user) -> joins.add(user.userId()));
		presence.onLeave("room", (channel, user) -> leaves.add(user.userId()));
		presence.onSync("room", (channel, users) -> syncs.add(userIds(users)));

		presence.track("room", "alice", Map.of("status", "online"));
		presence.track("room", "bob");
		presence.untrack("room", "alice");
		presence.untrack("room", "nobody");

		assertEquals(List.of("alice", "bob"), joins);
		assertEquals(List.of("alice"), leaves);
		assertEquals(List.of(List.of("alice"), List.of("alice", "bob"), List.of("bob")), syncs);
		assertEquals(List.of("bob"), userIds(presence.getState("room")));
	}

	@Test
	void retrackMergesState() {
		var joins = new ArrayList<String>();
		presence.onJoin("room", (channel, user) -> joins.add(user.userId()));

		presence.track("room", "alice", Map.of("status", "online", "device", "phone"));
		clock.advance(Duration.ofSeconds(10));
		var user = presence.track("room", "alice", Map.of("status", "away"));

		assertEquals(List.of("alice"), joins);
		assertEquals(Map.of("status", "away", "device", "phone"), user.state());
		assertEquals(Instant.parse("2024-08-01T12:00:00Z"), user.joinedAt());
		assertEquals(Instant.parse("2024-08-01T12:00:10Z"), user.lastSeenAt());
	}

	@Test
	void sweepEvictsIdleUsers() {
		var leaves = new ArrayList<String>();
		presence.onLeave("room", (channel, user) -> leaves.add(user.userId()));
		presence.track("room", "alice");
		presence.track("lobby", "carol");
		clock.advance(Duration.ofSeconds(30));
		presence.track("room", "bob");

		clock.advance(Duration.ofSeconds(30));
		assertEquals(0, presence.sweep());

		clock.advance(Duration.ofSeconds(1));
		assertEquals(2, presence.sweep());
		assertEquals(List.of("alice"), leaves);
		assertEquals(List.of("bob"), userIds(presence.getState("room")));
		assertEquals(List.of(new PresenceChannel("room", 1)), presence.getChannels());
	}

	@Test
	void configureChangesTheTimeout() {
		presence.track("room", "alice");
		presence.configure(null, Duration.ofSeconds(5));
		clock.advance(Duration.ofSeconds(6));
		assertEquals(1, presence.sweep());
		assertTrue(presence.getState("room").isEmpty());
		assertTrue(presence.getChannels().isEmpty());
	}

	@Test
	void failingCallbacksAreIsolated() {
		var joins = new ArrayList<String>();
		presence.onJoin("room", (channel, user) -> {
			throw new IllegalStateException("boom");
		});
		presence.onJoin("room", (channel, user) -> joins.add(user.userId()));
		presence.track("room", "alice");
		assertEquals(List.of("alice"), joins);
	}

	@Test
	void resetForgetsEverything() {
		presence.track("room", "alice");
		presence.track("lobby", "bob");
		assertEquals(2, presence.getChannels().size());
		presence.reset();
		assertTrue(presence.getChannels().isEmpty());
		assertTrue(presence.getState("room").isEmpty());
	}
}
