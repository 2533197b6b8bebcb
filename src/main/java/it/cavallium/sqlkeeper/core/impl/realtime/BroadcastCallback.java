package it.cavallium.sqlkeeper.core.impl.realtime;

@FunctionalInterface
public interface BroadcastCallback {

	void onEvent(BroadcastEvent event);
}
