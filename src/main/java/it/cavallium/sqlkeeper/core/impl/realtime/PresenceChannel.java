package it.cavallium.sqlkeeper.core.impl.realtime;

public record PresenceChannel(String channel, int userCount) {}
