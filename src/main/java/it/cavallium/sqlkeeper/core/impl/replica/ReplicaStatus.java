package it.cavallium.sqlkeeper.core.impl.replica;

public enum ReplicaStatus {
	/**
	 * Serves reads and is kept in sync
	 */
	ACTIVE("active"),
	/**
	 * Stale after a promotion, needs a re-sync
	 */
	INACTIVE("inactive"),
	/**
	 * The last read, sync or health check failed
	 */
	ERROR("error");

	private final String id;

	ReplicaStatus(String id) {
		this.id = id;
	}

	public String id() {
		return id;
	}
}
