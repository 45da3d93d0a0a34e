package com.pgskipper.replication.core.sql;

/**
 * DDL for role attributes managed by the controller.
 */
public final class RoleStatements {

	private static final String GRANT_REPLICATION = "ALTER ROLE %s WITH REPLICATION;";

	private RoleStatements() {
	}

	/**
	 * Grants the REPLICATION attribute. Granting it twice is a no-op on the
	 * server, so no existence check precedes it.
	 */
	public static String grantReplication(String username) {
		return String.format(GRANT_REPLICATION, Identifiers.quote(Identifiers.requireSafe(username, "username")));
	}
}
