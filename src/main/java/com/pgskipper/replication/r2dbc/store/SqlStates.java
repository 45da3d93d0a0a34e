package com.pgskipper.replication.r2dbc.store;

import java.util.Optional;

import io.r2dbc.spi.R2dbcException;

/**
 * SQLSTATE codes the services react to, and extraction of the code from a
 * driver failure.
 *
 * Only stable SQLSTATE codes are inspected, never message text.
 */
public final class SqlStates {

	/** {@code invalid_catalog_name}: the target database does not exist. */
	public static final String INVALID_CATALOG_NAME = "3D000";

	/** {@code duplicate_object}: e.g. a table is already member of a publication. */
	public static final String DUPLICATE_OBJECT = "42710";

	private SqlStates() {
	}

	/**
	 * Returns the first SQLSTATE found along the cause chain.
	 *
	 * The driver reports server errors during connection startup wrapped in a
	 * connection exception without a code of its own, hence the walk.
	 */
	public static Optional<String> of(Throwable error) {
		Throwable current = error;
		int depth = 0;
		while (current != null && depth++ < 16) {
			if (current instanceof R2dbcException r2dbc && r2dbc.getSqlState() != null) {
				return Optional.of(r2dbc.getSqlState());
			}
			current = current.getCause();
		}
		return Optional.empty();
	}

	public static boolean is(Throwable error, String sqlState) {
		return of(error).map(sqlState::equals).orElse(false);
	}

	public static boolean isDatabaseMissing(Throwable error) {
		return is(error, INVALID_CATALOG_NAME);
	}

	public static boolean isDuplicateObject(Throwable error) {
		return is(error, DUPLICATE_OBJECT);
	}
}
