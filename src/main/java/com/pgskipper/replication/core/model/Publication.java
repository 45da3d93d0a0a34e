package com.pgskipper.replication.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * =====================================================================
 * Publication
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Read model of a logical-replication publication as found in
 * {@code pg_publication}.
 *
 * IDENTITY
 * --------
 * A publication is uniquely identified by {@code (database, name)}; the same
 * name may exist independently in several databases of one cluster.
 *
 * LIFETIME
 * --------
 * Instances are built per request from the catalog and never cached.
 *
 * JSON
 * ----
 * {"name":..,"owner":..,"database":..,"tables":{schema:[table,..]}}
 * where {@code tables} is omitted when tables were not requested.
 */
public record Publication(

		/** Publication name. */
		String name,

		/** Role name owning the publication (resolved from {@code pubowner}). */
		String owner,

		/** Database the publication lives in. */
		String database,

		/**
		 * Member tables grouped by schema name, in catalog order.
		 *
		 * NULLABLE: null when the lookup did not request tables.
		 */
		@JsonInclude(JsonInclude.Include.NON_NULL)
		Map<String, List<PublishedTable>> tables) {

	public Publication {
		if (tables != null) {
			tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables));
		}
	}

	/**
	 * Returns a copy of this publication carrying the given table membership.
	 */
	public Publication withTables(Map<String, List<PublishedTable>> tables) {
		return new Publication(name, owner, database, tables);
	}
}
