package com.pgskipper.replication.core.sql;

import java.util.List;
import java.util.stream.Collectors;

/**
 * =====================================================================
 * PublicationStatements
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Builds the DDL text for publication create / alter / drop, and holds the
 * catalog queries used to look publications up.
 *
 * Pure functions: no I/O, no state.
 *
 * CLAUSE COMBINATION
 * ------------------
 * Given a table list T and a schema list S:
 *
 *   T only   ─▶  table template
 *   S only   ─▶  schema template
 *   T and S  ─▶  table template + ", TABLES IN SCHEMA <S>;"
 *
 * so a request naming both is still one statement, executed in one round trip
 * and therefore one DDL transaction on the server.
 */
public final class PublicationStatements {

	public static final String SELECT_PUBLICATION = "SELECT pubname, pubowner::regrole::text AS owner "
			+ "FROM pg_publication WHERE pubname = $1";

	public static final String SELECT_PUBLICATION_TABLES = "SELECT schemaname, tablename, "
			+ "COALESCE(attnames::text, '{}') AS attnames, COALESCE(rowfilter, '') AS rowfilter "
			+ "FROM pg_publication_tables WHERE pubname = $1 ORDER BY schemaname, tablename";

	private static final String CREATE_ALL_TABLES = "CREATE PUBLICATION %s FOR ALL TABLES;";
	private static final String CREATE_WITH_TABLES = "CREATE PUBLICATION %s FOR TABLE %s";
	private static final String CREATE_WITH_SCHEMAS = "CREATE PUBLICATION %s FOR TABLES IN SCHEMA %s";
	private static final String ALTER_ADD_WITH_TABLES = "ALTER PUBLICATION %s ADD TABLE %s";
	private static final String ALTER_ADD_WITH_SCHEMAS = "ALTER PUBLICATION %s ADD TABLES IN SCHEMA %s";
	private static final String ALTER_SET_WITH_TABLES = "ALTER PUBLICATION %s SET TABLE %s";
	private static final String ALTER_SET_WITH_SCHEMAS = "ALTER PUBLICATION %s SET TABLES IN SCHEMA %s";
	private static final String DROP = "DROP PUBLICATION %s;";

	private static final String SCHEMAS_APPEND = "%s, TABLES IN SCHEMA %s;";

	private PublicationStatements() {
	}

	/**
	 * CREATE PUBLICATION; {@code FOR ALL TABLES} when both lists are empty.
	 */
	public static String create(String publication, List<String> tables, List<String> schemas) {
		if (tables.isEmpty() && schemas.isEmpty()) {
			return String.format(CREATE_ALL_TABLES, quotedName(publication));
		}
		return withTablesAndSchemas(publication, tables, schemas, CREATE_WITH_TABLES, CREATE_WITH_SCHEMAS);
	}

	/**
	 * ALTER PUBLICATION ... ADD; at least one of the lists must be non-empty.
	 */
	public static String alterAdd(String publication, List<String> tables, List<String> schemas) {
		requireMembers(publication, tables, schemas);
		return withTablesAndSchemas(publication, tables, schemas, ALTER_ADD_WITH_TABLES, ALTER_ADD_WITH_SCHEMAS);
	}

	/**
	 * ALTER PUBLICATION ... SET, replacing the current membership; at least one
	 * of the lists must be non-empty.
	 */
	public static String alterSet(String publication, List<String> tables, List<String> schemas) {
		requireMembers(publication, tables, schemas);
		return withTablesAndSchemas(publication, tables, schemas, ALTER_SET_WITH_TABLES, ALTER_SET_WITH_SCHEMAS);
	}

	public static String drop(String publication) {
		return String.format(DROP, quotedName(publication));
	}

	private static String withTablesAndSchemas(String publication, List<String> tables, List<String> schemas,
			String tablesTemplate, String schemasTemplate) {
		String name = quotedName(publication);
		boolean hasTables = !tables.isEmpty();
		boolean hasSchemas = !schemas.isEmpty();

		String query = null;
		if (hasTables) {
			query = String.format(tablesTemplate, name, tableList(tables));
		}
		if (hasSchemas) {
			if (hasTables) {
				query = String.format(SCHEMAS_APPEND, query, schemaList(schemas));
			} else {
				query = String.format(schemasTemplate, name, schemaList(schemas));
			}
		}
		return query;
	}

	private static String tableList(List<String> tables) {
		return tables.stream()
				.map(t -> Identifiers.quoteTable(Identifiers.requireSafe(t, "table")))
				.collect(Collectors.joining(","));
	}

	private static String schemaList(List<String> schemas) {
		return schemas.stream()
				.map(s -> Identifiers.quote(Identifiers.requireSafe(s, "schema")))
				.collect(Collectors.joining(","));
	}

	private static String quotedName(String publication) {
		return Identifiers.quote(Identifiers.requireSafe(publication, "publicationName"));
	}

	private static void requireMembers(String publication, List<String> tables, List<String> schemas) {
		if (tables.isEmpty() && schemas.isEmpty()) {
			throw new IllegalArgumentException("Nothing to add to publication " + publication);
		}
	}
}
