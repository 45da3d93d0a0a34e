package com.pgskipper.replication.core.sql;

import com.pgskipper.replication.core.error.InvalidRequestException;

/**
 * =====================================================================
 * Identifiers
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Turns user supplied names into double-quoted PostgreSQL identifiers for DDL.
 *
 * Identifiers cannot be bound as statement parameters, so publication, table,
 * schema and role names are spliced into the statement text. Two rules keep
 * that splice contained:
 *
 * - Embedded single and double quotes are doubled before the name is wrapped
 *   in double quotes, so a name cannot close its own quoting.
 * - Names containing a statement terminator ({@code ;}) or a NUL character
 *   are rejected outright.
 *
 * This is NOT a grammar check: anything else PostgreSQL refuses is reported by
 * the server when the statement runs.
 *
 * TABLE TOKENS
 * ------------
 * A table token is {@code [schema.]table[(args)]}:
 *
 *   orders               ─▶  "orders"
 *   public.orders        ─▶  "public"."orders"
 *   orders(id,name)      ─▶  "orders"(id,name)
 *   public.orders(id)    ─▶  "public"."orders"(id)
 *
 * The schema/table split happens at the first {@code .} before any
 * {@code (}. The parenthesised suffix is appended as written.
 */
public final class Identifiers {

	private Identifiers() {
	}

	/**
	 * Doubles every single and double quote in {@code value}.
	 */
	public static String escape(String value) {
		String singleQuote = value.replace("'", "''");
		return singleQuote.replace("\"", "\"\"");
	}

	/**
	 * Escapes {@code value} and wraps it in double quotes.
	 */
	public static String quote(String value) {
		return "\"" + escape(value) + "\"";
	}

	/**
	 * Quotes a table token, see the class documentation for the accepted forms.
	 */
	public static String quoteTable(String token) {
		int paren = token.indexOf('(');
		String namePart = paren < 0 ? token : token.substring(0, paren);
		String args = paren < 0 ? "" : token.substring(paren);

		int dot = namePart.indexOf('.');
		if (dot < 0) {
			return quote(namePart) + args;
		}
		return quote(namePart.substring(0, dot)) + "." + quote(namePart.substring(dot + 1)) + args;
	}

	/**
	 * Rejects blank values and values containing a statement terminator.
	 *
	 * @param value the name to check
	 * @param field name of the request field, used in the error message
	 * @return {@code value} unchanged
	 * @throws InvalidRequestException when the value is unusable
	 */
	public static String requireSafe(String value, String field) {
		if (value == null || value.isBlank()) {
			throw new InvalidRequestException(field + " must not be empty");
		}
		if (value.indexOf(';') >= 0 || value.indexOf('\0') >= 0) {
			throw new InvalidRequestException(field + " must not contain ';' or NUL characters: " + value);
		}
		return value;
	}
}
