package com.pgskipper.replication.core.model;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One table member of a publication, as reported by
 * {@code pg_publication_tables}.
 *
 * @param name       table name (without schema; the schema is the key of the
 *                   enclosing map in {@link Publication#tables()})
 * @param attributes published column names, in catalog order
 * @param rowFilter  row filter predicate, empty when the table has none
 */
public record PublishedTable(

		String name,

		@JsonProperty("attrNames")
		List<String> attributes,

		@JsonProperty("rowfilter")
		@JsonInclude(JsonInclude.Include.NON_EMPTY)
		String rowFilter) {

	public PublishedTable {
		attributes = attributes == null ? List.of() : List.copyOf(attributes);
		rowFilter = rowFilter == null ? "" : rowFilter;
	}

	/**
	 * Parses the text form of a PostgreSQL name array ({@code {id,name}}) into
	 * its elements.
	 *
	 * Only the outer braces are stripped and the content is split on commas; an
	 * empty array yields an empty list.
	 */
	public static List<String> parseAttributeArray(String attrs) {
		if (attrs == null) {
			return List.of();
		}
		String body = attrs.trim();
		if (body.startsWith("{")) {
			body = body.substring(1);
		}
		if (body.endsWith("}")) {
			body = body.substring(0, body.length() - 1);
		}
		if (body.isEmpty()) {
			return List.of();
		}
		List<String> out = new ArrayList<>();
		for (String part : body.split(",", -1)) {
			out.add(part);
		}
		return out;
	}
}
