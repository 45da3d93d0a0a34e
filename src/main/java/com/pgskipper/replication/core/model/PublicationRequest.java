package com.pgskipper.replication.core.model;

import java.util.List;
import java.util.Objects;

import jakarta.validation.constraints.NotBlank;

/**
 * Desired state of a publication, as sent to the create / alter / drop
 * endpoints.
 *
 * {@code tables} and {@code schemas} are sets: null becomes empty and
 * duplicates (and null entries) are dropped, keeping first-seen order so generated DDL is stable.
 *
 * Table entries may be schema-qualified ({@code public.orders}) and may carry a
 * column list ({@code orders(id,name)}).
 */
public record PublicationRequest(

		@NotBlank(message = "publicationName must not be empty")
		String publicationName,

		@NotBlank(message = "database must not be empty")
		String database,

		List<String> tables,

		List<String> schemas) {

	public PublicationRequest {
		tables = distinct(tables);
		schemas = distinct(schemas);
	}

	public static PublicationRequest of(String publicationName, String database) {
		return new PublicationRequest(publicationName, database, List.of(), List.of());
	}

	public boolean hasMembers() {
		return !tables.isEmpty() || !schemas.isEmpty();
	}

	private static List<String> distinct(List<String> values) {
		if (values == null || values.isEmpty()) {
			return List.of();
		}
		return values.stream().filter(Objects::nonNull).distinct().toList();
	}
}
