package com.pgskipper.replication.core.model;

import jakarta.validation.constraints.NotBlank;

public record GrantRequest(@NotBlank(message = "username must not be empty") String username) {
}
