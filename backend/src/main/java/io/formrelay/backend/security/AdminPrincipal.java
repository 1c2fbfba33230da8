package io.formrelay.backend.security;

import java.util.UUID;

/** The authenticated dashboard user, as carried in the security context. */
public record AdminPrincipal(UUID adminId, String email) {}
