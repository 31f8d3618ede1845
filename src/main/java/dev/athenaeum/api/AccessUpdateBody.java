package dev.athenaeum.api;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * JSON body of {@code PUT /api/content/{id}/access}.
 *
 * @param tenantPath new tenant scope; null makes the item platform-wide
 * @param requiredRoles new required roles; null or empty means any role
 */
public record AccessUpdateBody(@Nullable String tenantPath, @Nullable List<String> requiredRoles) {}
