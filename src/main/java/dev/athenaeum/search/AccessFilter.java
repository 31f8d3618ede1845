package dev.athenaeum.search;

import dev.athenaeum.content.ContentItem;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Narrows fused candidates to the items a principal may read.
 *
 * <p>An item is readable iff both hold:
 *
 * <ul>
 *   <li>tenant: the item has no tenant path, or its path equals one of the principal's tenants or
 *       lies beneath one ({@code acme} grants {@code acme/legal})
 *   <li>role: the item requires no roles, or the principal holds at least one of them
 * </ul>
 *
 * <p>Fails closed: a candidate whose item is missing from the lookup is dropped.
 */
@Component
public class AccessFilter {

  private static final Logger log = LoggerFactory.getLogger(AccessFilter.class);

  /**
   * Keeps readable candidates, preserving order.
   *
   * @param principal the caller
   * @param candidates ranked candidates
   * @param items the candidates' items by id
   * @return readable candidates in input order
   * @throws UnauthorizedException if the principal carries no claims at all
   */
  public List<FusedCandidate> filter(
      Principal principal, List<FusedCandidate> candidates, Map<UUID, ContentItem> items) {
    requireClaims(principal);
    List<FusedCandidate> readable = new ArrayList<>(candidates.size());
    for (FusedCandidate candidate : candidates) {
      ContentItem item = items.get(candidate.contentItemId());
      if (item == null) {
        log.debug("Dropping candidate {}: content item not found", candidate.contentItemId());
      } else if (canRead(principal, item)) {
        readable.add(candidate);
      } else {
        log.debug(
            "Dropping candidate {}: outside scope of principal {}",
            candidate.contentItemId(),
            principal.principalId());
      }
    }
    return readable;
  }

  /** Throws if the principal has no role and no tenant claim. */
  public void requireClaims(Principal principal) {
    if (!principal.hasClaims()) {
      throw new UnauthorizedException("Request carries no role or tenant claims");
    }
  }

  /** Evaluates the visibility rule for a single item. */
  public boolean canRead(Principal principal, ContentItem item) {
    return tenantAllows(principal.tenants(), item.getTenantPath())
        && rolesAllow(principal.roles(), item.getRequiredRoleSet());
  }

  private static boolean tenantAllows(Set<String> tenants, @Nullable String tenantPath) {
    if (tenantPath == null || tenantPath.isBlank()) {
      return true;
    }
    for (String tenant : tenants) {
      if (tenantPath.equals(tenant) || tenantPath.startsWith(tenant + "/")) {
        return true;
      }
    }
    return false;
  }

  private static boolean rolesAllow(Set<String> roles, Set<String> requiredRoles) {
    if (requiredRoles.isEmpty()) {
      return true;
    }
    for (String role : roles) {
      if (requiredRoles.contains(role)) {
        return true;
      }
    }
    return false;
  }
}
