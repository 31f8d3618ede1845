package dev.athenaeum.search;

import dev.athenaeum.content.ContentHasher;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * The requesting principal's claims as supplied by the identity provider. Trusted as given.
 *
 * @param principalId optional caller identifier, used for logging only
 * @param roles role claims
 * @param tenants tenant path claims ({@code /} separated, e.g. {@code acme/legal})
 */
public record Principal(@Nullable String principalId, Set<String> roles, Set<String> tenants) {

  public Principal {
    roles = clean(roles);
    tenants = clean(tenants);
  }

  /** Convenience factory accepting any collections. */
  public static Principal of(
      @Nullable String principalId, Collection<String> roles, Collection<String> tenants) {
    return new Principal(principalId, new HashSet<>(roles), new HashSet<>(tenants));
  }

  /**
   * Builds a principal from comma-separated claim lists, as carried by request headers and tool
   * arguments. Blank entries are ignored.
   */
  public static Principal fromCommaSeparated(
      @Nullable String principalId, @Nullable String roles, @Nullable String tenants) {
    return new Principal(principalId, splitCommaSeparated(roles), splitCommaSeparated(tenants));
  }

  /** True if at least one role or tenant claim is present. */
  public boolean hasClaims() {
    return !roles.isEmpty() || !tenants.isEmpty();
  }

  /**
   * Stable hash of the effective access scope. Two principals with the same roles and tenants
   * share a fingerprint regardless of claim order or identifier. Claims are length-prefixed, so
   * no claim text can mimic a different claim set.
   */
  public String scopeFingerprint() {
    return ContentHasher.sha256("roles=" + encode(roles) + "|tenants=" + encode(tenants));
  }

  private static String encode(Set<String> claims) {
    StringBuilder sb = new StringBuilder();
    for (String claim : new TreeSet<>(claims)) {
      sb.append(claim.length()).append(':').append(claim).append(';');
    }
    return sb.toString();
  }

  private static Set<String> splitCommaSeparated(@Nullable String value) {
    if (value == null || value.isBlank()) {
      return Set.of();
    }
    return Arrays.stream(value.split(",")).collect(Collectors.toSet());
  }

  private static Set<String> clean(@Nullable Set<String> claims) {
    if (claims == null) {
      return Set.of();
    }
    return claims.stream()
        .filter(c -> c != null && !c.isBlank())
        .map(String::strip)
        .collect(Collectors.toUnmodifiableSet());
  }
}
