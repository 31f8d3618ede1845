package dev.athenaeum.api;

/** Request headers through which the identity provider forwards the caller's claims. */
final class PrincipalHeaders {

  static final String PRINCIPAL_ID = "X-Principal-Id";
  static final String ROLES = "X-Principal-Roles";
  static final String TENANTS = "X-Principal-Tenants";

  private PrincipalHeaders() {}
}
