package io.b2mash.teamboard.security;

import org.springframework.security.oauth2.jwt.Jwt;

/** Reads the profile claims the identity provider puts on access tokens. */
public final class JwtClaims {

  private static final String ROLE_CLAIM = "role";
  private static final String NAME_CLAIM = "name";
  private static final String EMAIL_CLAIM = "email";

  public static String extractRole(Jwt jwt) {
    return stringClaim(jwt, ROLE_CLAIM);
  }

  public static String extractName(Jwt jwt) {
    return stringClaim(jwt, NAME_CLAIM);
  }

  public static String extractEmail(Jwt jwt) {
    return stringClaim(jwt, EMAIL_CLAIM);
  }

  private static String stringClaim(Jwt jwt, String name) {
    Object value = jwt.getClaims().get(name);
    if (value instanceof String str && !str.isBlank()) {
      return str;
    }
    return null;
  }

  private JwtClaims() {}
}
