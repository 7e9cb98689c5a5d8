package io.b2mash.teamboard.security;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

@Component
public class JwtRoleAuthenticationConverter
    implements Converter<Jwt, AbstractAuthenticationToken> {

  private static final Map<String, String> ROLE_MAPPING =
      Map.of(
          Roles.ADMIN, Roles.AUTHORITY_ADMIN,
          Roles.MANAGER, Roles.AUTHORITY_MANAGER,
          Roles.MEMBER, Roles.AUTHORITY_MEMBER);

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    Collection<GrantedAuthority> authorities = extractAuthorities(jwt);
    return new JwtAuthenticationToken(jwt, authorities, jwt.getSubject());
  }

  private Collection<GrantedAuthority> extractAuthorities(Jwt jwt) {
    // Tokens without a role claim are treated as plain members
    String role = JwtClaims.extractRole(jwt);
    String authority = ROLE_MAPPING.get(role != null ? role : Roles.MEMBER);
    if (authority == null) {
      return List.of();
    }
    return List.of(new SimpleGrantedAuthority(authority));
  }
}
