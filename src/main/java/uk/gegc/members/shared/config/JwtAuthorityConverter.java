package uk.gegc.members.shared.config;

import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Maps the JWT claim "authorities" (e.g. ["MEMBERS_ADMIN"]) to Spring Security authorities as-is.
 */
public final class JwtAuthorityConverter implements Converter<Jwt, AbstractAuthenticationToken> {

    static final String AUTHORITIES_CLAIM = "authorities";

    @Override
    public AbstractAuthenticationToken convert(Jwt jwt) {
        Collection<SimpleGrantedAuthority> authorities = new ArrayList<>();
        List<String> claimed = jwt.getClaimAsStringList(AUTHORITIES_CLAIM);
        if (claimed != null) {
            for (String authority : claimed) {
                if (authority != null && !authority.isBlank()) {
                    authorities.add(new SimpleGrantedAuthority(authority.trim()));
                }
            }
        }
        return new JwtAuthenticationToken(jwt, authorities, jwt.getSubject());
    }
}
