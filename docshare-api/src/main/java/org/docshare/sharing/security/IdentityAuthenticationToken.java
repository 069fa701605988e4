package org.docshare.sharing.security;

import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.Collection;
import java.util.List;

/**
 * Authentication built from the identity headers forwarded by the authentication proxy.
 */
public class IdentityAuthenticationToken extends AbstractAuthenticationToken {

    private static final String ROLE_PREFIX = "ROLE_";

    private final IdentityContext identity;

    /**
     * Create an unauthenticated token (before validation).
     */
    public IdentityAuthenticationToken(IdentityContext identity) {
        super(null);
        this.identity = identity;
        setAuthenticated(false);
    }

    /**
     * Create an authenticated token (after validation).
     */
    public IdentityAuthenticationToken(IdentityContext identity, Collection<? extends GrantedAuthority> authorities) {
        super(authorities);
        this.identity = identity;
        setAuthenticated(true);
    }

    public static IdentityAuthenticationToken authenticated(IdentityContext identity) {
        List<SimpleGrantedAuthority> authorities = identity.roles().stream()
                .map(role -> new SimpleGrantedAuthority(ROLE_PREFIX + role))
                .toList();
        return new IdentityAuthenticationToken(identity, authorities);
    }

    @Override
    public Object getCredentials() {
        return null;
    }

    @Override
    public Object getPrincipal() {
        return identity.id();
    }

    @Override
    public String getName() {
        return identity.id();
    }

    public IdentityContext getIdentity() {
        return identity;
    }
}
