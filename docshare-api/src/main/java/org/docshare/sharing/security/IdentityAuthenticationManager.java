package org.docshare.sharing.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.ReactiveAuthenticationManager;
import org.springframework.security.core.Authentication;
import reactor.core.publisher.Mono;

/**
 * Trusts the identity asserted by the authentication proxy and turns its roles into authorities.
 */
@Slf4j
public class IdentityAuthenticationManager implements ReactiveAuthenticationManager {

    @Override
    public Mono<Authentication> authenticate(Authentication authentication) {
        if (!(authentication instanceof IdentityAuthenticationToken token)) {
            return Mono.empty();
        }
        IdentityContext identity = token.getIdentity();
        if (identity == null || identity.id() == null || identity.id().isBlank()) {
            return Mono.error(new BadCredentialsException("Missing user id"));
        }
        log.debug("Identity {} authenticated with roles {}", identity.id(), identity.roles());
        return Mono.just(IdentityAuthenticationToken.authenticated(identity));
    }
}
