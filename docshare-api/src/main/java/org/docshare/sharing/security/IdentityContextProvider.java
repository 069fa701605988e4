package org.docshare.sharing.security;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.security.core.context.SecurityContext;
import reactor.core.publisher.Mono;

import java.util.Optional;

public interface IdentityContextProvider {

    default IdentityContext getIdentity(Authentication authentication) {
        if (authentication instanceof IdentityAuthenticationToken token && token.isAuthenticated()) {
            return token.getIdentity();
        }
        return null;
    }

    /**
     * Identity of the caller, or an empty optional for anonymous requests.
     */
    default Mono<Optional<IdentityContext>> getConnectedIdentity() {
        return ReactiveSecurityContextHolder.getContext()
                .map(SecurityContext::getAuthentication)
                .map(auth -> Optional.ofNullable(getIdentity(auth)))
                .defaultIfEmpty(Optional.empty());
    }
}
