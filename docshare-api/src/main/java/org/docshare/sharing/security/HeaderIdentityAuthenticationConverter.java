package org.docshare.sharing.security;

import lombok.RequiredArgsConstructor;
import org.docshare.sharing.config.IdentityHeaderProperties;
import org.springframework.http.HttpHeaders;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.server.authentication.ServerAuthenticationConverter;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import static org.docshare.sharing.utils.SharingInputUtils.parseCsv;

/**
 * Converts the identity headers into an unauthenticated {@link IdentityAuthenticationToken}.
 * Requests without a user id are left anonymous.
 */
@RequiredArgsConstructor
public class HeaderIdentityAuthenticationConverter implements ServerAuthenticationConverter {

    private final IdentityHeaderProperties headerProperties;

    @Override
    public Mono<Authentication> convert(ServerWebExchange exchange) {
        return Mono.justOrEmpty(toIdentity(exchange.getRequest().getHeaders()))
                .map(IdentityAuthenticationToken::new);
    }

    public IdentityContext toIdentity(HttpHeaders headers) {
        String userId = headers.getFirst(headerProperties.getUserIdHeader());
        if (userId == null || userId.isBlank()) {
            return null;
        }
        String email = headers.getFirst(headerProperties.getEmailHeader());
        return new IdentityContext(
                userId.trim(),
                email == null || email.isBlank() ? null : email.trim(),
                parseCsv(headers.getFirst(headerProperties.getRolesHeader())),
                parseCsv(headers.getFirst(headerProperties.getAssignmentsHeader())),
                parseCsv(headers.getFirst(headerProperties.getDelegatedTeamsHeader())));
    }
}
