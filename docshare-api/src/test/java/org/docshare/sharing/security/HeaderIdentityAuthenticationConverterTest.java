package org.docshare.sharing.security;

import org.docshare.sharing.config.IdentityHeaderProperties;
import org.junit.jupiter.api.Test;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.security.authentication.BadCredentialsException;
import reactor.test.StepVerifier;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class HeaderIdentityAuthenticationConverterTest {

    private final HeaderIdentityAuthenticationConverter converter =
            new HeaderIdentityAuthenticationConverter(new IdentityHeaderProperties());

    private final IdentityAuthenticationManager authenticationManager = new IdentityAuthenticationManager();

    @Test
    void convert_readsAllIdentityHeaders() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/documents")
                .header("X-User-Id", " user-sam ")
                .header("X-User-Email", "sam@example.com")
                .header("X-User-Roles", "sub_admin, employee")
                .header("X-User-Assignments", "doc-1,,doc-2")
                .header("X-Delegated-Teams", " north "));

        StepVerifier.create(converter.convert(exchange))
                .assertNext(authentication -> {
                    IdentityContext identity = ((IdentityAuthenticationToken) authentication).getIdentity();
                    assertFalse(authentication.isAuthenticated());
                    assertEquals("user-sam", identity.id());
                    assertEquals("sam@example.com", identity.email());
                    assertEquals(Set.of("sub_admin", "employee"), identity.roles());
                    assertEquals(Set.of("doc-1", "doc-2"), identity.assignments());
                    assertTrue(identity.administers("north"));
                })
                .verifyComplete();
    }

    @Test
    void convert_withoutUserId_isAnonymous() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/documents")
                .header("X-User-Roles", "admin"));

        StepVerifier.create(converter.convert(exchange))
                .verifyComplete();
    }

    @Test
    void convert_withBlankUserId_isAnonymous() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/documents")
                .header("X-User-Id", "   "));

        StepVerifier.create(converter.convert(exchange))
                .verifyComplete();
    }

    @Test
    void convert_withCustomHeaderNames() {
        IdentityHeaderProperties properties = new IdentityHeaderProperties();
        properties.setUserIdHeader("X-Forwarded-User");
        HeaderIdentityAuthenticationConverter custom = new HeaderIdentityAuthenticationConverter(properties);
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/")
                .header("X-Forwarded-User", "user-alice"));

        StepVerifier.create(custom.convert(exchange))
                .assertNext(authentication -> assertEquals("user-alice", authentication.getName()))
                .verifyComplete();
    }

    @Test
    void authenticate_mapsRolesToAuthorities() {
        IdentityContext identity = new IdentityContext("user-root", null, Set.of("admin"), Set.of(), Set.of());

        StepVerifier.create(authenticationManager.authenticate(new IdentityAuthenticationToken(identity)))
                .assertNext(authentication -> {
                    assertTrue(authentication.isAuthenticated());
                    assertEquals("user-root", authentication.getName());
                    assertTrue(authentication.getAuthorities().stream()
                            .anyMatch(authority -> authority.getAuthority().equals("ROLE_admin")));
                })
                .verifyComplete();
    }

    @Test
    void authenticate_withBlankId_fails() {
        IdentityContext identity = new IdentityContext(" ", null, Set.of(), Set.of(), Set.of());

        StepVerifier.create(authenticationManager.authenticate(new IdentityAuthenticationToken(identity)))
                .expectError(BadCredentialsException.class)
                .verify();
    }

    @Test
    void getIdentity_ignoresUnauthenticatedTokens() {
        IdentityContextProvider provider = new IdentityContextProvider() {
        };
        IdentityContext identity = new IdentityContext("user-alice", null, Set.of(), Set.of(), Set.of());

        assertNull(provider.getIdentity(new IdentityAuthenticationToken(identity)));
        assertEquals(identity, provider.getIdentity(IdentityAuthenticationToken.authenticated(identity)));
    }
}
