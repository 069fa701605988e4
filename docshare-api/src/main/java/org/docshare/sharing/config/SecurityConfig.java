package org.docshare.sharing.config;

import lombok.RequiredArgsConstructor;
import org.docshare.sharing.security.HeaderIdentityAuthenticationConverter;
import org.docshare.sharing.security.IdentityAuthenticationManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.authentication.ReactiveAuthenticationManager;
import org.springframework.security.config.annotation.web.reactive.EnableWebFluxSecurity;
import org.springframework.security.config.web.server.SecurityWebFiltersOrder;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.web.server.SecurityWebFilterChain;
import org.springframework.security.web.server.authentication.AuthenticationWebFilter;

/**
 * Identity is asserted by an upstream authentication proxy through request headers.
 * Every exchange is permitted here: access decisions are taken by the visibility resolver,
 * which needs to see anonymous callers to report them as unauthenticated.
 */
@Configuration
@EnableWebFluxSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    private final IdentityHeaderProperties identityHeaderProperties;

    @Bean
    public ReactiveAuthenticationManager identityAuthenticationManager() {
        return new IdentityAuthenticationManager();
    }

    @Bean
    public SecurityWebFilterChain springSecurityFilterChain(ServerHttpSecurity http,
                                                            ReactiveAuthenticationManager identityAuthenticationManager) {
        AuthenticationWebFilter identityFilter = new AuthenticationWebFilter(identityAuthenticationManager);
        identityFilter.setServerAuthenticationConverter(new HeaderIdentityAuthenticationConverter(identityHeaderProperties));

        return http
                .csrf(ServerHttpSecurity.CsrfSpec::disable)
                .httpBasic(ServerHttpSecurity.HttpBasicSpec::disable)
                .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
                .addFilterAt(identityFilter, SecurityWebFiltersOrder.AUTHENTICATION)
                .authorizeExchange(exchanges -> exchanges.anyExchange().permitAll())
                .build();
    }
}
