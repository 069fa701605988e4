package org.docshare.sharing.client.impl;

import lombok.extern.slf4j.Slf4j;
import org.docshare.sharing.client.PermissionClient;
import org.docshare.sharing.config.IdentityHeaderProperties;
import org.docshare.sharing.config.PermissionClientProperties;
import org.docshare.sharing.config.RestApiVersion;
import org.docshare.sharing.dto.request.AccountPermissionsRequest;
import org.docshare.sharing.dto.request.ActorRequest;
import org.docshare.sharing.dto.request.DomainRestrictionsRequest;
import org.docshare.sharing.dto.request.VisibilityRequest;
import org.docshare.sharing.entity.AccountPermission;
import org.docshare.sharing.entity.DomainRestriction;
import org.docshare.sharing.entity.PermissionRecord;
import org.docshare.sharing.enums.Visibility;
import org.docshare.sharing.exception.GlobalExceptionHandler.ErrorResponse;
import org.docshare.sharing.exception.PermissionValidationException;
import org.docshare.sharing.exception.TransientIOException;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * {@link PermissionClient} calling the permission REST API with a {@link WebClient}.
 */
@Slf4j
@Component
public class WebClientPermissionClient implements PermissionClient {

    private static final String PERMISSIONS = RestApiVersion.API_PREFIX + RestApiVersion.ENDPOINT_PERMISSIONS + "/{documentId}";

    private final WebClient webClient;
    private final Duration timeout;
    private final String userIdHeader;

    public WebClientPermissionClient(WebClient.Builder webClientBuilder, PermissionClientProperties properties,
                                     IdentityHeaderProperties identityHeaderProperties) {
        this.webClient = webClientBuilder
                .baseUrl(properties.getBaseUrl())
                .build();
        this.timeout = properties.getTimeout();
        this.userIdHeader = identityHeaderProperties.getUserIdHeader();
    }

    @Override
    public Mono<PermissionRecord> fetchPermissions(String documentId) {
        return exchange(documentId, webClient.get().uri(PERMISSIONS, documentId));
    }

    @Override
    public Mono<PermissionRecord> updateVisibility(String documentId, Visibility visibility, String actorId) {
        return exchange(documentId, webClient.post()
                .uri(PERMISSIONS + "/visibility", documentId)
                .header(userIdHeader, actorId)
                .bodyValue(new VisibilityRequest(visibility, actorId)));
    }

    @Override
    public Mono<PermissionRecord> updateDomainRestrictions(String documentId, List<DomainRestriction> domains, String actorId) {
        return exchange(documentId, webClient.post()
                .uri(PERMISSIONS + "/domains", documentId)
                .header(userIdHeader, actorId)
                .bodyValue(new DomainRestrictionsRequest(domains, actorId)));
    }

    @Override
    public Mono<PermissionRecord> updateAccountPermissions(String documentId, List<AccountPermission> accounts, String actorId) {
        return exchange(documentId, webClient.post()
                .uri(PERMISSIONS + "/accounts", documentId)
                .header(userIdHeader, actorId)
                .bodyValue(new AccountPermissionsRequest(accounts, actorId)));
    }

    @Override
    public Mono<PermissionRecord> removeAccountPermission(String documentId, String accountId, String actorId) {
        return exchange(documentId, webClient.method(HttpMethod.DELETE)
                .uri(PERMISSIONS + "/accounts/{accountId}", documentId, accountId)
                .header(userIdHeader, actorId)
                .bodyValue(new ActorRequest(actorId)));
    }

    private Mono<PermissionRecord> exchange(String documentId, WebClient.RequestHeadersSpec<?> request) {
        return request.retrieve()
                .onStatus(status -> status.value() == HttpStatus.BAD_REQUEST.value(), this::toValidationError)
                .onStatus(HttpStatusCode::is5xxServerError, response -> Mono.just(
                        new TransientIOException("Permission service answered " + response.statusCode().value()
                                + " for document " + documentId)))
                .bodyToMono(PermissionRecord.class)
                .timeout(timeout)
                .onErrorMap(TimeoutException.class,
                        e -> new TransientIOException("Permission service timed out for document " + documentId, e))
                .onErrorMap(WebClientRequestException.class,
                        e -> new TransientIOException("Permission service unreachable: " + e.getMessage(), e))
                .doOnError(e -> log.warn("Permission call failed for document {}: {}", documentId, e.getMessage()));
    }

    private Mono<? extends Throwable> toValidationError(ClientResponse response) {
        return response.bodyToMono(ErrorResponse.class)
                .map(error -> new PermissionValidationException(error.message()))
                .defaultIfEmpty(new PermissionValidationException("Permission update rejected"));
    }
}
