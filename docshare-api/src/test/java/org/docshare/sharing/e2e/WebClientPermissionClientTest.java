package org.docshare.sharing.e2e;

import org.docshare.sharing.client.OptimisticPermissionCoordinator;
import org.docshare.sharing.client.PermissionCoordinatorFactory;
import org.docshare.sharing.client.impl.WebClientPermissionClient;
import org.docshare.sharing.config.IdentityHeaderProperties;
import org.docshare.sharing.config.PermissionClientProperties;
import org.docshare.sharing.entity.AccountPermission;
import org.docshare.sharing.entity.DomainRestriction;
import org.docshare.sharing.entity.PermissionRecord;
import org.docshare.sharing.enums.MutationPhase;
import org.docshare.sharing.enums.PermissionLevel;
import org.docshare.sharing.enums.Visibility;
import org.docshare.sharing.exception.PermissionValidationException;
import org.docshare.sharing.exception.TransientIOException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class WebClientPermissionClientTest {

    @LocalServerPort
    private int port;

    private WebClientPermissionClient permissionClient;

    @BeforeEach
    void setUp() {
        PermissionClientProperties properties = new PermissionClientProperties();
        properties.setBaseUrl("http://localhost:" + port);
        properties.setTimeout(Duration.ofSeconds(5));
        permissionClient = new WebClientPermissionClient(WebClient.builder(), properties, new IdentityHeaderProperties());
    }

    private static String newDocumentId() {
        return "doc-" + UUID.randomUUID();
    }

    @Test
    void fetchAndUpdate_roundTripThroughTheApi() {
        String documentId = newDocumentId();

        StepVerifier.create(permissionClient.fetchPermissions(documentId))
                .assertNext(permissions -> assertEquals(Visibility.RESTRICTED, permissions.visibility()))
                .verifyComplete();

        StepVerifier.create(permissionClient.updateDomainRestrictions(documentId,
                        List.of(new DomainRestriction("Example.com")), "owner-1"))
                .assertNext(permissions -> assertEquals(List.of(new DomainRestriction("example.com")), permissions.domains()))
                .verifyComplete();

        StepVerifier.create(permissionClient.updateAccountPermissions(documentId,
                        List.of(new AccountPermission("acc-1", "a@example.com", PermissionLevel.READ)), "owner-1"))
                .assertNext(permissions -> assertEquals(Visibility.ACCOUNT, permissions.visibility()))
                .verifyComplete();

        StepVerifier.create(permissionClient.removeAccountPermission(documentId, "acc-1", "owner-1"))
                .assertNext(permissions -> assertTrue(permissions.accounts().isEmpty()))
                .verifyComplete();

        StepVerifier.create(permissionClient.updateVisibility(documentId, Visibility.PUBLIC, "owner-1"))
                .assertNext(permissions -> assertEquals(Visibility.PUBLIC, permissions.visibility()))
                .verifyComplete();
    }

    @Test
    void rejectedUpdate_surfacesServerMessage() {
        StepVerifier.create(permissionClient.updateDomainRestrictions(newDocumentId(), List.of(), "owner-1"))
                .expectErrorMatches(e -> e instanceof PermissionValidationException
                        && e.getMessage().equals("Add at least one domain."))
                .verify();
    }

    @Test
    void unreachableAuthority_isTransient() {
        PermissionClientProperties properties = new PermissionClientProperties();
        properties.setBaseUrl("http://localhost:1");
        properties.setTimeout(Duration.ofSeconds(5));
        WebClientPermissionClient unreachable = new WebClientPermissionClient(WebClient.builder(), properties, new IdentityHeaderProperties());

        StepVerifier.create(unreachable.fetchPermissions(newDocumentId()))
                .expectError(TransientIOException.class)
                .verify(Duration.ofSeconds(10));
    }

    @Test
    void coordinator_confirmsAgainstTheRealAuthority() {
        String documentId = newDocumentId();
        List<PermissionRecord> notified = new ArrayList<>();
        PermissionCoordinatorFactory factory = new PermissionCoordinatorFactory(permissionClient);

        OptimisticPermissionCoordinator coordinator = factory.open(documentId, "owner-1", notified::add).block();
        assertNotNull(coordinator);

        StepVerifier.create(coordinator.addAccount("carol@example.com", PermissionLevel.COMMENT))
                .assertNext(permissions -> {
                    assertEquals("temp-1", permissions.accounts().get(0).accountId());
                    assertEquals(1, permissions.auditTrail().size());
                    assertEquals("owner-1", permissions.auditTrail().get(0).updatedBy());
                })
                .verifyComplete();

        assertEquals(MutationPhase.CONFIRMED, coordinator.getPhase());
        assertFalse(coordinator.getState().optimistic());
        assertEquals(1, notified.size());
    }
}
