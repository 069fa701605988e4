package org.docshare.sharing.client;

import lombok.RequiredArgsConstructor;
import org.docshare.sharing.entity.PermissionRecord;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
@RequiredArgsConstructor
public class PermissionCoordinatorFactory {

    private final PermissionClient permissionClient;

    /**
     * Loads the authoritative record of a document and opens a coordinator on it.
     */
    public Mono<OptimisticPermissionCoordinator> open(String documentId, String actorId, PermissionUpdateListener listener) {
        return permissionClient.fetchPermissions(documentId)
                .map(permissions -> create(permissions, actorId, listener));
    }

    public OptimisticPermissionCoordinator create(PermissionRecord permissions, String actorId, PermissionUpdateListener listener) {
        return new OptimisticPermissionCoordinator(permissions.documentId(), actorId, permissions, permissionClient, listener);
    }
}
