package org.docshare.sharing.client;

import lombok.extern.slf4j.Slf4j;
import org.docshare.sharing.entity.AccountPermission;
import org.docshare.sharing.entity.DomainRestriction;
import org.docshare.sharing.entity.PermissionRecord;
import org.docshare.sharing.enums.MutationPhase;
import org.docshare.sharing.enums.PermissionLevel;
import org.docshare.sharing.enums.Visibility;
import org.docshare.sharing.exception.AbstractDocShareException;
import org.docshare.sharing.exception.MutationInProgressException;
import org.docshare.sharing.exception.PermissionValidationException;
import org.docshare.sharing.exception.TransientIOException;
import org.docshare.sharing.service.PermissionInputValidator;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

import static org.docshare.sharing.utils.SharingInputUtils.isValidEmail;
import static org.docshare.sharing.utils.SharingInputUtils.normalizeDomain;
import static org.docshare.sharing.utils.SharingInputUtils.normalizeEmail;

/**
 * Applies permission mutations of one document optimistically.
 * <p>
 * Each mutation publishes a predicted record right away, then either replaces it with the authoritative
 * response or restores the record that was visible before the attempt. Only one mutation may be pending
 * at a time. Returned {@link Mono}s are lazy: nothing happens until they are subscribed.
 */
@Slf4j
public class OptimisticPermissionCoordinator {

    public static final String GENERIC_ERROR_MESSAGE = "We could not update the permissions. Please try again.";

    private static final String TEMP_ID_PREFIX = "temp-";

    private final String documentId;
    private final String actorId;
    private final PermissionClient permissionClient;
    private final PermissionUpdateListener listener;

    private PermissionSnapshot state;
    private PermissionRecord rollbackSnapshot;
    private MutationPhase phase = MutationPhase.IDLE;
    private String errorMessage;
    private long attempt;
    private long tempIdSequence;
    private Sinks.One<Boolean> cancellation;

    public OptimisticPermissionCoordinator(String documentId, String actorId, PermissionRecord initial,
                                           PermissionClient permissionClient, PermissionUpdateListener listener) {
        this.documentId = PermissionInputValidator.requireDocumentId(documentId);
        this.actorId = PermissionInputValidator.requireActor(actorId);
        this.permissionClient = permissionClient;
        this.listener = listener;
        this.state = PermissionSnapshot.authoritative(initial);
    }

    public synchronized PermissionSnapshot getState() {
        return state;
    }

    public synchronized MutationPhase getPhase() {
        return phase;
    }

    /**
     * @return the message of the last failed attempt, or null once a later attempt starts
     */
    public synchronized String getErrorMessage() {
        return errorMessage;
    }

    public Mono<PermissionRecord> makePublic() {
        return submit(current -> current.withVisibility(Visibility.PUBLIC).withDomains(List.of()).withAccounts(List.of()),
                () -> permissionClient.updateVisibility(documentId, Visibility.PUBLIC, actorId));
    }

    public Mono<PermissionRecord> restrictToDomains(List<String> domains) {
        return validated(() -> {
            List<DomainRestriction> normalized = PermissionInputValidator.domains(domains == null ? null
                    : domains.stream().map(DomainRestriction::new).toList());
            return submit(current -> current.withVisibility(Visibility.RESTRICTED).withDomains(normalized),
                    () -> permissionClient.updateDomainRestrictions(documentId, normalized, actorId));
        });
    }

    public Mono<PermissionRecord> addDomain(String domain) {
        return validated(() -> {
            List<String> domains = new ArrayList<>(currentDomains());
            domains.add(domain);
            return restrictToDomains(domains);
        });
    }

    public Mono<PermissionRecord> removeDomain(String domain) {
        return validated(() -> {
            String removed = normalizeDomain(domain);
            List<String> domains = new ArrayList<>(currentDomains());
            domains.remove(removed);
            return restrictToDomains(domains);
        });
    }

    public Mono<PermissionRecord> shareWithAccounts(List<AccountPermission> accounts) {
        return validated(() -> {
            List<AccountPermission> normalized = PermissionInputValidator.accounts(accounts);
            return submit(current -> current.withVisibility(Visibility.ACCOUNT).withAccounts(normalized),
                    () -> permissionClient.updateAccountPermissions(documentId, normalized, actorId));
        });
    }

    /**
     * Adds a collaborator under a temporary id, or changes the level of the collaborator already
     * holding that email.
     */
    public Mono<PermissionRecord> addAccount(String email, PermissionLevel permission) {
        return validated(() -> {
            String normalizedEmail = normalizeEmail(email);
            if (!isValidEmail(normalizedEmail)) {
                throw new PermissionValidationException("Invalid email : " + email);
            }
            List<AccountPermission> accounts = new ArrayList<>();
            boolean replaced = false;
            for (AccountPermission account : currentRecord().accounts()) {
                if (account.email().equalsIgnoreCase(normalizedEmail)) {
                    accounts.add(account.withPermission(permission));
                    replaced = true;
                } else {
                    accounts.add(account);
                }
            }
            if (!replaced) {
                accounts.add(new AccountPermission(nextTempId(), normalizedEmail, permission));
            }
            return shareWithAccounts(accounts);
        });
    }

    public Mono<PermissionRecord> updateAccountPermission(String accountId, PermissionLevel permission) {
        return validated(() -> {
            List<AccountPermission> accounts = currentRecord().accounts();
            if (accounts.stream().noneMatch(a -> a.accountId().equals(accountId))) {
                throw new PermissionValidationException("Unknown account : " + accountId);
            }
            return shareWithAccounts(accounts.stream()
                    .map(a -> a.accountId().equals(accountId) ? a.withPermission(permission) : a)
                    .toList());
        });
    }

    public Mono<PermissionRecord> removeAccount(String accountId) {
        return submit(current -> current.withAccounts(current.accounts().stream()
                        .filter(a -> !a.accountId().equals(accountId))
                        .toList()),
                () -> permissionClient.removeAccountPermission(documentId, accountId, actorId));
    }

    /**
     * Abandons the pending mutation. The record visible before the attempt is restored, the remote
     * call is cancelled and the {@link Mono} returned for that mutation completes empty.
     * <p>
     * Disposing the subscription of a pending mutation has the same effect on the state.
     *
     * @return true if a mutation was pending
     */
    public boolean cancel() {
        Sinks.One<Boolean> pending;
        synchronized (this) {
            pending = discardPending();
        }
        if (pending == null) {
            return false;
        }
        pending.tryEmitValue(Boolean.TRUE);
        log.debug("Permission update cancelled for document {}", documentId);
        return true;
    }

    /**
     * Replaces the state with a freshly loaded authoritative record, abandoning any pending mutation.
     */
    public void reset(PermissionRecord permissions) {
        Sinks.One<Boolean> pending;
        synchronized (this) {
            pending = discardPending();
            state = PermissionSnapshot.authoritative(permissions);
            phase = MutationPhase.IDLE;
            errorMessage = null;
        }
        if (pending != null) {
            pending.tryEmitValue(Boolean.TRUE);
        }
    }

    private Mono<PermissionRecord> submit(UnaryOperator<PermissionRecord> prediction,
                                          Supplier<Mono<PermissionRecord>> remoteCall) {
        return Mono.fromCallable(() -> beginAttempt(prediction))
                .flatMap(started -> Mono.defer(remoteCall)
                        .switchIfEmpty(Mono.error(() -> new TransientIOException(
                                "Empty permission response for document " + documentId)))
                        .doOnNext(permissions -> confirm(started.token(), permissions))
                        .onErrorMap(error -> rollback(started.token(), error))
                        .takeUntilOther(started.cancellation().asMono())
                        .doOnCancel(() -> abandon(started.token())));
    }

    private Mono<PermissionRecord> validated(Supplier<Mono<PermissionRecord>> mutation) {
        return Mono.defer(() -> {
            try {
                return mutation.get();
            } catch (PermissionValidationException e) {
                reportValidationError(e);
                return Mono.error(e);
            }
        });
    }

    private synchronized Attempt beginAttempt(UnaryOperator<PermissionRecord> prediction) {
        if (phase == MutationPhase.PREDICTING) {
            throw new MutationInProgressException(documentId);
        }
        rollbackSnapshot = state.record();
        state = PermissionSnapshot.predicted(prediction.apply(rollbackSnapshot));
        phase = MutationPhase.PREDICTING;
        errorMessage = null;
        cancellation = Sinks.one();
        return new Attempt(++attempt, cancellation);
    }

    /**
     * Restores the record visible before the pending attempt. Caller holds the monitor.
     *
     * @return the cancellation signal of the discarded attempt, or null if none was pending
     */
    private Sinks.One<Boolean> discardPending() {
        if (phase != MutationPhase.PREDICTING) {
            return null;
        }
        Sinks.One<Boolean> pending = cancellation;
        attempt++;
        state = PermissionSnapshot.authoritative(rollbackSnapshot);
        rollbackSnapshot = null;
        cancellation = null;
        phase = MutationPhase.IDLE;
        return pending;
    }

    private synchronized void abandon(long token) {
        if (isCurrent(token)) {
            discardPending();
            log.debug("Permission update of document {} disposed before completion", documentId);
        }
    }

    private void confirm(long token, PermissionRecord permissions) {
        synchronized (this) {
            if (!isCurrent(token)) {
                log.debug("Discarding stale permission response for document {}", documentId);
                return;
            }
            state = PermissionSnapshot.authoritative(permissions);
            rollbackSnapshot = null;
            cancellation = null;
            phase = MutationPhase.CONFIRMED;
        }
        if (listener != null) {
            listener.onPermissionsUpdate(permissions);
        }
    }

    private synchronized Throwable rollback(long token, Throwable error) {
        if (isCurrent(token)) {
            log.warn("Permission update failed for document {}, rolling back : {}", documentId, error.getMessage());
            state = PermissionSnapshot.authoritative(rollbackSnapshot);
            rollbackSnapshot = null;
            cancellation = null;
            phase = MutationPhase.ROLLED_BACK;
            errorMessage = GENERIC_ERROR_MESSAGE;
        }
        if (error instanceof AbstractDocShareException) {
            return error;
        }
        return new TransientIOException(GENERIC_ERROR_MESSAGE, error);
    }

    private synchronized void reportValidationError(PermissionValidationException e) {
        if (phase != MutationPhase.PREDICTING) {
            errorMessage = e.getMessage();
        }
    }

    private boolean isCurrent(long token) {
        return token == attempt && phase == MutationPhase.PREDICTING;
    }

    private synchronized PermissionRecord currentRecord() {
        return state.record();
    }

    private List<String> currentDomains() {
        return currentRecord().domains().stream().map(DomainRestriction::domain).toList();
    }

    private synchronized String nextTempId() {
        return TEMP_ID_PREFIX + (++tempIdSequence);
    }

    private record Attempt(long token, Sinks.One<Boolean> cancellation) {
    }
}
