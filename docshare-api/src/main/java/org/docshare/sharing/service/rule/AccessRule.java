package org.docshare.sharing.service.rule;

import org.docshare.sharing.dto.response.AccessDecision;
import org.docshare.sharing.enums.AccessPath;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One step of the visibility chain: when {@code matches} holds, {@code decision} is final.
 */
public record AccessRule(AccessPath path, Predicate<AccessRequest> matches,
                         Function<AccessRequest, AccessDecision> decision) {

    public Optional<AccessDecision> evaluate(AccessRequest request) {
        return matches.test(request) ? Optional.of(decision.apply(request)) : Optional.empty();
    }
}
