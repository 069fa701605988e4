package org.docshare.sharing.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.docshare.sharing.config.SharingProperties;
import org.docshare.sharing.dto.response.AccessDecision;
import org.docshare.sharing.entity.Document;
import org.docshare.sharing.entity.PermissionRecord;
import org.docshare.sharing.enums.AccessPath;
import org.docshare.sharing.exception.AccessForbiddenException;
import org.docshare.sharing.exception.UnauthenticatedException;
import org.docshare.sharing.security.IdentityContext;
import org.docshare.sharing.service.VisibilityResolver;
import org.docshare.sharing.service.rule.AccessRequest;
import org.docshare.sharing.service.rule.AccessRule;
import org.docshare.sharing.service.rule.VisibilityRules;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
public class RuleChainVisibilityResolver implements VisibilityResolver {

    private final List<AccessRule> rules;

    @Autowired
    public RuleChainVisibilityResolver(SharingProperties sharingProperties) {
        this(VisibilityRules.ordered(sharingProperties));
    }

    RuleChainVisibilityResolver(List<AccessRule> rules) {
        this.rules = List.copyOf(rules);
    }

    @Override
    public AccessDecision evaluate(Document document, PermissionRecord permissions, IdentityContext identity) {
        if (identity == null) {
            return AccessDecision.denied(AccessPath.UNAUTHENTICATED);
        }
        AccessRequest request = new AccessRequest(document, permissions, identity);
        for (AccessRule rule : rules) {
            Optional<AccessDecision> decision = rule.evaluate(request);
            if (decision.isPresent()) {
                return decision.get();
            }
        }
        return AccessDecision.denied(AccessPath.NONE);
    }

    @Override
    public AccessDecision resolve(Document document, PermissionRecord permissions, IdentityContext identity) {
        AccessDecision decision = evaluate(document, permissions, identity);
        if (decision.granted()) {
            log.debug("Access to document {} granted to {} at level {} by {}", document.getId(), identity.id(),
                    decision.level(), decision.path());
            return decision;
        }
        if (decision.path() == AccessPath.UNAUTHENTICATED) {
            throw new UnauthenticatedException();
        }
        log.debug("Access to document {} denied to {} ({})", document.getId(), identity.id(), decision.path());
        throw new AccessForbiddenException(document.getId(), identity.id());
    }

    List<AccessRule> getRules() {
        return rules;
    }
}
