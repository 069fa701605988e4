package org.docshare.sharing.enums;

/**
 * Rule of the visibility chain that produced an access decision.
 */
public enum AccessPath {
    UNAUTHENTICATED,
    ADMINISTRATOR,
    OWNER,
    ASSIGNMENT,
    ACCOUNT,
    PUBLIC,
    DOMAIN,
    ROLE,
    DELEGATED_TEAM,
    NONE
}
