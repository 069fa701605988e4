package org.docshare.sharing.repository;

import org.docshare.sharing.entity.PermissionRecord;

import java.util.function.UnaryOperator;

/**
 * Single source of truth for permission records, keyed by document id.
 */
public interface PermissionStore {

    /**
     * Current record of a document, created with default values on first access.
     */
    PermissionRecord get(String documentId);

    /**
     * Applies a mutation atomically. Mutations of the same document are serialized, mutations of
     * different documents run independently. If the mutation throws, the stored record is unchanged.
     *
     * @return the record stored after the mutation
     */
    PermissionRecord update(String documentId, UnaryOperator<PermissionRecord> mutation);

    /**
     * Drops the record of a deleted document.
     */
    void evict(String documentId);
}
