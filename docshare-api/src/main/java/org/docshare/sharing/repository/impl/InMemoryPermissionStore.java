package org.docshare.sharing.repository.impl;

import lombok.extern.slf4j.Slf4j;
import org.docshare.sharing.config.SharingProperties;
import org.docshare.sharing.entity.PermissionRecord;
import org.docshare.sharing.repository.PermissionStore;
import org.springframework.stereotype.Repository;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

@Slf4j
@Repository
public class InMemoryPermissionStore implements PermissionStore {

    private final ConcurrentMap<String, Slot> slots = new ConcurrentHashMap<>();
    private final SharingProperties sharingProperties;

    public InMemoryPermissionStore(SharingProperties sharingProperties) {
        this.sharingProperties = sharingProperties;
    }

    @Override
    public PermissionRecord get(String documentId) {
        return slot(documentId).record;
    }

    @Override
    public PermissionRecord update(String documentId, UnaryOperator<PermissionRecord> mutation) {
        while (true) {
            Slot slot = slot(documentId);
            slot.lock.lock();
            try {
                if (slot.evicted) {
                    // evicted while we were waiting, retry on the fresh slot
                    continue;
                }
                PermissionRecord next = Objects.requireNonNull(mutation.apply(slot.record), "mutation result");
                slot.record = next;
                return next;
            } finally {
                slot.lock.unlock();
            }
        }
    }

    @Override
    public void evict(String documentId) {
        Slot slot = slots.get(documentId);
        if (slot == null) {
            return;
        }
        slot.lock.lock();
        try {
            slot.evicted = true;
            slots.remove(documentId, slot);
        } finally {
            slot.lock.unlock();
        }
        log.info("Permission record of document {} evicted", documentId);
    }

    private Slot slot(String documentId) {
        return slots.computeIfAbsent(documentId, id -> {
            log.debug("Creating default permission record for document {}", id);
            return new Slot(PermissionRecord.defaultFor(id, sharingProperties.getDefaultVisibility()));
        });
    }

    private static final class Slot {

        private final ReentrantLock lock = new ReentrantLock();

        // written under lock, read without it
        private volatile PermissionRecord record;

        // guarded by lock
        private boolean evicted;

        private Slot(PermissionRecord record) {
            this.record = record;
        }
    }
}
