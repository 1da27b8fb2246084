package com.valkyrlabs.thordrive.security;

import java.util.HashSet;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.valkyrlabs.model.DriveFolder;
import com.valkyrlabs.model.NodeKind;
import com.valkyrlabs.thordrive.store.EntityStore;
import com.valkyrlabs.thordrive.store.StoreException;

/**
 * Rejects folder moves that would break the forest shape.
 */
@Component
public class CycleGuard {

    private static final Logger logger = LoggerFactory.getLogger(CycleGuard.class);

    private final EntityStore store;

    public CycleGuard(EntityStore store) {
        this.store = store;
    }

    /**
     * Walks up from the proposed parent looking for the folder being moved.
     * Detaching to the root (null parent) never creates a cycle.
     */
    public boolean wouldCreateCycle(String folderId, String proposedParentId) {
        if (proposedParentId == null) {
            return false;
        }
        if (proposedParentId.equals(folderId)) {
            return true;
        }
        Set<String> seen = new HashSet<>();
        String current = proposedParentId;
        while (current != null) {
            if (current.equals(folderId)) {
                logger.trace("{} is an ancestor of {}", folderId, proposedParentId);
                return true;
            }
            if (!seen.add(current)) {
                throw new StoreException("Cycle in folder ancestry at " + current);
            }
            final String id = current;
            DriveFolder folder = store.getFolder(id).orElseThrow(() -> id.equals(proposedParentId)
                    ? new NodeNotFoundException(NodeKind.FOLDER, id)
                    : new StoreException("Unhandled error: parent folder not found: " + id));
            current = folder.getParentFolder();
        }
        return false;
    }

    /**
     * @throws InvalidOperationException on a self-move or a cycle-creating move
     */
    public void checkMove(String folderId, String proposedParentId) {
        if (folderId != null && folderId.equals(proposedParentId)) {
            throw new InvalidOperationException("A folder cannot be moved into itself: " + folderId);
        }
        if (wouldCreateCycle(folderId, proposedParentId)) {
            throw new InvalidOperationException(
                    "Moving folder " + folderId + " into " + proposedParentId + " would create a cycle");
        }
    }
}
