package com.valkyrlabs.thordrive.service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.valkyrlabs.model.DriveFolder;
import com.valkyrlabs.model.NodeKind;
import com.valkyrlabs.thordrive.security.NodeNotFoundException;
import com.valkyrlabs.thordrive.store.EntityStore;
import com.valkyrlabs.thordrive.store.StoreException;

/**
 * Writes grants and parent links. Callers authorize first; nothing here checks
 * who is asking.
 */
@Component
public class GrantMutator {

    private static final Logger logger = LoggerFactory.getLogger(GrantMutator.class);

    private final EntityStore store;

    public GrantMutator(EntityStore store) {
        this.store = store;
    }

    /**
     * Idempotent: granting an already-granted user writes nothing.
     *
     * @return true if a new grant was written
     */
    public boolean grantDirectAccess(NodeKind kind, String nodeId, String userId) {
        boolean added = kind == NodeKind.FILE
                ? store.addToFileUsers(nodeId, userId)
                : store.addToFolderUsers(nodeId, userId);
        if (!added) {
            logger.trace("{} already granted on {} {}", userId, kind.toValue(), nodeId);
            return false;
        }
        logger.debug("granted {} on {} {}", userId, kind.toValue(), nodeId);
        if (store.getUser(userId).isPresent()) {
            if (kind == NodeKind.FILE) {
                store.addToUserFiles(userId, nodeId);
            } else {
                store.addToUserFolders(userId, nodeId);
            }
        }
        return true;
    }

    /**
     * Moves a node under {@code newParentId}, or to the root when null.
     * Detaches from the old parent, updates the pointer, then attaches to the
     * new parent. Grants on the node and its descendants are left alone.
     */
    public void reparent(NodeKind kind, String nodeId, String newParentId) {
        String oldParentId = kind == NodeKind.FILE
                ? store.getFile(nodeId).orElseThrow(() -> new NodeNotFoundException(kind, nodeId))
                        .getParentFolder()
                : store.getFolder(nodeId).orElseThrow(() -> new NodeNotFoundException(kind, nodeId))
                        .getParentFolder();
        if (Objects.equals(oldParentId, newParentId)) {
            logger.trace("{} {} already under {}", kind.toValue(), nodeId, newParentId);
            return;
        }

        if (kind == NodeKind.FILE) {
            if (oldParentId != null) {
                store.removeFromFolderFiles(oldParentId, nodeId);
            }
            store.setFileParentFolder(nodeId, newParentId);
            if (newParentId != null) {
                store.addToFolderFiles(newParentId, nodeId);
            }
        } else {
            if (oldParentId != null) {
                store.removeFromFolderFolders(oldParentId, nodeId);
            }
            store.setFolderParentFolder(nodeId, newParentId);
            if (newParentId != null) {
                store.addToFolderFolders(newParentId, nodeId);
            }
        }
        logger.debug("moved {} {} from {} to {}", kind.toValue(), nodeId, oldParentId, newParentId);
    }

    /**
     * Grants {@code userId} directly on the folder and on every file and folder
     * currently inside it, walking the subtree with a worklist.
     *
     * @return number of new grants written
     */
    public int grantSubtree(String folderId, String userId) {
        Deque<String> pending = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        pending.push(folderId);
        int written = 0;

        while (!pending.isEmpty()) {
            String currentId = pending.pop();
            if (!visited.add(currentId)) {
                continue;
            }
            DriveFolder folder = store.getFolder(currentId).orElseThrow(() -> currentId.equals(folderId)
                    ? new NodeNotFoundException(NodeKind.FOLDER, currentId)
                    : new StoreException("Unhandled error: child folder not found: " + currentId));
            if (grantDirectAccess(NodeKind.FOLDER, currentId, userId)) {
                written++;
            }
            for (String fileId : folder.getChildFiles()) {
                if (grantDirectAccess(NodeKind.FILE, fileId, userId)) {
                    written++;
                }
            }
            for (String childId : folder.getChildFolders()) {
                pending.push(childId);
            }
        }
        logger.info("shared folder {} with {}: {} folder(s) visited, {} new grant(s)", folderId, userId,
                visited.size(), written);
        return written;
    }
}
