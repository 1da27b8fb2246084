package com.valkyrlabs.thordrive.security;

import java.util.HashSet;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.valkyrlabs.model.DriveFile;
import com.valkyrlabs.model.DriveFolder;
import com.valkyrlabs.model.NodeKind;
import com.valkyrlabs.thordrive.store.EntityStore;
import com.valkyrlabs.thordrive.store.StoreException;

/**
 * Decides whether a user can reach a file or folder.
 *
 * <p>
 * A user can access a node when the node's direct grants name the user, or
 * when the node has a parent folder the user can access. Derived access is
 * always computed from the current parent chain; nothing is cached, so a move
 * takes effect on the next check.
 * </p>
 *
 * <p>
 * The ancestor walk is a loop, so resolution depth is bounded only by the
 * depth of the data. Read-only.
 * </p>
 */
@Component
public class AccessResolver {

    protected static final Logger logger = LoggerFactory.getLogger(AccessResolver.class);

    private final EntityStore store;

    public AccessResolver(EntityStore store) {
        this.store = store;
    }

    /**
     * @return true if {@code userId} holds a direct or derived grant on the node
     * @throws NodeNotFoundException if the node itself does not exist
     * @throws StoreException        if the ancestor chain is broken or cyclic
     */
    public boolean canAccess(String userId, String nodeId, NodeKind kind) {
        String parentId;
        if (kind == NodeKind.FILE) {
            DriveFile file = store.getFile(nodeId).orElseThrow(() -> new NodeNotFoundException(kind, nodeId));
            if (userId != null && file.getDirectGrants().contains(userId)) {
                logger.trace("direct grant on file {} for {}", nodeId, userId);
                return true;
            }
            parentId = file.getParentFolder();
        } else {
            DriveFolder folder = store.getFolder(nodeId).orElseThrow(() -> new NodeNotFoundException(kind, nodeId));
            if (userId != null && folder.getDirectGrants().contains(userId)) {
                logger.trace("direct grant on folder {} for {}", nodeId, userId);
                return true;
            }
            parentId = folder.getParentFolder();
        }
        if (userId == null) {
            return false;
        }
        return canAccessThroughAncestors(userId, nodeId, parentId);
    }

    /**
     * Same as {@link #canAccess} but fails instead of answering false.
     *
     * @throws NodeAccessDeniedException when the user cannot reach the node
     */
    public void requireAccess(String userId, String nodeId, NodeKind kind) {
        if (!canAccess(userId, nodeId, kind)) {
            logger.info("Denied {} on {} {}", userId, kind.toValue(), nodeId);
            throw new NodeAccessDeniedException();
        }
    }

    private boolean canAccessThroughAncestors(String userId, String startId, String firstParentId) {
        Set<String> seen = new HashSet<>();
        String current = firstParentId;
        int depth = 0;
        while (current != null) {
            if (!seen.add(current)) {
                logger.warn("Cycle in folder ancestry at {} while resolving {}", current, startId);
                throw new StoreException("Cycle in folder ancestry at " + current);
            }
            final String ancestorId = current;
            DriveFolder ancestor = store.getFolder(ancestorId).orElseThrow(() -> {
                logger.warn("Dangling parent folder {} while resolving {}", ancestorId, startId);
                return new StoreException("Unhandled error: parent folder not found: " + ancestorId);
            });
            depth++;
            if (ancestor.getDirectGrants().contains(userId)) {
                logger.trace("derived grant for {} on {} via {} (depth {})", userId, startId, ancestorId, depth);
                return true;
            }
            current = ancestor.getParentFolder();
        }
        logger.trace("no grant for {} on {} after {} ancestor(s)", userId, startId, depth);
        return false;
    }
}
