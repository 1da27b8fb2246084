package com.valkyrlabs.thordrive.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.valkyrlabs.model.DriveFile;
import com.valkyrlabs.model.DriveFolder;
import com.valkyrlabs.model.DriveUser;
import com.valkyrlabs.model.NodeKind;
import com.valkyrlabs.thordrive.security.AccessGuarded;
import com.valkyrlabs.thordrive.security.CycleGuard;
import com.valkyrlabs.thordrive.security.InvalidOperationException;
import com.valkyrlabs.thordrive.security.NodeNotFoundException;
import com.valkyrlabs.thordrive.security.RequiresAccess;
import com.valkyrlabs.thordrive.store.EntityStore;

/**
 * <p>
 * HierarchyService: create, read, move and share files and folders.
 * </p>
 *
 * Authorization is declared on each method with {@link AccessGuarded} and
 * enforced before the body runs; the bodies only do structural checks and
 * writes. Sharing a folder materializes the grant on the whole subtree, while
 * moving never adds or removes grants: access that came only from the old
 * ancestry is gone after a move.
 */
@Service
public class HierarchyService implements DriveOperations {

    protected static final Logger logger = LoggerFactory.getLogger(HierarchyService.class);

    private final EntityStore store;
    private final GrantMutator grantMutator;
    private final CycleGuard cycleGuard;

    public HierarchyService(EntityStore store, GrantMutator grantMutator, CycleGuard cycleGuard) {
        this.store = store;
        this.grantMutator = grantMutator;
        this.cycleGuard = cycleGuard;
    }

    @Override
    @AccessGuarded
    @Transactional
    public DriveUser createUser(String userId) {
        try {
            DriveUser user = store.createUser(userId);
            logger.debug("createUser {}", user.getId());
            return user;
        } catch (DuplicateKeyException e) {
            throw new InvalidOperationException("User already exists: " + userId, e);
        }
    }

    @Override
    @AccessGuarded(@RequiresAccess(kind = NodeKind.FOLDER, node = "#parentFolder", optional = true))
    @Transactional
    public DriveFile createFile(String asUser, String name, String contents, String parentFolder) {
        requireActor(asUser);
        DriveFile file = store.createFile(name, contents);
        if (parentFolder != null) {
            grantMutator.reparent(NodeKind.FILE, file.getId(), parentFolder);
        }
        grantMutator.grantDirectAccess(NodeKind.FILE, file.getId(), asUser);
        logger.debug("{} created file {} in {}", asUser, file.getId(), parentFolder);
        return reload(file.getId());
    }

    @Override
    @AccessGuarded(value = @RequiresAccess(kind = NodeKind.FILE, node = "#fileId"), mutates = false)
    @Transactional(readOnly = true)
    public DriveFile getFile(String asUser, String fileId) {
        return reload(fileId);
    }

    @Override
    @AccessGuarded({
            @RequiresAccess(kind = NodeKind.FILE, node = "#fileId"),
            @RequiresAccess(kind = NodeKind.FOLDER, node = "#toFolderId", optional = true) })
    @Transactional
    public void moveFile(String asUser, String fileId, String toFolderId) {
        grantMutator.reparent(NodeKind.FILE, fileId, toFolderId);
    }

    @Override
    @AccessGuarded(@RequiresAccess(kind = NodeKind.FILE, node = "#fileId"))
    @Transactional
    public void shareFile(String asUser, String fileId, String toUserId) {
        requireUser(toUserId);
        grantMutator.grantDirectAccess(NodeKind.FILE, fileId, toUserId);
    }

    @Override
    @AccessGuarded(@RequiresAccess(kind = NodeKind.FOLDER, node = "#parentFolder", optional = true))
    @Transactional
    public DriveFolder createFolder(String asUser, String name, String parentFolder) {
        requireActor(asUser);
        DriveFolder folder = store.createFolder(name);
        if (parentFolder != null) {
            grantMutator.reparent(NodeKind.FOLDER, folder.getId(), parentFolder);
        }
        grantMutator.grantDirectAccess(NodeKind.FOLDER, folder.getId(), asUser);
        logger.debug("{} created folder {} in {}", asUser, folder.getId(), parentFolder);
        return store.getFolder(folder.getId())
                .orElseThrow(() -> new NodeNotFoundException(NodeKind.FOLDER, folder.getId()));
    }

    @Override
    @AccessGuarded(value = @RequiresAccess(kind = NodeKind.FOLDER, node = "#folderId"), mutates = false)
    @Transactional(readOnly = true)
    public DriveFolder getFolder(String asUser, String folderId) {
        return store.getFolder(folderId).orElseThrow(() -> new NodeNotFoundException(NodeKind.FOLDER, folderId));
    }

    @Override
    @AccessGuarded({
            @RequiresAccess(kind = NodeKind.FOLDER, node = "#folderId"),
            @RequiresAccess(kind = NodeKind.FOLDER, node = "#toFolderId", optional = true) })
    @Transactional
    public void moveFolder(String asUser, String folderId, String toFolderId) {
        cycleGuard.checkMove(folderId, toFolderId);
        grantMutator.reparent(NodeKind.FOLDER, folderId, toFolderId);
    }

    @Override
    @AccessGuarded(@RequiresAccess(kind = NodeKind.FOLDER, node = "#folderId"))
    @Transactional
    public void shareFolder(String asUser, String folderId, String toUserId) {
        requireUser(toUserId);
        grantMutator.grantSubtree(folderId, toUserId);
    }

    private static void requireActor(String asUser) {
        if (asUser == null) {
            throw new InvalidOperationException("A node cannot be created without an acting user");
        }
    }

    private void requireUser(String userId) {
        if (store.getUser(userId).isEmpty()) {
            throw new NodeNotFoundException("user", userId);
        }
    }

    private DriveFile reload(String fileId) {
        return store.getFile(fileId).orElseThrow(() -> new NodeNotFoundException(NodeKind.FILE, fileId));
    }
}
