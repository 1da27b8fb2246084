package com.valkyrlabs.thordrive.service;

import com.valkyrlabs.model.DriveFile;
import com.valkyrlabs.model.DriveFolder;
import com.valkyrlabs.model.DriveUser;

/**
 * The hierarchy use cases exposed to the request boundary.
 *
 * <p>
 * {@code asUser} is the asserted identity of the caller. Failures surface as
 * {@link com.valkyrlabs.thordrive.security.NodeNotFoundException},
 * {@link com.valkyrlabs.thordrive.security.NodeAccessDeniedException},
 * {@link com.valkyrlabs.thordrive.security.InvalidOperationException} or a
 * {@link org.springframework.dao.DataAccessException} for store failures.
 * </p>
 */
public interface DriveOperations {

    /**
     * @param userId optional id, generated when null
     */
    DriveUser createUser(String userId);

    /**
     * Creates a file owned by {@code asUser}, optionally inside a folder the
     * caller can access.
     */
    DriveFile createFile(String asUser, String name, String contents, String parentFolder);

    DriveFile getFile(String asUser, String fileId);

    /**
     * @param toFolderId destination folder, or null to move the file to the root
     */
    void moveFile(String asUser, String fileId, String toFolderId);

    void shareFile(String asUser, String fileId, String toUserId);

    DriveFolder createFolder(String asUser, String name, String parentFolder);

    DriveFolder getFolder(String asUser, String folderId);

    /**
     * @param toFolderId destination folder, or null to detach to the root
     */
    void moveFolder(String asUser, String folderId, String toFolderId);

    /**
     * Grants {@code toUserId} direct access to the folder and everything it
     * contains at the time of the call.
     */
    void shareFolder(String asUser, String folderId, String toUserId);
}
