package com.valkyrlabs.thordrive.store;

import java.util.Optional;

import com.valkyrlabs.model.DriveFile;
import com.valkyrlabs.model.DriveFolder;
import com.valkyrlabs.model.DriveUser;

/**
 * Field-level access to the user, folder and file rows.
 *
 * <p>
 * Reads return detached copies. Each single call is atomic for the row it
 * touches; sequences of calls are not, so callers that update several rows
 * (reparenting, recursive shares) provide their own exclusion.
 * </p>
 *
 * <p>
 * Writes against a row that does not exist throw {@link StoreException}.
 * </p>
 */
public interface EntityStore {

    Optional<DriveUser> getUser(String userId);

    Optional<DriveFolder> getFolder(String folderId);

    Optional<DriveFile> getFile(String fileId);

    /**
     * Insert a user.
     *
     * @param userId the id to use, or null to generate one
     * @throws org.springframework.dao.DuplicateKeyException if the id is taken
     */
    DriveUser createUser(String userId);

    /** Insert a root folder with no grants and no children. */
    DriveFolder createFolder(String name);

    /** Insert a root file with no grants. */
    DriveFile createFile(String name, String contents);

    void setFileParentFolder(String fileId, String parentFolderId);

    void setFolderParentFolder(String folderId, String parentFolderId);

    /** @return true if the user was not already granted */
    boolean addToFileUsers(String fileId, String userId);

    /** @return true if the user was not already granted */
    boolean addToFolderUsers(String folderId, String userId);

    void addToFolderFiles(String folderId, String fileId);

    void removeFromFolderFiles(String folderId, String fileId);

    void addToFolderFolders(String parentFolderId, String childFolderId);

    void removeFromFolderFolders(String parentFolderId, String childFolderId);

    void addToUserFiles(String userId, String fileId);

    void addToUserFolders(String userId, String folderId);
}
