package com.valkyrlabs.thordrive.store;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;

import com.valkyrlabs.model.DriveFile;
import com.valkyrlabs.model.DriveFolder;
import com.valkyrlabs.model.DriveUser;
import com.valkyrlabs.thordrive.config.ThorDriveProperties;

/**
 * Arena-style store: one map per record type, keyed by id. Rows are guarded by
 * their own monitor, which gives per-row atomicity and nothing more.
 */
@Component
@ConditionalOnProperty(prefix = "thordrive.store", name = "type", havingValue = ThorDriveProperties.STORE_MEMORY)
public class InMemoryEntityStore implements EntityStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryEntityStore.class);

    private final Map<String, DriveUser> users = new ConcurrentHashMap<>();
    private final Map<String, DriveFolder> folders = new ConcurrentHashMap<>();
    private final Map<String, DriveFile> files = new ConcurrentHashMap<>();

    @Override
    public Optional<DriveUser> getUser(String userId) {
        return read(users, userId, DriveUser::copy);
    }

    @Override
    public Optional<DriveFolder> getFolder(String folderId) {
        return read(folders, folderId, DriveFolder::copy);
    }

    @Override
    public Optional<DriveFile> getFile(String fileId) {
        return read(files, fileId, DriveFile::copy);
    }

    @Override
    public DriveUser createUser(String userId) {
        String id = userId != null ? userId : newId();
        DriveUser user = new DriveUser(id);
        if (users.putIfAbsent(id, user) != null) {
            throw new DuplicateKeyException("user already exists: " + id);
        }
        logger.trace("created user {}", id);
        return user.copy();
    }

    @Override
    public DriveFolder createFolder(String name) {
        DriveFolder folder = new DriveFolder(newId(), name);
        folders.put(folder.getId(), folder);
        logger.trace("created folder {}", folder.getId());
        return folder.copy();
    }

    @Override
    public DriveFile createFile(String name, String contents) {
        DriveFile file = new DriveFile(newId(), name, contents);
        files.put(file.getId(), file);
        logger.trace("created file {}", file.getId());
        return file.copy();
    }

    @Override
    public void setFileParentFolder(String fileId, String parentFolderId) {
        update(files, "file", fileId, f -> {
            f.setParentFolder(parentFolderId);
            return null;
        });
    }

    @Override
    public void setFolderParentFolder(String folderId, String parentFolderId) {
        update(folders, "folder", folderId, f -> {
            f.setParentFolder(parentFolderId);
            return null;
        });
    }

    @Override
    public boolean addToFileUsers(String fileId, String userId) {
        return update(files, "file", fileId, f -> f.getDirectGrants().add(userId));
    }

    @Override
    public boolean addToFolderUsers(String folderId, String userId) {
        return update(folders, "folder", folderId, f -> f.getDirectGrants().add(userId));
    }

    @Override
    public void addToFolderFiles(String folderId, String fileId) {
        update(folders, "folder", folderId, f -> f.getChildFiles().add(fileId));
    }

    @Override
    public void removeFromFolderFiles(String folderId, String fileId) {
        update(folders, "folder", folderId, f -> f.getChildFiles().remove(fileId));
    }

    @Override
    public void addToFolderFolders(String parentFolderId, String childFolderId) {
        update(folders, "folder", parentFolderId, f -> f.getChildFolders().add(childFolderId));
    }

    @Override
    public void removeFromFolderFolders(String parentFolderId, String childFolderId) {
        update(folders, "folder", parentFolderId, f -> f.getChildFolders().remove(childFolderId));
    }

    @Override
    public void addToUserFiles(String userId, String fileId) {
        update(users, "user", userId, u -> u.getFiles().add(fileId));
    }

    @Override
    public void addToUserFolders(String userId, String folderId) {
        update(users, "user", userId, u -> u.getFolders().add(folderId));
    }

    private static <T> Optional<T> read(Map<String, T> rows, String id, Function<T, T> copier) {
        if (id == null) {
            return Optional.empty();
        }
        T row = rows.get(id);
        if (row == null) {
            return Optional.empty();
        }
        synchronized (row) {
            return Optional.of(copier.apply(row));
        }
    }

    private static <T, R> R update(Map<String, T> rows, String type, String id, Function<T, R> change) {
        T row = id != null ? rows.get(id) : null;
        if (row == null) {
            throw new StoreException("Unhandled error: " + type + " not found: " + id);
        }
        synchronized (row) {
            return change.apply(row);
        }
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
