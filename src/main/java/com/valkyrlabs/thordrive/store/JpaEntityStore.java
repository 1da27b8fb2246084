package com.valkyrlabs.thordrive.store;

import java.util.Optional;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.valkyrlabs.api.DriveFileRepository;
import com.valkyrlabs.api.DriveFolderRepository;
import com.valkyrlabs.api.DriveUserRepository;
import com.valkyrlabs.model.DriveFile;
import com.valkyrlabs.model.DriveFolder;
import com.valkyrlabs.model.DriveUser;
import com.valkyrlabs.thordrive.config.ThorDriveProperties;

/**
 * EntityStore over the Spring Data repositories. Every method runs in its own
 * transaction unless the caller already holds one.
 */
@Component
@ConditionalOnProperty(prefix = "thordrive.store", name = "type", havingValue = ThorDriveProperties.STORE_JPA,
        matchIfMissing = true)
public class JpaEntityStore implements EntityStore {

    private static final Logger logger = LoggerFactory.getLogger(JpaEntityStore.class);

    private final DriveUserRepository userRepository;
    private final DriveFolderRepository folderRepository;
    private final DriveFileRepository fileRepository;

    public JpaEntityStore(DriveUserRepository userRepository, DriveFolderRepository folderRepository,
            DriveFileRepository fileRepository) {
        this.userRepository = userRepository;
        this.folderRepository = folderRepository;
        this.fileRepository = fileRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<DriveUser> getUser(String userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return userRepository.findById(userId).map(DriveUser::copy);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<DriveFolder> getFolder(String folderId) {
        if (folderId == null) {
            return Optional.empty();
        }
        return folderRepository.findById(folderId).map(DriveFolder::copy);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<DriveFile> getFile(String fileId) {
        if (fileId == null) {
            return Optional.empty();
        }
        return fileRepository.findById(fileId).map(DriveFile::copy);
    }

    @Override
    @Transactional
    public DriveUser createUser(String userId) {
        String id = userId != null ? userId : UUID.randomUUID().toString();
        // save() on an assigned id merges, so an existing row must be rejected here
        if (userRepository.existsById(id)) {
            throw new DuplicateKeyException("user already exists: " + id);
        }
        DriveUser saved = userRepository.save(new DriveUser(id));
        logger.trace("created user {}", id);
        return saved.copy();
    }

    @Override
    @Transactional
    public DriveFolder createFolder(String name) {
        DriveFolder saved = folderRepository.save(new DriveFolder(UUID.randomUUID().toString(), name));
        logger.trace("created folder {}", saved.getId());
        return saved.copy();
    }

    @Override
    @Transactional
    public DriveFile createFile(String name, String contents) {
        DriveFile saved = fileRepository.save(new DriveFile(UUID.randomUUID().toString(), name, contents));
        logger.trace("created file {}", saved.getId());
        return saved.copy();
    }

    @Override
    @Transactional
    public void setFileParentFolder(String fileId, String parentFolderId) {
        DriveFile file = requireFile(fileId);
        file.setParentFolder(parentFolderId);
        fileRepository.save(file);
    }

    @Override
    @Transactional
    public void setFolderParentFolder(String folderId, String parentFolderId) {
        DriveFolder folder = requireFolder(folderId);
        folder.setParentFolder(parentFolderId);
        folderRepository.save(folder);
    }

    @Override
    @Transactional
    public boolean addToFileUsers(String fileId, String userId) {
        DriveFile file = requireFile(fileId);
        boolean added = file.getDirectGrants().add(userId);
        if (added) {
            fileRepository.save(file);
        }
        return added;
    }

    @Override
    @Transactional
    public boolean addToFolderUsers(String folderId, String userId) {
        DriveFolder folder = requireFolder(folderId);
        boolean added = folder.getDirectGrants().add(userId);
        if (added) {
            folderRepository.save(folder);
        }
        return added;
    }

    @Override
    @Transactional
    public void addToFolderFiles(String folderId, String fileId) {
        DriveFolder folder = requireFolder(folderId);
        if (folder.getChildFiles().add(fileId)) {
            folderRepository.save(folder);
        }
    }

    @Override
    @Transactional
    public void removeFromFolderFiles(String folderId, String fileId) {
        DriveFolder folder = requireFolder(folderId);
        if (folder.getChildFiles().remove(fileId)) {
            folderRepository.save(folder);
        }
    }

    @Override
    @Transactional
    public void addToFolderFolders(String parentFolderId, String childFolderId) {
        DriveFolder folder = requireFolder(parentFolderId);
        if (folder.getChildFolders().add(childFolderId)) {
            folderRepository.save(folder);
        }
    }

    @Override
    @Transactional
    public void removeFromFolderFolders(String parentFolderId, String childFolderId) {
        DriveFolder folder = requireFolder(parentFolderId);
        if (folder.getChildFolders().remove(childFolderId)) {
            folderRepository.save(folder);
        }
    }

    @Override
    @Transactional
    public void addToUserFiles(String userId, String fileId) {
        DriveUser user = requireUser(userId);
        if (user.getFiles().add(fileId)) {
            userRepository.save(user);
        }
    }

    @Override
    @Transactional
    public void addToUserFolders(String userId, String folderId) {
        DriveUser user = requireUser(userId);
        if (user.getFolders().add(folderId)) {
            userRepository.save(user);
        }
    }

    private DriveUser requireUser(String userId) {
        return (userId == null ? Optional.<DriveUser>empty() : userRepository.findById(userId))
                .orElseThrow(() -> new StoreException("Unhandled error: user not found: " + userId));
    }

    private DriveFolder requireFolder(String folderId) {
        return (folderId == null ? Optional.<DriveFolder>empty() : folderRepository.findById(folderId))
                .orElseThrow(() -> new StoreException("Unhandled error: folder not found: " + folderId));
    }

    private DriveFile requireFile(String fileId) {
        return (fileId == null ? Optional.<DriveFile>empty() : fileRepository.findById(fileId))
                .orElseThrow(() -> new StoreException("Unhandled error: file not found: " + fileId));
    }
}
