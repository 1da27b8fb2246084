package com.valkyrlabs.thordrive.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DuplicateKeyException;

import com.valkyrlabs.api.DriveFileRepository;
import com.valkyrlabs.api.DriveFolderRepository;
import com.valkyrlabs.model.DriveFile;
import com.valkyrlabs.model.DriveFolder;
import com.valkyrlabs.model.DriveUser;

@DataJpaTest
@Import(JpaEntityStore.class)
class JpaEntityStoreTest {

    @Autowired
    private JpaEntityStore store;

    @Autowired
    private DriveFolderRepository folderRepository;

    @Autowired
    private DriveFileRepository fileRepository;

    @Test
    void createUser_persistsAndRejectsDuplicates() {
        DriveUser user = store.createUser("alice");

        assertEquals("alice", user.getId());
        assertTrue(store.getUser("alice").isPresent());
        assertThrows(DuplicateKeyException.class, () -> store.createUser("alice"));
    }

    @Test
    void parentPointerAndChildSet_agree() {
        DriveFolder parent = store.createFolder("parent");
        DriveFolder child = store.createFolder("child");
        DriveFile file = store.createFile("f", "contents");

        store.setFolderParentFolder(child.getId(), parent.getId());
        store.addToFolderFolders(parent.getId(), child.getId());
        store.setFileParentFolder(file.getId(), parent.getId());
        store.addToFolderFiles(parent.getId(), file.getId());

        DriveFolder stored = store.getFolder(parent.getId()).orElseThrow();
        assertEquals(Set.of(child.getId()), stored.getChildFolders());
        assertEquals(Set.of(file.getId()), stored.getChildFiles());
        assertEquals(List.of(child.getId()),
                folderRepository.findByParentFolder(parent.getId()).stream().map(DriveFolder::getId).toList());
        assertEquals(List.of(file.getId()),
                fileRepository.findByParentFolder(parent.getId()).stream().map(DriveFile::getId).toList());
    }

    @Test
    void detach_clearsBothSides() {
        DriveFolder parent = store.createFolder("parent");
        DriveFile file = store.createFile("f", null);
        store.setFileParentFolder(file.getId(), parent.getId());
        store.addToFolderFiles(parent.getId(), file.getId());

        store.removeFromFolderFiles(parent.getId(), file.getId());
        store.setFileParentFolder(file.getId(), null);

        assertNull(store.getFile(file.getId()).orElseThrow().getParentFolder());
        assertTrue(store.getFolder(parent.getId()).orElseThrow().getChildFiles().isEmpty());
        assertTrue(fileRepository.findByParentFolder(parent.getId()).isEmpty());
    }

    @Test
    void grants_areIdempotentAndRecordedOnTheUser() {
        store.createUser("bob");
        DriveFolder folder = store.createFolder("shared");

        assertTrue(store.addToFolderUsers(folder.getId(), "bob"));
        assertFalse(store.addToFolderUsers(folder.getId(), "bob"));
        store.addToUserFolders("bob", folder.getId());

        assertEquals(Set.of("bob"), store.getFolder(folder.getId()).orElseThrow().getDirectGrants());
        assertEquals(Set.of(folder.getId()), store.getUser("bob").orElseThrow().getFolders());
    }

    @Test
    void reads_returnDetachedCopies() {
        DriveFile file = store.createFile("f", "x");

        store.getFile(file.getId()).orElseThrow().getDirectGrants().add("mallory");

        assertTrue(store.getFile(file.getId()).orElseThrow().getDirectGrants().isEmpty());
    }

    @Test
    void writes_toMissingRow_throwStoreException() {
        assertThrows(StoreException.class, () -> store.addToFileUsers("missing", "bob"));
        assertThrows(StoreException.class, () -> store.setFolderParentFolder("missing", null));
        assertThrows(StoreException.class, () -> store.addToUserFiles("ghost", "f"));
    }
}
