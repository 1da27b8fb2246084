package com.valkyrlabs.thordrive.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;

import com.valkyrlabs.model.DriveFile;
import com.valkyrlabs.model.DriveFolder;

class InMemoryEntityStoreTest {

    private InMemoryEntityStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryEntityStore();
    }

    @Test
    void createUser_generatesDistinctIds() {
        String a = store.createUser(null).getId();
        String b = store.createUser(null).getId();

        assertNotEquals(a, b);
        assertTrue(store.getUser(a).isPresent());
    }

    @Test
    void createUser_duplicateId_throwsDuplicateKey() {
        store.createUser("u1");

        assertThrows(DuplicateKeyException.class, () -> store.createUser("u1"));
    }

    @Test
    void createFolder_startsAsEmptyRoot() {
        DriveFolder folder = store.createFolder("docs");

        assertEquals("docs", folder.getName());
        assertNull(folder.getParentFolder());
        assertTrue(folder.isRoot());
        assertTrue(folder.getDirectGrants().isEmpty());
        assertTrue(folder.getChildFiles().isEmpty());
        assertTrue(folder.getChildFolders().isEmpty());
    }

    @Test
    void reads_returnCopies() {
        DriveFile file = store.createFile("a", "body");

        store.getFile(file.getId()).orElseThrow().getDirectGrants().add("intruder");
        file.setParentFolder("elsewhere");

        DriveFile stored = store.getFile(file.getId()).orElseThrow();
        assertTrue(stored.getDirectGrants().isEmpty());
        assertNull(stored.getParentFolder());
    }

    @Test
    void reads_missingOrNullId_areEmpty() {
        assertTrue(store.getUser("nope").isEmpty());
        assertTrue(store.getFolder(null).isEmpty());
        assertTrue(store.getFile(null).isEmpty());
    }

    @Test
    void addToFileUsers_isIdempotent() {
        DriveFile file = store.createFile("a", null);

        assertTrue(store.addToFileUsers(file.getId(), "u1"));
        assertFalse(store.addToFileUsers(file.getId(), "u1"));
        assertEquals(1, store.getFile(file.getId()).orElseThrow().getDirectGrants().size());
    }

    @Test
    void childSets_addAndRemove() {
        DriveFolder parent = store.createFolder("p");
        DriveFolder child = store.createFolder("c");
        DriveFile file = store.createFile("f", null);

        store.addToFolderFolders(parent.getId(), child.getId());
        store.addToFolderFiles(parent.getId(), file.getId());
        store.removeFromFolderFiles(parent.getId(), file.getId());
        // removing an absent member is not an error
        store.removeFromFolderFiles(parent.getId(), file.getId());

        DriveFolder stored = store.getFolder(parent.getId()).orElseThrow();
        assertTrue(stored.getChildFolders().contains(child.getId()));
        assertTrue(stored.getChildFiles().isEmpty());
    }

    @Test
    void writes_toMissingRow_throwStoreException() {
        DriveFile file = store.createFile("a", null);

        StoreException e = assertThrows(StoreException.class,
                () -> store.addToFolderFiles("missing", file.getId()));
        assertTrue(e.getMessage().contains("missing"));
        assertThrows(StoreException.class, () -> store.setFileParentFolder("missing", null));
        assertThrows(StoreException.class, () -> store.addToUserFiles("ghost", file.getId()));
        assertThrows(StoreException.class, () -> store.addToFolderUsers(null, "u1"));
    }
}
