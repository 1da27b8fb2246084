package com.valkyrlabs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import com.valkyrlabs.model.DriveFile;
import com.valkyrlabs.model.DriveFolder;
import com.valkyrlabs.thordrive.config.ThorDriveProperties;
import com.valkyrlabs.thordrive.service.DriveOperations;
import com.valkyrlabs.thordrive.store.EntityStore;
import com.valkyrlabs.thordrive.store.InMemoryEntityStore;

@SpringBootTest(properties = "thordrive.store.type=" + ThorDriveProperties.STORE_MEMORY)
class ThorDriveMemoryStoreTest {

    @Autowired
    private DriveOperations drive;

    @Autowired
    private EntityStore store;

    @Test
    void memoryStoreIsSelectedAndServesOperations() {
        assertInstanceOf(InMemoryEntityStore.class, store);

        String owner = drive.createUser(null).getId();
        DriveFolder folder = drive.createFolder(owner, "docs", null);
        DriveFile file = drive.createFile(owner, "a.txt", "body", folder.getId());

        assertEquals(folder.getId(), drive.getFile(owner, file.getId()).getParentFolder());
    }
}
