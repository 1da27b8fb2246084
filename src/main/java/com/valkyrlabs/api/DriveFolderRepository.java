package com.valkyrlabs.api;

import com.valkyrlabs.model.DriveFolder;
import java.util.List;
import org.springframework.data.repository.CrudRepository;

/**
 * Folder rows, keyed by folder id.
 */
public interface DriveFolderRepository extends CrudRepository<DriveFolder, String> {

        /**
         * Folders whose parent pointer names the given folder. Used to cross-check
         * the child set kept on the parent row.
         *
         * @param parentFolder id of the enclosing folder
         * @return the direct sub-folders
         */
        List<DriveFolder> findByParentFolder(String parentFolder);
}
