package com.valkyrlabs.api;

import com.valkyrlabs.model.DriveFile;
import java.util.List;
import org.springframework.data.repository.CrudRepository;

public interface DriveFileRepository extends CrudRepository<DriveFile, String> {

        List<DriveFile> findByParentFolder(String parentFolder);
}
