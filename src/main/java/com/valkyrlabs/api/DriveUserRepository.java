package com.valkyrlabs.api;

import com.valkyrlabs.model.DriveUser;
import org.springframework.data.repository.CrudRepository;

public interface DriveUserRepository extends CrudRepository<DriveUser, String> {
}
