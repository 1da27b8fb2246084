package com.valkyrlabs.model;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;

/**
 * <p>
 * DriveUser record.
 * </p>
 *
 * The files/folders sets are bookkeeping only: they list nodes the user has
 * been granted directly and are never consulted when deciding access.
 */
@Entity
@Table(name = "drive_user")
public class DriveUser {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private String id;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "drive_user_files", joinColumns = @JoinColumn(name = "user_id"))
    @Column(name = "file_id")
    private Set<String> files = new LinkedHashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "drive_user_folders", joinColumns = @JoinColumn(name = "user_id"))
    @Column(name = "folder_id")
    private Set<String> folders = new LinkedHashSet<>();

    protected DriveUser() {
        // JPA
    }

    public DriveUser(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public Set<String> getFiles() {
        return files;
    }

    public Set<String> getFolders() {
        return folders;
    }

    /** Detached copy, safe to hand to callers. */
    public DriveUser copy() {
        DriveUser c = new DriveUser(id);
        c.files = new LinkedHashSet<>(files);
        c.folders = new LinkedHashSet<>(folders);
        return c;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DriveUser other)) {
            return false;
        }
        return Objects.equals(id, other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "DriveUser[" + id + "]";
    }
}
