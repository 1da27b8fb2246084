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
 * A folder node. A folder without a parent is a root.
 *
 * <p>
 * Relationships are id references resolved through the store: the parent
 * pointer, the child file and child folder sets, and the set of users holding
 * a direct grant on this folder.
 * </p>
 */
@Entity
@Table(name = "drive_folder")
public class DriveFolder {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private String id;

    @Column(name = "name")
    private String name;

    @Column(name = "parent_folder")
    private String parentFolder;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "drive_folder_grants", joinColumns = @JoinColumn(name = "folder_id"))
    @Column(name = "user_id")
    private Set<String> directGrants = new LinkedHashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "drive_folder_files", joinColumns = @JoinColumn(name = "folder_id"))
    @Column(name = "file_id")
    private Set<String> childFiles = new LinkedHashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "drive_folder_folders", joinColumns = @JoinColumn(name = "folder_id"))
    @Column(name = "child_folder_id")
    private Set<String> childFolders = new LinkedHashSet<>();

    protected DriveFolder() {
        // JPA
    }

    public DriveFolder(String id, String name) {
        this.id = id;
        this.name = name;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getParentFolder() {
        return parentFolder;
    }

    public void setParentFolder(String parentFolder) {
        this.parentFolder = parentFolder;
    }

    public Set<String> getDirectGrants() {
        return directGrants;
    }

    public Set<String> getChildFiles() {
        return childFiles;
    }

    public Set<String> getChildFolders() {
        return childFolders;
    }

    public boolean isRoot() {
        return parentFolder == null;
    }

    public DriveFolder copy() {
        DriveFolder c = new DriveFolder(id, name);
        c.parentFolder = parentFolder;
        c.directGrants = new LinkedHashSet<>(directGrants);
        c.childFiles = new LinkedHashSet<>(childFiles);
        c.childFolders = new LinkedHashSet<>(childFolders);
        return c;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DriveFolder other)) {
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
        return "DriveFolder[" + id + (name != null ? " '" + name + "'" : "") + "]";
    }
}
