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
import jakarta.persistence.Lob;
import jakarta.persistence.Table;

/**
 * A file node, optionally contained in a folder.
 */
@Entity
@Table(name = "drive_file")
public class DriveFile {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private String id;

    @Column(name = "name")
    private String name;

    @Lob
    @Column(name = "contents")
    private String contents;

    @Column(name = "parent_folder")
    private String parentFolder;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "drive_file_grants", joinColumns = @JoinColumn(name = "file_id"))
    @Column(name = "user_id")
    private Set<String> directGrants = new LinkedHashSet<>();

    protected DriveFile() {
        // JPA
    }

    public DriveFile(String id, String name, String contents) {
        this.id = id;
        this.name = name;
        this.contents = contents;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getContents() {
        return contents;
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

    public DriveFile copy() {
        DriveFile c = new DriveFile(id, name, contents);
        c.parentFolder = parentFolder;
        c.directGrants = new LinkedHashSet<>(directGrants);
        return c;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DriveFile other)) {
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
        return "DriveFile[" + id + (name != null ? " '" + name + "'" : "") + "]";
    }
}
