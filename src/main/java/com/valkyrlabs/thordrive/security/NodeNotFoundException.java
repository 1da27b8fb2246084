package com.valkyrlabs.thordrive.security;

import com.valkyrlabs.model.NodeKind;

/**
 * A referenced file, folder or user id does not exist in the store.
 */
public class NodeNotFoundException extends RuntimeException {

    private static final long serialVersionUID = -2260378517339207212L;

    private final String resource;
    private final String id;

    public NodeNotFoundException(String resource, String id) {
        super(resource + " not found: " + id);
        this.resource = resource;
        this.id = id;
    }

    public NodeNotFoundException(NodeKind kind, String id) {
        this(kind.toValue(), id);
    }

    public String getResource() {
        return resource;
    }

    public String getId() {
        return id;
    }
}
