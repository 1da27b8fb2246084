package com.valkyrlabs.thordrive.security;

import org.springframework.security.access.AccessDeniedException;

/**
 * The actor holds neither a direct nor a derived grant on the target or
 * destination node. The message is the same for every denial so callers
 * cannot tell which part of the ancestry was missing.
 */
public class NodeAccessDeniedException extends AccessDeniedException {

    private static final long serialVersionUID = 7731268090137245530L;

    public static final String MESSAGE = "Access denied";

    public NodeAccessDeniedException() {
        super(MESSAGE);
    }
}
