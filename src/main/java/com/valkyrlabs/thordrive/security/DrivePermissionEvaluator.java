package com.valkyrlabs.thordrive.security;

import java.io.Serializable;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.access.PermissionEvaluator;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;

import com.valkyrlabs.model.DriveFile;
import com.valkyrlabs.model.DriveFolder;
import com.valkyrlabs.model.NodeKind;

/**
 * Thin wrapper around {@link AccessResolver} that implements Spring Security's
 * PermissionEvaluator, so method-security expressions such as
 * {@code hasPermission(#fileId, 'FILE', 'READ')} resolve against the drive
 * hierarchy. The authentication name is taken as the user id.
 *
 * <p>
 * There is a single access level: READ, MOVE and SHARE all ask the same
 * question. Everything else, and any missing node, denies.
 * </p>
 */
@Component
public class DrivePermissionEvaluator implements PermissionEvaluator {

    protected static final Logger logger = LoggerFactory.getLogger(DrivePermissionEvaluator.class);

    static final Set<String> KNOWN_PERMISSIONS = Set.of("READ", "MOVE", "SHARE");

    private final AccessResolver accessResolver;

    public DrivePermissionEvaluator(AccessResolver accessResolver) {
        this.accessResolver = accessResolver;
    }

    @Override
    public boolean hasPermission(Authentication auth, Object targetDomainObject, Object permission) {
        if (targetDomainObject instanceof DriveFile file) {
            return hasPermission(auth, file.getId(), NodeKind.FILE.name(), permission);
        }
        if (targetDomainObject instanceof DriveFolder folder) {
            return hasPermission(auth, folder.getId(), NodeKind.FOLDER.name(), permission);
        }
        logger.warn("Unsupported targetDomainObject {} - denying access",
                targetDomainObject != null ? targetDomainObject.getClass().getSimpleName() : "null");
        return false;
    }

    @Override
    public boolean hasPermission(Authentication auth, Serializable targetId, String targetType, Object permission) {
        logger.trace("hasPermission called with targetId={}, targetType={}, permission={}", targetId, targetType,
                permission);

        if (auth == null || auth.getName() == null || targetId == null || permission == null) {
            logger.trace("Null parameters - denying access: {}:{}:{}", targetId, targetType, permission);
            return false;
        }
        if (!KNOWN_PERMISSIONS.contains(permission.toString().trim().toUpperCase())) {
            logger.warn("Unknown permission {}, denying", permission);
            return false;
        }
        NodeKind kind = NodeKind.fromString(targetType);
        if (kind == null) {
            logger.warn("Unknown target type {}, denying", targetType);
            return false;
        }

        try {
            return accessResolver.canAccess(auth.getName(), targetId.toString(), kind);
        } catch (NodeNotFoundException nf) {
            logger.trace("Node not found for targetId={}, targetType={}: {}", targetId, targetType, nf.getMessage());
            return false;
        }
    }
}
