package com.cladgateway.config;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.EnumSet;
import java.util.Set;

/**
 * Warns about client identity files that other users can read.
 * Never fails: a loose mode is reported, not rejected.
 */
@Slf4j
public final class CredentialFileInspector {

    private static final Set<PosixFilePermission> SHARED_ACCESS = EnumSet.of(
            PosixFilePermission.GROUP_READ, PosixFilePermission.GROUP_WRITE,
            PosixFilePermission.OTHERS_READ, PosixFilePermission.OTHERS_WRITE);

    private CredentialFileInspector() {
    }

    /**
     * @return {@code true} if the file is group or world accessible
     */
    public static boolean warnIfShared(Path file) {
        Set<PosixFilePermission> permissions;
        try {
            permissions = Files.getPosixFilePermissions(file);
        } catch (UnsupportedOperationException e) {
            log.debug("Cannot inspect permissions of {} on this file system", file);
            return false;
        } catch (IOException e) {
            log.warn("Cannot inspect permissions of {}: {}", file, e.getMessage());
            return false;
        }

        Set<PosixFilePermission> shared = EnumSet.noneOf(PosixFilePermission.class);
        shared.addAll(permissions);
        shared.retainAll(SHARED_ACCESS);
        if (shared.isEmpty()) {
            return false;
        }
        log.warn("{} is accessible by group or others ({}); restrict it with chmod 600", file, shared);
        return true;
    }
}
