package com.bulwark.core.check;

import com.bulwark.core.model.CheckResult;
import com.bulwark.core.model.Severity;
import com.bulwark.core.snapshot.ProjectSnapshot;
import com.bulwark.core.snapshot.SnapshotReadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.file.attribute.PosixFilePermission;
import java.util.Set;

/**
 * Flags sensitive configuration files (environment files, configs) that
 * grant any permission to "others". Deducts per offending file.
 */
@Component
@Order(1)
public class FilePermissionsCheck extends AbstractCheck {

    private static final Logger log = LoggerFactory.getLogger(FilePermissionsCheck.class);

    public FilePermissionsCheck() {
        super("file_permissions", "File Permissions");
    }

    @Override
    protected int score(ProjectSnapshot snapshot, IssueLog issues) {
        int score = CheckResult.MAX_SCORE;
        for (var target : CheckRules.SENSITIVE_FILES) {
            String path = snapshot.resolve(target.component(), target.path());
            if (!snapshot.exists(path)) {
                continue;
            }

            Set<PosixFilePermission> permissions;
            try {
                permissions = snapshot.permissions(path);
            } catch (SnapshotReadException e) {
                log.debug("Skipping permission check for {}: {}", path, e.getMessage());
                continue;
            }

            String octal = toOctal(permissions);
            if (octal.charAt(2) != '0') {
                score -= CheckRules.PERMISSION_DEDUCTION;
                issues.issue("FilePermissions", Severity.WARNING,
                        path + " is readable by others (permissions: " + octal + ")",
                        "Run: chmod 600 " + snapshot.absolute(path));
            } else {
                log.info("{}: {} (secure)", path, octal);
            }
        }
        return score;
    }

    /**
     * Renders permissions as three octal digits, e.g. {@code 644}.
     */
    static String toOctal(Set<PosixFilePermission> permissions) {
        int owner = digit(permissions, PosixFilePermission.OWNER_READ,
                PosixFilePermission.OWNER_WRITE, PosixFilePermission.OWNER_EXECUTE);
        int group = digit(permissions, PosixFilePermission.GROUP_READ,
                PosixFilePermission.GROUP_WRITE, PosixFilePermission.GROUP_EXECUTE);
        int others = digit(permissions, PosixFilePermission.OTHERS_READ,
                PosixFilePermission.OTHERS_WRITE, PosixFilePermission.OTHERS_EXECUTE);
        return "" + owner + group + others;
    }

    private static int digit(Set<PosixFilePermission> permissions,
                             PosixFilePermission read, PosixFilePermission write, PosixFilePermission execute) {
        return (permissions.contains(read) ? 4 : 0)
                + (permissions.contains(write) ? 2 : 0)
                + (permissions.contains(execute) ? 1 : 0);
    }
}
