package com.bulwark.core.check;

import com.bulwark.core.model.Severity;
import com.bulwark.core.snapshot.InMemorySnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.attribute.PosixFilePermissions;

import static org.junit.jupiter.api.Assertions.*;

class FilePermissionsCheckTest {

    private final FilePermissionsCheck check = new FilePermissionsCheck();

    @Test
    @DisplayName("no sensitive files scores full marks")
    void noSensitiveFiles() {
        var result = check.evaluate(new InMemorySnapshot().file("README.md", "hi", "rw-r--r--"));
        assertEquals(10, result.score());
        assertTrue(result.issues().isEmpty());
    }

    @Test
    @DisplayName("world-readable env file costs two points with a warning")
    void worldReadableEnvFile() {
        var snapshot = new InMemorySnapshot()
                .file(".env", "TOKEN=x", "rw-r--r--")
                .file("mcp-server/.env", "KEY=y", "rw-------");

        var result = check.evaluate(snapshot);

        assertEquals(8, result.score());
        assertEquals(1, result.issues().size());
        var issue = result.issues().get(0);
        assertEquals("FilePermissions", issue.component());
        assertEquals(Severity.WARNING, issue.severity());
        assertEquals(".env is readable by others (permissions: 644)", issue.message());
        assertEquals("Run: chmod 600 /work/project/.env", issue.recommendation());
    }

    @Test
    @DisplayName("every offending file deducts")
    void everyOffendingFileDeducts() {
        var snapshot = new InMemorySnapshot()
                .file(".env", "", "rw-rw-rw-")
                .file("config.toml", "", "rwxr-xr-x")
                .file("mcp-server/.env", "", "rw-r-----")
                .file("mcp-server/config.json", "{}", "rw-r--r--");

        var result = check.evaluate(snapshot);

        assertEquals(4, result.score());
        assertEquals(3, result.issues().size());
        assertEquals("mcp-server/config.json is readable by others (permissions: 644)",
                result.issues().get(2).message());
    }

    @Test
    @DisplayName("permission lookup failures are skipped")
    void lookupFailureSkipped() {
        var result = check.evaluate(new InMemorySnapshot().file(".env", "A=1"));
        assertEquals(10, result.score());
        assertTrue(result.issues().isEmpty());
    }

    @Test
    @DisplayName("toOctal renders owner, group and others digits")
    void toOctal() {
        assertEquals("600", FilePermissionsCheck.toOctal(PosixFilePermissions.fromString("rw-------")));
        assertEquals("755", FilePermissionsCheck.toOctal(PosixFilePermissions.fromString("rwxr-xr-x")));
        assertEquals("000", FilePermissionsCheck.toOctal(PosixFilePermissions.fromString("---------")));
    }
}
