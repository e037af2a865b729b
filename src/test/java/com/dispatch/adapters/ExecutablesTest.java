package com.dispatch.adapters;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ExecutablesTest {

    @TempDir
    Path dir;

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void resolvesBareNameOnPath() {
        var sh = Executables.resolve("sh");
        assertTrue(sh.isPresent());
        assertEquals("sh", sh.get().getFileName().toString());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void acceptsAbsolutePath() {
        assertEquals(Path.of("/bin/sh"), Executables.resolve("/bin/sh").orElseThrow());
    }

    @Test
    void rejectsNonExecutableFile() throws Exception {
        var file = Files.writeString(dir.resolve("notes.txt"), "hi");
        assertTrue(Executables.resolve(file.toString()).isEmpty());
    }

    @Test
    void unknownAndBlankResolveToNothing() {
        assertTrue(Executables.resolve("no-such-binary-anywhere-42").isEmpty());
        assertTrue(Executables.resolve(" ").isEmpty());
        assertTrue(Executables.resolve(null).isEmpty());
    }
}
