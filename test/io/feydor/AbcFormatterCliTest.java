package io.feydor;

import io.feydor.abc.Abc;
import io.feydor.abc.fmt.FormatterConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AbcFormatterCliTest {

    private static AbcFormatterCli cli(AbcCliMode mode) {
        return new AbcFormatterCli(FormatterConfig.defaults(), mode, false);
    }

    @Test
    void checkFailsOnUnformattedFiles(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("tune.abc");
        Files.writeString(file, "X:1\nC  D|\n");

        assertEquals(1, cli(AbcCliMode.CHECK).run(List.of(file.toFile())));
        assertEquals("X:1\nC  D|\n", Files.readString(file));
    }

    @Test
    void checkPassesOnFormattedFiles(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("tune.abc");
        Files.writeString(file, "X:1\nC D |\n");

        assertEquals(0, cli(AbcCliMode.CHECK).run(List.of(file.toFile())));
    }

    @Test
    void writeRewritesTheFileInPlace(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("tune.abc");
        Files.writeString(file, "X:1\nV:1\nV:2\nK:C\n[V:1]CD|EF|\n[V:2]GABC|EF|\n");

        assertEquals(0, cli(AbcCliMode.WRITE).run(List.of(file.toFile())));
        assertEquals("X:1\nV:1\nV:2\nK:C\n[V:1] CD   | EF |\n[V:2] GABC | EF |\n", Files.readString(file));
        assertEquals(0, cli(AbcCliMode.CHECK).run(List.of(file.toFile())));
    }

    @Test
    void missingFilesFail(@TempDir Path dir) {
        assertEquals(1, cli(AbcCliMode.PRINT).run(List.of(new File(dir.toFile(), "missing.abc"))));
    }

    @Test
    void notesBetweenTunesAreWrittenBack(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("notes.abc");
        Files.writeString(file, "X:1\nC  D|\n\nSome notes about the tune.\n\nX:2\nE|\n");

        assertEquals(0, cli(AbcCliMode.WRITE).run(List.of(file.toFile())));
        assertEquals("X:1\nC D |\n\nSome notes about the tune.\n\nX:2\nE |\n", Files.readString(file));
    }

    @Test
    void diagnosticsAsJson() {
        var abc = Abc.parse("X:1\n[CE\n");
        var json = AbcFormatterCli.toJsonObject("tune.abc", abc.getErrors().get(0));

        assertEquals("tune.abc", json.get("file"));
        assertEquals(1, json.get("line"));
        assertEquals("CHORD", json.get("origin"));
        assertEquals("\n", json.get("token"));
    }
}
