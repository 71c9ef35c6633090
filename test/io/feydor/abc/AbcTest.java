package io.feydor.abc;

import io.feydor.abc.fmt.Stringifier;
import io.feydor.abc.tree.AbcNode;
import io.feydor.abc.tree.TreeCloner;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AbcTest {

    @Test
    void readKeepsTheSourceAndTheFilename() throws IOException {
        var abc = Abc.read(new File("test/resources/roundtrip.abc"));

        assertEquals("test/resources/roundtrip.abc".replace('/', File.separatorChar), abc.filename);
        assertEquals(Files.readString(Path.of("test/resources/roundtrip.abc")), abc.getSource());
        assertTrue(abc.isParsed());
        assertTrue(abc.getErrors().isEmpty());
        assertEquals(abc.getSource(), abc.stringify());
    }

    @Test
    void formattingWorksOnACopy() {
        var abc = Abc.parse("X:1\nC  D|\n");

        assertEquals("X:1\nC D |\n", abc.format());
        assertEquals("X:1\nC  D|\n", abc.stringify());
    }

    @Test
    void tokensEndWithEof() {
        var tokens = Abc.parse("X:1\nC").getTokens();

        assertEquals("", tokens.get(tokens.size() - 1).lexeme());
        assertThrows(UnsupportedOperationException.class, () -> tokens.add(tokens.get(0)));
    }

    @Test
    void freeTextBetweenTunesDoesNotStopTheParse() {
        String source = "X:1\nK:C\nCDE|\n\nSome notes about the tune.\n\nX:2\nK:C\nC|\n";
        var abc = Abc.parse(source);

        assertTrue(abc.isParsed());
        assertEquals(List.of(), abc.getErrors());
        assertEquals(2, abc.getTree().tunes().size());
        assertEquals(source, abc.stringify());
        assertEquals("X:1\nK:C\nCDE |\n\nSome notes about the tune.\n\nX:2\nK:C\nC |\n", abc.format());
    }

    @Test
    void diagnosticsAreOneBasedWhenPrinted() {
        var abc = Abc.parse("X:1\nC \"open\n");
        var error = abc.getErrors().get(0);

        assertEquals(AbcErrorOrigin.SCANNER, error.origin());
        assertEquals(1, error.line());
        assertEquals(2, error.column());
        assertTrue(error.toString().startsWith("2:3 [SCANNER]"));
    }

    @Test
    void clonesAreDeepCopiesWithTheirOwnIds() {
        var context = new AbcContext();
        var abc = Abc.parse("X:1\nV:1\nV:2\n[V:1]CD|\n[V:2]EF|\n");
        var copy = new TreeCloner(context).copy(abc.getTree());

        assertEquals(abc.stringify(), new Stringifier().stringify(copy));
        var original = abc.getTree().tunes().get(0).body().systems().get(0);
        var copied = copy.tunes().get(0).body().systems().get(0);
        assertEquals(original.size(), copied.size());
        for (int i = 0; i < original.size(); i++) {
            assertNotSame(original.get(i), copied.get(i));
        }
        assertEquals(copied.size(), ids(copied).size());
        assertEquals(List.of("1", "2"), copy.tunes().get(0).header().voices());
    }

    private static Set<Integer> ids(List<AbcNode> nodes) {
        var ids = new HashSet<Integer>();
        for (var node : nodes) {
            ids.add(node.id());
        }
        return ids;
    }
}
