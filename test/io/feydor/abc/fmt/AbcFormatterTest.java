package io.feydor.abc.fmt;

import io.feydor.abc.Abc;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AbcFormatterTest {

    private static String format(String source) {
        return Abc.parse(source).format();
    }

    private static String musicLines(String formatted) {
        return formatted.substring(formatted.indexOf("[V:1]"));
    }

    private static String withoutSpaces(String text) {
        return text.replace(" ", "").replace("\t", "");
    }

    @Test
    void singleVoiceGetsOneSpaceAroundEachElement() {
        assertEquals("X:1\nCDEF | GABG |", format("X:1\nCDEF|GABG|"));
    }

    @Test
    void runsOfWhitespaceCollapse() {
        assertEquals("X:1\nC D | E", format("X:1\nC    D\t|  E"));
    }

    @Test
    void slursAndTupletsStayAttached() {
        assertEquals("X:1\nC (DE) F", format("X:1\nC (DE) F"));
        assertEquals("X:1\n(3abc def", format("X:1\n(3abc def"));
        assertEquals("X:1\nC (3DEF |", format("X:1\nC(3DEF|"));
    }

    @Test
    void inlineFieldsAreFollowedByASpace() {
        assertEquals("X:1\n[K:G] abc", format("X:1\n[K:G]abc"));
    }

    @Test
    void commentsAndLineBreaksAreKept() {
        assertEquals("X:1\nC D % note\nE F |\n", format("X:1\nC  D   % note\nE F|\n"));
    }

    @Test
    void headersAreLeftAsWritten() {
        String source = "%%scale 0.8\n\nX:1\nT:  spaced   title\nK:C\nC D|\n";

        assertEquals("%%scale 0.8\n\nX:1\nT:  spaced   title\nK:C\nC D |\n", format(source));
    }

    @Test
    void barsOfTwoVoicesAreEqualized() {
        String source = "X:1\nV:1\nV:2\nK:C\n[V:1]CD|EF|\n[V:2]GABC|EF|\n";

        assertEquals("X:1\nV:1\nV:2\nK:C\n[V:1] CD   | EF |\n[V:2] GABC | EF |\n", format(source));
    }

    @Test
    void notesSoundingTogetherShareAColumn() {
        String source = "X:1\nV:1\nV:2\nK:C\n[V:1]C3 D|\n[V:2]EFG A|\n";

        assertEquals("[V:1] C3  D |\n[V:2] EFG A |\n", musicLines(format(source)));
    }

    @Test
    void theLastBarIsNotPadded() {
        String source = "X:1\nV:1\nV:2\nK:C\n[V:1]CD|EF\n[V:2]GABC|EFGA\n";

        assertEquals("[V:1] CD   | EF\n[V:2] GABC | EFGA\n", musicLines(format(source)));
    }

    @Test
    void multiMeasureRestsAreExpandedInMultiVoiceTunes() {
        String source = "X:1\nV:1\nV:2\nK:C\n[V:1]Z2|\n[V:2]CD|EF|\n";

        assertEquals("[V:1] Z  | Z  |\n[V:2] CD | EF |\n", musicLines(format(source)));
    }

    @Test
    void aGraceGroupGluedToItsNoteMovesWithIt() {
        String source = "X:1\nV:1\nV:2\nK:C\n[V:1]C2 {g} D|\n[V:2]E F G|\n";

        assertEquals("[V:1] C2  {g}D |\n[V:2] E F G    |\n", musicLines(format(source)));
    }

    @Test
    void ornamentedMultiVoiceTunesFormatTheSameTwice() {
        for (var ornament : new String[]{"{g}", "!trill!", "{/ab}", "\"Am\"", "y"}) {
            String source = "X:1\nV:1\nV:2\nK:C\n[V:1]C2 " + ornament + " D|\n[V:2]E F G|\n";
            String once = format(source);

            assertEquals(once, format(once), ornament);
        }
    }

    @Test
    void multiMeasureRestsStayInSingleVoiceTunes() {
        assertEquals("X:1\nZ4 |", format("X:1\nZ4|"));
    }

    @Test
    void alignmentCanBeTurnedOff() {
        String source = "X:1\nV:1\nV:2\nK:C\n[V:1]CD|EF|\n[V:2]GABC|EF|\n";
        var config = new FormatterConfig(false, false, false);

        assertEquals("[V:1] CD | EF |\n[V:2] GABC | EF |\n", musicLines(Abc.parse(source).format(config)));
    }

    @Test
    void tunesWithErrorsAreLeftAsWritten() {
        String source = "X:1\n[CE\nCDEF|\n\nX:2\nC  D|\n";

        assertEquals("X:1\n[CE\nCDEF|\n\nX:2\nC D |\n", format(source));
    }

    @Test
    void tunesWithErrorsCanBeFormattedOnRequest() {
        var config = new FormatterConfig(true, true, false);

        assertEquals("X:1\n[CE\nCDEF |\n", Abc.parse("X:1\n[CE\nCDEF|\n").format(config));
    }

    @Test
    void twoVoiceFixtureLinesUpItsFirstBars() throws IOException {
        String formatted = format(Files.readString(Path.of("test/resources/two_voices.abc")));
        String[] lines = formatted.split("\n");
        String soprano = lines[lines.length - 2];
        String alto = lines[lines.length - 1];

        int sopranoBar = soprano.indexOf('|');
        int altoBar = alto.indexOf('|');
        assertEquals(sopranoBar, altoBar);
        assertEquals(soprano.indexOf('|', sopranoBar + 1), alto.indexOf('|', altoBar + 1));
    }

    @Test
    void formattingOnlyAddsOrRemovesWhitespace() throws IOException {
        for (var fixture : new String[]{"test/resources/roundtrip.abc", "test/resources/two_voices.abc"}) {
            String source = Files.readString(Path.of(fixture));

            assertEquals(withoutSpaces(source), withoutSpaces(format(source)), fixture);
        }
    }

    @Test
    void formattingIsIdempotent() throws IOException {
        String[] sources = {
                Files.readString(Path.of("test/resources/roundtrip.abc")),
                Files.readString(Path.of("test/resources/two_voices.abc")),
                "X:1\nV:1\nV:2\nK:C\n[V:1]C3 D|Z2|\n[V:2]EFG A|CD|EF|\n",
        };
        for (var source : sources) {
            String once = format(source);

            assertEquals(once, format(once));
        }
    }
}
