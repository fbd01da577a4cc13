package floats;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.*;

public class FloatsTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
    private final PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);

    List<String> outLines() {
        return Arrays.asList(outBytes.toString(StandardCharsets.UTF_8).split("\\R"));
    }

    String errText() {
        return errBytes.toString(StandardCharsets.UTF_8);
    }

    String requests(String... lines) throws IOException {
        File f = tmp.newFile();
        Files.write(f.toPath(), Arrays.asList(lines), StandardCharsets.UTF_8);
        return f.getPath();
    }

    @Test
    public void executePrintsOnePlacementPerFloat() {
        FloatContext ctx = new FloatContext(100);
        int failed = Floats.execute(ctx, Arrays.asList(
            "# three left floats",
            "left 40 20",
            "",
            "left 40 20 0",
            "LEFT 40 20",
            "right 30 10"), out, err);
        assertEquals(0, failed);
        assertEquals(Arrays.asList(
            "left  40x20 -> (0, 0)",
            "left  40x20 -> (40, 0)",
            "left  40x20 -> (0, 20)",
            "right 30x10 -> (70, 20)"), outLines());
    }

    @Test
    public void clearRaisesLaterMinTop() {
        FloatContext ctx = new FloatContext(100);
        Floats.execute(ctx, Arrays.asList(
            "left 40 20",
            "clear left",
            "right 10 10"), out, err);
        assertEquals("right 10x10 -> (90, 20)", outLines().get(1));
    }

    @Test
    public void badLinesAreReportedAndSkipped() {
        FloatContext ctx = new FloatContext(100);
        int failed = Floats.execute(ctx, Arrays.asList(
            "left 150 10",
            "up 10 10",
            "left ten 10",
            "left 10",
            "left 10 10"), out, err);
        assertEquals(4, failed);
        assertEquals(1, ctx.floatCount());
        String e = errText();
        assertTrue(e, e.contains("line 1: float width 150 exceeds containing width 100"));
        assertTrue(e, e.contains("line 2: Unknown side: up"));
        assertTrue(e, e.contains("line 3: bad width: ten"));
        assertTrue(e, e.contains("line 4: expected"));
    }

    @Test
    public void placeCommandPrintsSummary() throws IOException {
        String path = requests("left 40 20", "right 30 50");
        int failed = Floats.run(new String[] {"place", "100", path, "--check"}, out, err);
        assertEquals(0, failed);
        List<String> lines = outLines();
        assertTrue(lines.toString(), lines.contains("Floats:       2"));
        assertTrue(lines.toString(), lines.contains("Clear left:   20"));
        assertTrue(lines.toString(), lines.contains("Clear right:  50"));
    }

    @Test
    public void bandsCommandDumpsProfile() throws IOException {
        String path = requests("left 40 20");
        Floats.run(new String[] {"bands", "100", path}, out, err);
        List<String> lines = outLines();
        assertTrue(lines.toString(), lines.contains("    [0, 20) left=40 right=0"));
        assertTrue(lines.toString(), lines.contains("    [20, inf) left=0 right=0"));
    }

    @Test
    public void rejectedRequestsAreCounted() throws IOException {
        String path = requests("left 40 20", "right 200 5");
        assertEquals(1, Floats.run(new String[] {"place", "100", path}, out, err));
        assertTrue(outLines().contains("Rejected:     1"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownOptionIsRejected() throws IOException {
        Floats.run(new String[] {"place", "100", requests("left 1 1"), "--fast"}, out, err);
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownCommandShowsUsage() throws IOException {
        Floats.run(new String[] {"stack", "100", "x"}, out, err);
    }
}
