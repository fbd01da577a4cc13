package floats;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static floats.Types.*;

/**
 * CLI for float placement.
 *
 * Usage:
 *   java floats.Floats place containing-width requests  [options]
 *   java floats.Floats bands containing-width requests  [options]
 *
 * Request lines: "left|right WIDTH HEIGHT [MIN_TOP]", "clear left|right|both".
 * Blank lines and lines starting with '#' are ignored.
 * Options: --verbose, --check, --source-order
 */
public final class Floats {

    public static void main(String[] args) {
        try {
            int failed = run(args, System.out, System.err);
            if (failed > 0) System.exit(1);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.exit(1);
        } catch (IOException e) {
            System.err.println(e.getMessage());
            System.exit(1);
        }
    }

    /** Runs one command; returns the number of rejected requests. */
    static int run(String[] args, PrintStream out, PrintStream err) throws IOException {
        if (args.length < 3) usage();

        String cmd = args[0];
        boolean dumpBands;
        if ("place".equals(cmd)) {
            dumpBands = false;
        } else if ("bands".equals(cmd)) {
            dumpBands = true;
        } else {
            usage();
            return 0;
        }

        long containingWidth = parseLong(args[1], "containing width");
        String path = args[2];

        ContextOptions opts = new ContextOptions();
        for (int i = 3; i < args.length; i++) {
            String opt = args[i];
            if ("--verbose".equals(opt)) {
                opts.verbose = true;
            } else if ("--check".equals(opt)) {
                opts.checkInvariants = true;
            } else if ("--source-order".equals(opt)) {
                opts.sourceOrder = true;
            } else {
                throw new IllegalArgumentException("Unknown option: " + opt);
            }
        }

        List<String> lines = Files.readAllLines(Path.of(path), StandardCharsets.UTF_8);
        FloatContext ctx = new FloatContext(containingWidth, opts);
        int failed = execute(ctx, lines, out, err);

        if (dumpBands) {
            out.print(ctx);
        } else {
            out.printf("Floats:       %d%n", ctx.floatCount());
            out.printf("Bands:        %d%n", ctx.bandCount());
            out.printf("Clear left:   %d%n", ctx.clearance(Clear.LEFT));
            out.printf("Clear right:  %d%n", ctx.clearance(Clear.RIGHT));
            if (failed > 0) out.printf("Rejected:     %d%n", failed);
        }
        return failed;
    }

    /**
     * Feed request lines to ctx, printing one placement per float.  A rejected
     * request is reported on err and does not stop the run.
     */
    static int execute(FloatContext ctx, List<String> lines, PrintStream out, PrintStream err) {
        int failed = 0;
        long floor = 0;
        for (int n = 0; n < lines.size(); n++) {
            String line = lines.get(n).trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            String[] f = line.split("\\s+");
            try {
                if ("clear".equalsIgnoreCase(f[0])) {
                    if (f.length != 2) throw new IllegalArgumentException("expected: clear left|right|both");
                    floor = Math.max(floor, ctx.clearance(parseClear(f[1])));
                    continue;
                }
                if (f.length < 3 || f.length > 4)
                    throw new IllegalArgumentException("expected: left|right WIDTH HEIGHT [MIN_TOP]");
                Side side = parseSide(f[0]);
                long width = parseLong(f[1], "width");
                long height = parseLong(f[2], "height");
                long minTop = Math.max(floor, f.length == 4 ? parseLong(f[3], "min top") : 0);
                Point at = ctx.addFloat(side, width, height, minTop);
                out.printf("%-5s %dx%d -> %s%n", side.name().toLowerCase(), width, height, at);
            } catch (IllegalArgumentException e) {
                failed++;
                err.printf("line %d: %s%n", n + 1, e.getMessage());
            }
        }
        return failed;
    }

    private static void usage() {
        throw new IllegalArgumentException(
            "Usage:\n" +
            "  java floats.Floats place <containing-width> <requests> [options]\n" +
            "  java floats.Floats bands <containing-width> <requests> [options]\n\n" +
            "Requests: left|right WIDTH HEIGHT [MIN_TOP], clear left|right|both\n" +
            "Options: --verbose, --check, --source-order");
    }

    private static Side parseSide(String s) {
        if ("left".equalsIgnoreCase(s)) return Side.LEFT;
        if ("right".equalsIgnoreCase(s)) return Side.RIGHT;
        throw new IllegalArgumentException("Unknown side: " + s);
    }

    private static Clear parseClear(String s) {
        if ("left".equalsIgnoreCase(s)) return Clear.LEFT;
        if ("right".equalsIgnoreCase(s)) return Clear.RIGHT;
        if ("both".equalsIgnoreCase(s)) return Clear.BOTH;
        if ("none".equalsIgnoreCase(s)) return Clear.NONE;
        throw new IllegalArgumentException("Unknown clear value: " + s);
    }

    private static long parseLong(String s, String what) {
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("bad " + what + ": " + s);
        }
    }
}
