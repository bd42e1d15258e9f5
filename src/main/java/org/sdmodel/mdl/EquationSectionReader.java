package org.sdmodel.mdl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the lines before the sketch marker into an {@link EquationSection}.
 *
 * A block starts on a line with an unquoted {@code =}. Its equation continues while
 * a line ends with the {@code \} continuation marker, or until the first line that
 * starts with {@code ~} (Vensim also writes multi-line bodies such as {@code INTEG (}
 * without backslashes). The units line and the documentation lines up to the
 * {@code |} terminator close the block. Scanning stops at the control-parameter
 * group, which is kept verbatim.
 */
public final class EquationSectionReader {

    private static final Logger LOG = LoggerFactory.getLogger(EquationSectionReader.class);

    static final String UTF8_MARKER = "{UTF-8}";
    static final String CONTROL_RULE = "***";
    static final String CONTROL_GROUP = ".Control";

    private EquationSectionReader() {
    }

    public static EquationSection read(ParseContext ctx) {
        int end = ctx.sketchStart();
        int controlStart = findControlBlock(ctx, end);

        List<EquationSection.Entry> entries = new ArrayList<>();
        int declarationOrder = 0;
        int i = 0;

        while (i < controlStart) {
            String line = ctx.line(i);
            if (!startsEquation(line)) {
                entries.add(new EquationSection.LooseLine(line));
                i++;
                continue;
            }

            String name = extractName(line);
            if (name.isEmpty()) {
                ctx.report(Diagnostic.malformed(i + 1, "Equation without a variable name: " + line.strip()));
                entries.add(new EquationSection.LooseLine(line));
                i++;
                continue;
            }

            int start = i;
            List<String> equationLines = new ArrayList<>();
            equationLines.add(line);
            i++;

            String unitsLine = null;
            List<String> docLines = new ArrayList<>();
            boolean terminated = isSingleLineBlock(line);

            if (!terminated) {
                // equation body
                while (i < controlStart && continuesEquation(equationLines.get(equationLines.size() - 1), ctx.line(i))) {
                    equationLines.add(ctx.line(i));
                    i++;
                }

                // units, then documentation up to the terminator
                if (i < controlStart && ctx.line(i).strip().startsWith("~")) {
                    unitsLine = ctx.line(i);
                    i++;
                    terminated = endsWithTerminator(unitsLine);
                    while (!terminated && i < controlStart) {
                        String doc = ctx.line(i);
                        docLines.add(doc);
                        i++;
                        terminated = endsWithTerminator(doc);
                    }
                }
            }

            if (!terminated) {
                ctx.report(Diagnostic.malformed(start + 1,
                        "Equation block for '" + name + "' has no '" + EquationBlock.TERMINATOR + "' terminator"));
            }

            List<String> trailing = new ArrayList<>();
            while (i < controlStart && ctx.line(i).isBlank()) {
                trailing.add(ctx.line(i));
                i++;
            }

            entries.add(new EquationSection.BlockEntry(new EquationBlock(
                    name, equationLines, unitsLine, docLines, trailing, declarationOrder++, start + 1)));
        }

        List<String> control = new ArrayList<>(ctx.lines().subList(controlStart, end));
        LOG.debug("Read {} equation blocks, {} control lines", declarationOrder, control.size());
        return new EquationSection(entries, control);
    }

    // ==================== Helpers ====================

    private static int findControlBlock(ParseContext ctx, int end) {
        for (int i = 0; i + 1 < end; i++) {
            if (ctx.line(i).strip().startsWith(CONTROL_RULE)
                    && ctx.line(i + 1).strip().startsWith(CONTROL_GROUP)) {
                return i;
            }
        }
        return end;
    }

    static boolean startsEquation(String line) {
        String s = line.strip();
        if (s.isEmpty() || s.startsWith("~") || s.startsWith("|") || s.startsWith(UTF8_MARKER)) {
            return false;
        }
        return FieldSplitter.indexOfUnquoted(line, '=') > 0;
    }

    /**
     * Text left of the first unquoted {@code =}, trimmed and unquoted. The colon of a
     * {@code :=} data equation is not part of the name.
     */
    static String extractName(String line) {
        String lhs = line.substring(0, FieldSplitter.indexOfUnquoted(line, '=')).strip();
        if (lhs.endsWith(":")) {
            lhs = lhs.substring(0, lhs.length() - 1).strip();
        }
        return FieldSplitter.unquote(lhs);
    }

    private static boolean isSingleLineBlock(String line) {
        return FieldSplitter.indexOfUnquoted(line, '~') >= 0 && endsWithTerminator(line);
    }

    private static boolean continuesEquation(String previous, String next) {
        if (previous.stripTrailing().endsWith("\\")) {
            return true;
        }
        return !next.isBlank() && !next.strip().startsWith("~");
    }

    private static boolean endsWithTerminator(String line) {
        return line.stripTrailing().endsWith(String.valueOf(EquationBlock.TERMINATOR));
    }
}
