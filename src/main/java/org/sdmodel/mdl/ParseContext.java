package org.sdmodel.mdl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * State shared by the parsing stages: the physical lines, the section boundaries
 * located up front, and the diagnostics collected along the way.
 */
public final class ParseContext {

    /** Marker line opening the sketch section. */
    public static final String SKETCH_MARKER = "\\\\\\---///";
    /** Marker line closing the sketch section. */
    public static final String FOOTER_MARKER = "///---\\\\\\";

    private final List<String> lines;
    private final int sketchStart;
    private final int footerStart;
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    private ParseContext(List<String> lines, int sketchStart, int footerStart) {
        this.lines = lines;
        this.sketchStart = sketchStart;
        this.footerStart = footerStart;
    }

    /**
     * Split the text into lines and locate the section markers.
     *
     * @throws MdlParseException when the sketch marker is missing
     */
    public static ParseContext of(String text) {
        if (text == null) {
            throw new MdlParseException("Model text is null");
        }
        // keep \r inside lines so that CRLF files round-trip unchanged
        List<String> lines = List.of(text.split("\n", -1));

        int sketchStart = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).contains(SKETCH_MARKER)) {
                sketchStart = i;
                break;
            }
        }
        if (sketchStart < 0) {
            throw new MdlParseException("No sketch section found (missing '" + SKETCH_MARKER
                    + "' marker); connection topology cannot be resolved from equations alone");
        }

        int footerStart = lines.size();
        for (int i = sketchStart + 1; i < lines.size(); i++) {
            if (lines.get(i).contains(FOOTER_MARKER)) {
                footerStart = i;
                break;
            }
        }
        return new ParseContext(lines, sketchStart, footerStart);
    }

    public List<String> lines() {
        return lines;
    }

    public String line(int index) {
        return lines.get(index);
    }

    /** Index of the sketch marker line. */
    public int sketchStart() {
        return sketchStart;
    }

    /** Index of the footer marker line, or the line count when the footer is missing. */
    public int footerStart() {
        return footerStart;
    }

    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}
