package org.sdmodel.mdl;

import org.sdmodel.mdl.SketchRecord.CloudRecord;
import org.sdmodel.mdl.SketchRecord.ConnectionRecord;
import org.sdmodel.mdl.SketchRecord.Identified;
import org.sdmodel.mdl.SketchRecord.RawLine;
import org.sdmodel.mdl.SketchRecord.ValveRecord;
import org.sdmodel.mdl.SketchRecord.VariableRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the sketch section: the header prologue up to the first record line, the
 * records dispatched by their leading type code, and the footer from the closing marker.
 *
 * <pre>
 * 10,1,Population,412,232,40,20,3,3,0,0,0,0,0,0        variable
 * 11,5,48,295,234,6,8,34,3,0,0,1,0,0,0                  valve
 * 12,2,48,199,234,10,8,0,3,0,0,-1,0,0,0                 cloud
 * 1,3,5,1,4,0,0,22,0,0,0,-1--1--1,,1|(349,234)|         connection (from 5 to 1)
 * </pre>
 */
public final class SketchSectionReader {

    private static final Logger LOG = LoggerFactory.getLogger(SketchSectionReader.class);

    private static final int MIN_VARIABLE_FIELDS = 7;
    private static final int MIN_VALVE_FIELDS = 5;
    private static final int MIN_CLOUD_FIELDS = 5;
    private static final int MIN_CONNECTION_FIELDS = 4;

    private static final String DEFAULT_DISCRIMINATOR = "0";

    private SketchSectionReader() {
    }

    public static SketchSection read(ParseContext ctx) {
        int start = ctx.sketchStart();
        int end = ctx.footerStart();

        int firstRecord = end;
        for (int i = start + 1; i < end; i++) {
            if (isRecordType(typeCode(ctx.line(i)))) {
                firstRecord = i;
                break;
            }
        }

        List<String> header = new ArrayList<>(ctx.lines().subList(start, firstRecord));
        List<SketchRecord> records = new ArrayList<>();
        Map<Integer, Integer> idLines = new HashMap<>();

        for (int i = firstRecord; i < end; i++) {
            SketchRecord record = readRecord(ctx.line(i), i + 1, ctx);
            if (record instanceof Identified identified) {
                Integer previous = idLines.putIfAbsent(identified.id(), i + 1);
                if (previous != null) {
                    ctx.report(Diagnostic.consistency(i + 1,
                            "Duplicate id " + identified.id() + " (first used at line " + previous + ")"));
                }
            }
            records.add(record);
        }

        List<String> footer = new ArrayList<>(ctx.lines().subList(end, ctx.lines().size()));
        LOG.debug("Read sketch: {} header lines, {} records, {} footer lines",
                header.size(), records.size(), footer.size());
        return new SketchSection(header, records, footer);
    }

    /**
     * Decode one line into a record. Lines that are not records, or whose fields
     * cannot be decoded, come back as {@link RawLine}.
     */
    static SketchRecord readRecord(String line, int lineNumber, ParseContext ctx) {
        int type = typeCode(line);
        if (!isRecordType(type)) {
            return new RawLine(line, lineNumber);
        }

        List<String> fields = FieldSplitter.split(line);
        try {
            return switch (type) {
                case SketchRecord.TYPE_VARIABLE -> readVariable(fields, line, lineNumber, ctx);
                case SketchRecord.TYPE_VALVE -> readValve(fields, line, lineNumber, ctx);
                case SketchRecord.TYPE_CLOUD -> readCloud(fields, line, lineNumber, ctx);
                default -> readConnection(fields, line, lineNumber, ctx);
            };
        } catch (NumberFormatException e) {
            ctx.report(Diagnostic.malformed(lineNumber, "Non-integer field in record: " + e.getMessage()));
            LOG.warn("Skipping malformed sketch record at line {}: {}", lineNumber, line);
            return new RawLine(line, lineNumber);
        }
    }

    private static SketchRecord readVariable(List<String> f, String line, int lineNumber, ParseContext ctx) {
        if (!hasFields(f, MIN_VARIABLE_FIELDS, "variable", line, lineNumber, ctx)) {
            return new RawLine(line, lineNumber);
        }
        int shape = f.size() > 7 ? parseIntOr(f.get(7), -1) : -1;
        return new VariableRecord(
                parseInt(f.get(1)),
                f.get(2),
                new Position(parseInt(f.get(3)), parseInt(f.get(4))),
                new Size(parseInt(f.get(5)), parseInt(f.get(6))),
                shape,
                line,
                lineNumber);
    }

    private static SketchRecord readValve(List<String> f, String line, int lineNumber, ParseContext ctx) {
        if (!hasFields(f, MIN_VALVE_FIELDS, "valve", line, lineNumber, ctx)) {
            return new RawLine(line, lineNumber);
        }
        return new ValveRecord(parseInt(f.get(1)), new Position(parseInt(f.get(3)), parseInt(f.get(4))),
                line, lineNumber);
    }

    private static SketchRecord readCloud(List<String> f, String line, int lineNumber, ParseContext ctx) {
        if (!hasFields(f, MIN_CLOUD_FIELDS, "cloud", line, lineNumber, ctx)) {
            return new RawLine(line, lineNumber);
        }
        return new CloudRecord(parseInt(f.get(1)), parseIntOr(f.get(2), -1),
                new Position(parseInt(f.get(3)), parseInt(f.get(4))), line, lineNumber);
    }

    private static SketchRecord readConnection(List<String> f, String line, int lineNumber, ParseContext ctx) {
        if (!hasFields(f, MIN_CONNECTION_FIELDS, "connection", line, lineNumber, ctx)) {
            return new RawLine(line, lineNumber);
        }
        String discriminator = f.size() > ConnectionRecord.FIELD_POLARITY
                ? f.get(ConnectionRecord.FIELD_POLARITY).strip()
                : DEFAULT_DISCRIMINATOR;
        return new ConnectionRecord(parseInt(f.get(1)), parseInt(f.get(2)), parseInt(f.get(3)),
                discriminator, line, lineNumber);
    }

    // ==================== Helpers ====================

    private static boolean hasFields(List<String> fields, int min, String kind, String line, int lineNumber,
                                     ParseContext ctx) {
        if (fields.size() >= min) {
            return true;
        }
        ctx.report(Diagnostic.malformed(lineNumber,
                "Too few fields for " + kind + " record (" + fields.size() + " < " + min + ")"));
        LOG.warn("Skipping malformed {} record at line {}: {}", kind, lineNumber, line);
        return false;
    }

    /**
     * Leading integer type code of a line, or -1 when the line does not start with one.
     */
    static int typeCode(String line) {
        int comma = line.indexOf(',');
        if (comma <= 0) {
            return -1;
        }
        return parseIntOr(line.substring(0, comma), -1);
    }

    private static boolean isRecordType(int type) {
        return type == SketchRecord.TYPE_VARIABLE || type == SketchRecord.TYPE_VALVE
                || type == SketchRecord.TYPE_CLOUD || type == SketchRecord.TYPE_CONNECTION;
    }

    private static int parseInt(String field) {
        return Integer.parseInt(field.strip());
    }

    private static int parseIntOr(String field, int fallback) {
        try {
            return Integer.parseInt(field.strip());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
