package org.sdmodel;

import org.sdmodel.mdl.ParseContext;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Model texts shared by the tests: the fixtures under {@code /models} and small
 * diagrams assembled from individual records.
 */
public final class ModelFixtures {

    /** Stock-and-flow model: one stock, two flows, two auxiliaries, no causal loops. */
    public static final String POPULATION = "population.mdl";
    /** Causal loop diagram with three loops, a shadow variable and a comment box. */
    public static final String WORKFORCE = "workforce.mdl";

    private ModelFixtures() {
    }

    public static String load(String name) {
        try (InputStream in = ModelFixtures.class.getResourceAsStream("/models/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("No fixture " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    // ── Assembled models ──

    /**
     * A complete model text from equation blocks and sketch record lines.
     */
    public static String model(String equations, String... records) {
        StringBuilder sb = new StringBuilder("{UTF-8}\n");
        sb.append(equations);
        sb.append(ParseContext.SKETCH_MARKER).append(" Sketch information - do not modify anything except names\n");
        sb.append("V300  Do not put anything below this section - it will be ignored\n");
        sb.append("*View 1\n");
        sb.append("$192-192-192,0,Times New Roman|12||0-0-0|0-0-0|0-0-255|-1--1--1|-1--1--1|96,96,100,0\n");
        for (String record : records) {
            sb.append(record).append('\n');
        }
        sb.append(ParseContext.FOOTER_MARKER).append('\n');
        sb.append(":L<%^E!@\n");
        return sb.toString();
    }

    public static String sketchOnly(String... records) {
        return model("", records);
    }

    public static String equation(String name, String rightHandSide) {
        return name + "=\n\t" + rightHandSide + "\n\t~\t\n\t~\t\t|\n\n";
    }

    public static String variable(int id, String name) {
        return "10," + id + "," + name + ",100,100,40,20,8,3,0,0,-1,0,0,0";
    }

    public static String valve(int id) {
        return "11," + id + ",48,200,100,6,8,34,3,0,0,1,0,0,0";
    }

    public static String valveLabel(int id, String name) {
        return "10," + id + "," + name + ",200,120,28,11,40,3,0,0,-1,0,0,0";
    }

    public static String cloud(int id) {
        return "12," + id + ",48,50,100,10,8,0,3,0,0,-1,0,0,0";
    }

    public static String arrow(int id, int from, int to, String marker) {
        return "1," + id + "," + from + "," + to + ",0,0," + marker + ",0,0,64,0,-1--1--1,,1|(0,0)|";
    }

    public static String pipe(int id, int from, int to) {
        return "1," + id + "," + from + "," + to + ",4,0,0,22,0,0,0,-1--1--1,,1|(0,0)|";
    }
}
