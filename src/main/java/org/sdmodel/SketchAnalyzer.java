package org.sdmodel;

import org.sdmodel.edit.ChangeLogEntry;
import org.sdmodel.edit.EditOperation;
import org.sdmodel.edit.EditResult;
import org.sdmodel.edit.SurgicalEditor;
import org.sdmodel.graph.LoopEnumerator;
import org.sdmodel.graph.LoopSearchResult;
import org.sdmodel.graph.SignedGraph;
import org.sdmodel.mdl.EquationBlock;
import org.sdmodel.mdl.MdlModel;
import org.sdmodel.mdl.MdlParseException;
import org.sdmodel.mdl.MdlParser;
import org.sdmodel.mdl.MdlRenderer;
import org.sdmodel.mdl.SketchRecord;
import org.sdmodel.topology.TopologyResolver;
import org.sdmodel.topology.TypedModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point tying the pipeline together: parse, classify, build the signed graph,
 * enumerate loops, edit and render.
 *
 * <pre>
 * SketchAnalyzer analyzer = new SketchAnalyzer(AnalysisOptions.fromEnvironment());
 * TypedModel typed = analyzer.classifyTopology(analyzer.parse(text));
 * LoopSearchResult loops = analyzer.findLoops(typed);
 * </pre>
 *
 * Holds no state besides its options; every call works on the values it is given.
 */
public final class SketchAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(SketchAnalyzer.class);

    private final AnalysisOptions options;

    public SketchAnalyzer() {
        this(AnalysisOptions.defaults());
    }

    public SketchAnalyzer(AnalysisOptions options) {
        this.options = options;
    }

    public AnalysisOptions options() {
        return options;
    }

    // ==================== Pipeline ====================

    /**
     * @throws MdlParseException when the text has no sketch section
     */
    public MdlModel parse(String text) {
        return MdlParser.parse(text);
    }

    public TypedModel classifyTopology(MdlModel model) {
        return new TopologyResolver(options.polarity()).classify(model);
    }

    public SignedGraph buildGraph(TypedModel model) {
        return SignedGraph.of(model);
    }

    public LoopSearchResult findLoops(TypedModel model) {
        return LoopEnumerator.findLoops(buildGraph(model), options.limits());
    }

    /**
     * Apply the operations to the model in place and classify the result.
     */
    public EditResult applyEdits(MdlModel model, List<? extends EditOperation> operations) {
        SurgicalEditor editor = new SurgicalEditor(model, options.polarity());
        List<ChangeLogEntry> changes = editor.apply(operations);
        return new EditResult(classifyTopology(model), changes);
    }

    public String render(MdlModel model) {
        return MdlRenderer.render(model);
    }

    // ==================== Self-check ====================

    /**
     * Outcome of re-parsing rendered text.
     */
    public record SelfCheck(boolean passed, List<String> problems) {

        public SelfCheck {
            problems = List.copyOf(problems);
        }
    }

    /**
     * Render the model, parse the output again and compare the two structures: sketch
     * records, equation blocks and the re-rendered text must all agree.
     */
    public SelfCheck selfCheck(MdlModel model) {
        String rendered = render(model);
        List<String> problems = new ArrayList<>();

        MdlModel reparsed;
        try {
            reparsed = parse(rendered);
        } catch (MdlParseException e) {
            return new SelfCheck(false, List.of("Rendered text does not parse: " + e.getMessage()));
        }

        List<String> expectedRecords = recordLines(model);
        List<String> actualRecords = recordLines(reparsed);
        if (!expectedRecords.equals(actualRecords)) {
            problems.add("Sketch records differ after re-parse (" + expectedRecords.size() + " vs "
                    + actualRecords.size() + ")");
        }
        if (model.sketch().variables().size() != reparsed.sketch().variables().size()) {
            problems.add("Variable record count changed: " + model.sketch().variables().size() + " -> "
                    + reparsed.sketch().variables().size());
        }
        if (model.sketch().connections().size() != reparsed.sketch().connections().size()) {
            problems.add("Connection record count changed: " + model.sketch().connections().size() + " -> "
                    + reparsed.sketch().connections().size());
        }

        List<String> expectedBlocks = blockNames(model);
        List<String> actualBlocks = blockNames(reparsed);
        if (!expectedBlocks.equals(actualBlocks)) {
            problems.add("Equation blocks differ after re-parse: " + expectedBlocks + " vs " + actualBlocks);
        }
        if (!rendered.equals(render(reparsed))) {
            problems.add("Rendering is not stable across a re-parse");
        }

        if (!problems.isEmpty()) {
            LOG.warn("Self-check failed: {}", problems);
        }
        return new SelfCheck(problems.isEmpty(), problems);
    }

    private static List<String> recordLines(MdlModel model) {
        List<String> lines = new ArrayList<>();
        for (SketchRecord record : model.sketch().records()) {
            lines.add(record.getClass().getSimpleName() + ":" + record.rawLine());
        }
        return lines;
    }

    private static List<String> blockNames(MdlModel model) {
        List<String> names = new ArrayList<>();
        for (EquationBlock block : model.equations().blocks()) {
            names.add(block.name());
        }
        return names;
    }
}
