package org.sdmodel.mdl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses model-description text into an {@link MdlModel}.
 *
 * Runs the equation and sketch readers over one {@link ParseContext}. Only a missing
 * sketch marker is fatal; everything else is reported through the model's diagnostics.
 */
public final class MdlParser {

    private static final Logger LOG = LoggerFactory.getLogger(MdlParser.class);

    private MdlParser() {
    }

    /**
     * @throws MdlParseException when the text has no sketch section
     */
    public static MdlModel parse(String text) {
        ParseContext ctx = ParseContext.of(text);
        EquationSection equations = EquationSectionReader.read(ctx);
        SketchSection sketch = SketchSectionReader.read(ctx);

        for (Diagnostic d : ctx.diagnostics()) {
            LOG.warn("{}", d);
        }
        LOG.debug("Parsed {} lines: {} equation blocks, {} sketch records, {} diagnostics",
                ctx.lines().size(), equations.blocks().size(), sketch.records().size(), ctx.diagnostics().size());
        return new MdlModel(equations, sketch, ctx.diagnostics());
    }
}
