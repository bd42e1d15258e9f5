package org.sdmodel.mdl;

import java.util.ArrayList;
import java.util.List;

/**
 * Regenerates model-description text from an {@link MdlModel}.
 *
 * Emits the equation section (loose lines and blocks in order, then the control
 * block), the sketch header, the records and the footer. Every line that was parsed
 * and not edited comes back unchanged, so rendering an unedited model reproduces its
 * source text exactly.
 */
public final class MdlRenderer {

    private MdlRenderer() {
    }

    public static String render(MdlModel model) {
        return String.join("\n", toLines(model));
    }

    public static List<String> toLines(MdlModel model) {
        List<String> lines = new ArrayList<>(model.equations().toLines());
        lines.addAll(model.sketch().toLines());
        return lines;
    }
}
