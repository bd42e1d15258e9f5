package org.sdmodel.mdl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A parsed model description: the equation section, the sketch section and the
 * diagnostics collected while reading them.
 *
 * The sections are mutable so that the surgical editor can change them in place;
 * each parse produces an independent instance and nothing is shared between them.
 */
public final class MdlModel {

    private final EquationSection equations;
    private final SketchSection sketch;
    private final List<Diagnostic> diagnostics;

    public MdlModel(EquationSection equations, SketchSection sketch, List<Diagnostic> diagnostics) {
        this.equations = equations;
        this.sketch = sketch;
        this.diagnostics = new ArrayList<>(diagnostics);
    }

    public EquationSection equations() {
        return equations;
    }

    public SketchSection sketch() {
        return sketch;
    }

    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Next free id in the shared id space (current maximum + 1).
     */
    public int nextId() {
        return sketch.maxId() + 1;
    }
}
