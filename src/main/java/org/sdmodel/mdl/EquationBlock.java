package org.sdmodel.mdl;

import java.util.ArrayList;
import java.util.List;

/**
 * One variable definition of the equation section.
 *
 * <pre>
 * Births = A FUNCTION OF( Population, "Birth Rate")     equation lines (may continue)
 * 	~	people/Month                                       units line
 * 	~	Newborns per month.                                documentation lines,
 * 	|                                                     ending with the terminator
 * </pre>
 *
 * @param name             Variable name, unquoted
 * @param equationLines    Raw equation lines including continuations
 * @param unitsLine        Raw units line, or null when the block has none
 * @param docLines         Raw documentation lines; the last one ends with {@code |}
 * @param trailingLines    Blank lines that follow the block
 * @param declarationOrder Position among the blocks of the file, starting at 0
 * @param lineNumber       1-based line of the first equation line, -1 when synthesized
 */
public record EquationBlock(
        String name,
        List<String> equationLines,
        String unitsLine,
        List<String> docLines,
        List<String> trailingLines,
        int declarationOrder,
        int lineNumber) {

    public static final char TERMINATOR = '|';

    public EquationBlock {
        equationLines = List.copyOf(equationLines);
        docLines = List.copyOf(docLines);
        trailingLines = List.copyOf(trailingLines);
    }

    /**
     * Build a block for a variable that did not exist in the source text.
     */
    public static EquationBlock synthesize(String name, String equation, String units, String description,
                                           int declarationOrder) {
        String body = equation == null || equation.isBlank() ? "A FUNCTION OF( )" : equation;
        String head = FieldSplitter.quoteIfNeeded(name) + "  = " + body;
        List<String> equationLines = List.of(head.split("\n", -1));
        String unitsLine = "\t~\t" + (units == null ? "" : units);
        List<String> docLines = description == null || description.isBlank()
                ? List.of("\t~\t\t|")
                : List.of("\t~\t" + description, "\t|");
        return new EquationBlock(name, equationLines, unitsLine, docLines, List.of(""), declarationOrder, -1);
    }

    /**
     * The equation text, physical lines joined with newlines.
     */
    public String equationText() {
        return String.join("\n", equationLines);
    }

    /**
     * The right-hand side of the equation, continuation markers kept.
     */
    public String rightHandSide() {
        String text = equationText();
        int eq = FieldSplitter.indexOfUnquoted(text, '=');
        return eq < 0 ? text : text.substring(eq + 1).strip();
    }

    public boolean isTerminated() {
        String last;
        if (!docLines.isEmpty()) {
            last = docLines.get(docLines.size() - 1);
        } else if (unitsLine != null) {
            last = unitsLine;
        } else {
            last = equationLines.get(equationLines.size() - 1);
        }
        return last.stripTrailing().endsWith(String.valueOf(TERMINATOR));
    }

    /**
     * Copy with the right-hand side replaced; the name as written and all other lines are kept.
     */
    public EquationBlock withRightHandSide(String equation) {
        String first = equationLines.get(0);
        int eq = FieldSplitter.indexOfUnquoted(first, '=');
        String lhs = eq < 0 ? FieldSplitter.quoteIfNeeded(name) + "  " : first.substring(0, eq);
        String head = lhs + "= " + equation;
        return new EquationBlock(name, List.of(head.split("\n", -1)), unitsLine, docLines, trailingLines,
                declarationOrder, lineNumber);
    }

    /**
     * All physical lines of the block in source order.
     */
    public List<String> toLines() {
        List<String> lines = new ArrayList<>(equationLines);
        if (unitsLine != null) {
            lines.add(unitsLine);
        }
        lines.addAll(docLines);
        lines.addAll(trailingLines);
        return lines;
    }
}
