package org.pysymphony.compiler.backend;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Replaces {@code [start, end)} of a source text.
 */
public record TextEdit(int start, int end, String replacement) {

    /**
     * Applies edits to a slice of {@code source}. Edits are applied in position order; an edit
     * that overlaps an earlier one is dropped. At equal starts the longer edit goes first, so a
     * chain edit wins over the name edit of its head.
     * @param source The full text.
     * @param from   Start of the slice.
     * @param to     End of the slice.
     * @param edits  Edits inside the slice.
     * @return The edited slice.
     */
    public static String apply(String source, int from, int to, List<TextEdit> edits) {
        List<TextEdit> sorted = new ArrayList<>(edits);
        sorted.sort(Comparator.comparingInt(TextEdit::start).thenComparing(edit -> -edit.end()));
        StringBuilder out = new StringBuilder(to - from);
        int position = from;
        for (TextEdit edit : sorted) {
            if (edit.start() < position || edit.end() > to) {
                continue;
            }
            out.append(source, position, edit.start()).append(edit.replacement());
            position = edit.end();
        }
        out.append(source, position, to);
        return out.toString();
    }
}
