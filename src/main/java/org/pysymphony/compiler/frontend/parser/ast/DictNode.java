package org.pysymphony.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A dict display. A key of -1 marks a {@code **mapping} entry.
 */
public record DictNode(Span span, List<Integer> keys, List<Integer> values) implements Node {

    public DictNode {
        keys = Collections.unmodifiableList(new ArrayList<>(keys));
        values = List.copyOf(values);
    }

    @Override
    public List<Integer> children() {
        List<Integer> result = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            if (keys.get(i) >= 0) {
                result.add(keys.get(i));
            }
            result.add(values.get(i));
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public <R> R accept(int index, NodeVisitor<R> visitor) {
        return visitor.visitDict(index, this);
    }
}
