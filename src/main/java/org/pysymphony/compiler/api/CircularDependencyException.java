package org.pysymphony.compiler.api;

import org.pysymphony.compiler.diagnostics.ErrorKind;

import java.util.List;

/**
 * Thrown when the selected definitions cannot be ordered because they depend on each other.
 */
public class CircularDependencyException extends CompilationException {

    private final List<String> cycle;

    /**
     * @param cycle The participating symbols in dependency order; the first symbol is
     *              repeated at the end to close the cycle.
     */
    public CircularDependencyException(List<String> cycle) {
        super(ErrorKind.CIRCULAR_DEPENDENCY, String.join(" -> ", cycle), null, List.of());
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
