package org.pysymphony.compiler.backend;

import org.pysymphony.compiler.frontend.semantics.ImportBinding;
import org.pysymphony.compiler.frontend.semantics.Symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One distinct import of a module outside the project, shared by every selected alias that
 * was bound by the same import form.
 */
public final class ExternalImport {

    private final ImportBinding binding;
    private final String boundName;
    private final List<Symbol> aliases = new ArrayList<>();

    ExternalImport(ImportBinding binding, String boundName) {
        this.binding = binding;
        this.boundName = boundName;
    }

    /**
     * @return The statement as written in its first module; identical imports share a key.
     */
    public static String keyOf(Symbol alias) {
        return alias.importBinding().render(alias.name());
    }

    public ImportBinding binding() {
        return binding;
    }

    /**
     * @return The name the import binds in the original sources.
     */
    public String boundName() {
        return boundName;
    }

    public List<Symbol> aliases() {
        return Collections.unmodifiableList(aliases);
    }

    public String emittedName() {
        return aliases.get(0).emittedName();
    }

    /**
     * @return The import statement as emitted, bound to {@link #emittedName()}.
     */
    public String render() {
        return binding.render(emittedName());
    }

    void addAlias(Symbol alias) {
        aliases.add(alias);
    }

    @Override
    public String toString() {
        return render();
    }
}
