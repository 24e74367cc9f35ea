package org.pysymphony.compiler.frontend.semantics;

import java.util.Optional;

/**
 * Connects import aliases of one module to the modules they load. Implemented by the project
 * loader for merges; {@link #external()} treats every import as leaving the project, which is
 * how single files are audited.
 */
public interface ImportLinker {

    /**
     * @param alias An {@link Symbol.Kind#IMPORT_ALIAS} symbol.
     * @return The internal module or symbol the alias is bound to; empty for external imports.
     */
    Optional<LinkTarget> link(Symbol alias);

    /**
     * Looks up an attribute of a linked module.
     * @param module A module target.
     * @param attribute The attribute name.
     * @return The module-level symbol or submodule; empty if the module does not define it.
     */
    Optional<LinkTarget> member(LinkTarget module, String attribute);

    static ImportLinker external() {
        return new ImportLinker() {
            @Override
            public Optional<LinkTarget> link(Symbol alias) {
                return Optional.empty();
            }

            @Override
            public Optional<LinkTarget> member(LinkTarget module, String attribute) {
                return Optional.empty();
            }
        };
    }
}
