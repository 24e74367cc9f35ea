package org.pysymphony.compiler.frontend.semantics;

/**
 * What an import alias symbol was bound from.
 *
 * @param module       The dotted module named by the statement ({@code a.b} in {@code import a.b}
 *                     or {@code from .a.b import c}); may be empty for {@code from . import c}.
 * @param importedName The imported name for {@code from} imports, otherwise null.
 * @param level        The number of leading dots of a relative import.
 * @param asName       The explicit alias, or null.
 */
public record ImportBinding(String module, String importedName, int level, String asName) {

    public boolean isFromImport() {
        return importedName != null;
    }

    public boolean isRelative() {
        return level > 0;
    }

    /**
     * Renders the import statement that binds this alias under {@code boundName}.
     */
    public String render(String boundName) {
        if (isFromImport()) {
            String source = ".".repeat(level) + module;
            String head = "from " + source + " import " + importedName;
            return boundName.equals(importedName) ? head : head + " as " + boundName;
        }
        if (asName == null && boundName.equals(rootName())) {
            return "import " + module;
        }
        if (asName == null) {
            // a plain dotted import binds its root package
            return "import " + rootName() + " as " + boundName;
        }
        return "import " + module + " as " + boundName;
    }

    private String rootName() {
        int dot = module.indexOf('.');
        return dot < 0 ? module : module.substring(0, dot);
    }

    /**
     * @return A key identifying the bound object, independent of the alias it is bound to.
     */
    public String targetKey() {
        String source = ".".repeat(level) + module;
        if (isFromImport()) {
            return source + ":" + importedName;
        }
        return asName == null ? rootName() : source;
    }
}
