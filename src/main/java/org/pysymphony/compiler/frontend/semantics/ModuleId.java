package org.pysymphony.compiler.frontend.semantics;

/**
 * Identifies a module by its path relative to the project root, using forward slashes,
 * e.g. {@code test_pkg/module1.py}.
 *
 * @param path The normalized relative path.
 */
public record ModuleId(String path) {

    /**
     * Derives the dotted module name: {@code a/b.py} becomes {@code a.b},
     * {@code a/__init__.py} becomes {@code a}.
     * @return The dotted name.
     */
    public String dottedName() {
        String withoutExtension = path.endsWith(".py") ? path.substring(0, path.length() - 3) : path;
        if (withoutExtension.endsWith("/__init__")) {
            withoutExtension = withoutExtension.substring(0, withoutExtension.length() - "/__init__".length());
        }
        return withoutExtension.replace('/', '.');
    }

    /**
     * @return true if this module is a package's {@code __init__.py}.
     */
    public boolean isPackage() {
        return path.equals("__init__.py") || path.endsWith("/__init__.py");
    }

    @Override
    public String toString() {
        return path;
    }
}
