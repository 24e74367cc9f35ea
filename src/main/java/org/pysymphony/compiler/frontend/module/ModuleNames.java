package org.pysymphony.compiler.frontend.module;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Dotted module name arithmetic for absolute and relative imports.
 */
public final class ModuleNames {

    private ModuleNames() {
    }

    /**
     * Computes the absolute module named by an import.
     * @param packageName The importer's package ({@link ModuleDescriptor#packageName()}).
     * @param level       Leading dots; 0 for absolute imports.
     * @param module      The module part as written, possibly empty.
     * @return The absolute dotted name, or empty if a relative import climbs above the root.
     */
    public static Optional<String> absolute(String packageName, int level, String module) {
        if (level == 0) {
            return Optional.of(module);
        }
        List<String> parts = new ArrayList<>();
        if (!packageName.isEmpty()) {
            parts.addAll(Arrays.asList(packageName.split("\\.")));
        }
        for (int i = 1; i < level; i++) {
            if (parts.isEmpty()) {
                return Optional.empty();
            }
            parts.remove(parts.size() - 1);
        }
        if (module != null && !module.isEmpty()) {
            parts.add(module);
        }
        return Optional.of(String.join(".", parts));
    }

    /**
     * @return {@code a}, {@code a.b}, {@code a.b.c} for {@code a.b.c}.
     */
    public static List<String> prefixes(String dottedName) {
        List<String> prefixes = new ArrayList<>();
        int dot = dottedName.indexOf('.');
        while (dot >= 0) {
            prefixes.add(dottedName.substring(0, dot));
            dot = dottedName.indexOf('.', dot + 1);
        }
        prefixes.add(dottedName);
        return prefixes;
    }

    public static String child(String parent, String name) {
        return parent.isEmpty() ? name : parent + "." + name;
    }
}
