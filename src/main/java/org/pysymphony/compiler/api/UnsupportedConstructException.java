package org.pysymphony.compiler.api;

import org.pysymphony.compiler.diagnostics.ErrorKind;

import java.util.List;

/**
 * Thrown for constructs whose effect cannot be determined statically, such as
 * wildcard imports and dynamic imports.
 */
public class UnsupportedConstructException extends CompilationException {

    public UnsupportedConstructException(String message, String fileName, int line) {
        super(ErrorKind.UNSUPPORTED_CONSTRUCT, message, fileName, List.of(line));
    }
}
