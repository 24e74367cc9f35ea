package org.pysymphony.compiler.frontend.semantics;

import java.util.Set;

/**
 * Names that resolve without a definition in the merged sources: the interpreter's builtins and
 * the names the runtime injects into module, class and function scopes.
 */
public final class Builtins {

    private static final Set<String> BUILTIN_NAMES = Set.of(
            "abs", "aiter", "all", "anext", "any", "ascii", "bin", "bool", "breakpoint", "bytearray", "bytes",
            "callable", "chr", "classmethod", "compile", "complex", "copyright", "credits", "delattr", "dict",
            "dir", "divmod", "enumerate", "eval", "exec", "exit", "filter", "float", "format", "frozenset",
            "getattr", "globals", "hasattr", "hash", "help", "hex", "id", "input", "int", "isinstance",
            "issubclass", "iter", "len", "license", "list", "locals", "map", "max", "memoryview", "min", "next",
            "object", "oct", "open", "ord", "pow", "print", "property", "quit", "range", "repr", "reversed",
            "round", "set", "setattr", "slice", "sorted", "staticmethod", "str", "sum", "super", "tuple", "type",
            "vars", "zip", "__import__", "__build_class__",
            "None", "True", "False", "Ellipsis", "NotImplemented",
            "BaseException", "BaseExceptionGroup", "Exception", "ExceptionGroup", "ArithmeticError",
            "AssertionError", "AttributeError", "BlockingIOError", "BrokenPipeError", "BufferError",
            "ChildProcessError", "ConnectionAbortedError", "ConnectionError", "ConnectionRefusedError",
            "ConnectionResetError", "EOFError", "EncodingWarning", "EnvironmentError", "FileExistsError",
            "FileNotFoundError", "FloatingPointError", "GeneratorExit", "IOError", "ImportError",
            "IndentationError", "IndexError", "InterruptedError", "IsADirectoryError", "KeyError",
            "KeyboardInterrupt", "LookupError", "MemoryError", "ModuleNotFoundError", "NameError",
            "NotADirectoryError", "NotImplementedError", "OSError", "OverflowError", "PermissionError",
            "ProcessLookupError", "RecursionError", "ReferenceError", "RuntimeError", "StopAsyncIteration",
            "StopIteration", "SyntaxError", "SystemError", "SystemExit", "TabError", "TimeoutError", "TypeError",
            "UnboundLocalError", "UnicodeDecodeError", "UnicodeEncodeError", "UnicodeError",
            "UnicodeTranslateError", "ValueError", "ZeroDivisionError",
            "Warning", "BytesWarning", "DeprecationWarning", "FutureWarning", "ImportWarning",
            "PendingDeprecationWarning", "ResourceWarning", "RuntimeWarning", "SyntaxWarning", "UnicodeWarning",
            "UserWarning");

    private static final Set<String> MODULE_NAMES = Set.of(
            "__name__", "__file__", "__doc__", "__spec__", "__loader__", "__package__", "__builtins__",
            "__path__", "__annotations__", "__debug__", "__cached__", "__dict__");

    private static final Set<String> CLASS_NAMES = Set.of("__module__", "__qualname__");

    private Builtins() {
    }

    public static boolean isBuiltin(String name) {
        return BUILTIN_NAMES.contains(name);
    }

    /**
     * @return true for names every module scope provides implicitly.
     */
    public static boolean isModuleImplicit(String name) {
        return MODULE_NAMES.contains(name);
    }

    public static boolean isClassImplicit(String name) {
        return CLASS_NAMES.contains(name);
    }

    /**
     * @return true for {@code __class__}, which methods may read through the implicit closure.
     */
    public static boolean isFunctionImplicit(String name) {
        return "__class__".equals(name);
    }

    /**
     * @return true for {@code __name__}-style names.
     */
    public static boolean isDunder(String name) {
        return name.length() > 4 && name.startsWith("__") && name.endsWith("__");
    }
}
