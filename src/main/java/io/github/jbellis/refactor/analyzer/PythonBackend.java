package io.github.jbellis.refactor.analyzer;

import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterPython;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

public final class PythonBackend extends TreeSitterBackend {

    private static final TSLanguage PY_LANGUAGE = new TreeSitterPython();

    private static final Pattern IDENTIFIER = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");

    public static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue",
            "def", "del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in",
            "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with", "yield");

    public static final Set<String> BUILTINS = Set.of(
            "abs", "aiter", "all", "anext", "any", "ascii", "bin", "bool", "breakpoint", "bytearray", "bytes",
            "callable", "chr", "classmethod", "compile", "complex", "delattr", "dict", "dir", "divmod",
            "enumerate", "eval", "exec", "filter", "float", "format", "frozenset", "getattr", "globals",
            "hasattr", "hash", "help", "hex", "id", "input", "int", "isinstance", "issubclass", "iter", "len",
            "list", "locals", "map", "max", "memoryview", "min", "next", "object", "oct", "open", "ord", "pow",
            "print", "property", "range", "repr", "reversed", "round", "set", "setattr", "slice", "sorted",
            "staticmethod", "str", "sum", "super", "tuple", "type", "vars", "zip", "__import__",
            "Exception", "BaseException", "ValueError", "TypeError", "KeyError", "IndexError",
            "AttributeError", "RuntimeError", "StopIteration", "NotImplementedError", "NotImplemented",
            "Ellipsis", "__name__", "__file__", "__doc__");

    private static final LanguageSyntaxProfile PY_SYNTAX_PROFILE = new LanguageSyntaxProfile(
            Set.of("function_definition"),
            Set.of("class_definition"),
            "decorated_definition",
            Set.of("lambda"),
            Set.of("list_comprehension", "set_comprehension", "dictionary_comprehension", "generator_expression"),
            Set.of("call", "comparison_operator", "boolean_operator", "binary_operator", "not_operator",
                   "conditional_expression"),
            Set.of("if_statement", "elif_clause", "else_clause", "for_statement", "while_statement",
                   "with_statement", "try_statement", "except_clause", "finally_clause"),
            Set.of("return_statement", "yield", "break_statement", "continue_statement", "global_statement",
                   "nonlocal_statement", "await"),
            "name",
            "body",
            "parameters"
    );

    @Override
    protected TSLanguage getTSLanguage() {
        return PY_LANGUAGE;
    }

    @Override
    protected LanguageSyntaxProfile getLanguageSyntaxProfile() {
        return PY_SYNTAX_PROFILE;
    }

    @Override
    public SymbolTable buildSymbolTable(List<SourceFile> sources, Map<ProjectFile, String> warnings, boolean partial) {
        var walked = sources.parallelStream()
                .map(source -> PythonScopeBuilder.build(source, PY_SYNTAX_PROFILE))
                .toList();
        return PythonReferenceLinker.link(walked, warnings, partial);
    }

    @Override
    public Language language() {
        return Language.PYTHON;
    }

    @Override
    public boolean isValidIdentifier(String name) {
        return IDENTIFIER.matcher(name).matches() && !KEYWORDS.contains(name);
    }

    @Override
    public boolean isReserved(String name) {
        return KEYWORDS.contains(name) || BUILTINS.contains(name);
    }

    /**
     * Dotted module name for a file: {@code pkg/util.py} is {@code pkg.util}, {@code pkg/__init__.py} is {@code pkg}.
     */
    public static String moduleName(ProjectFile file) {
        var rel = file.toString();
        if (rel.endsWith(".py")) {
            rel = rel.substring(0, rel.length() - 3);
        }
        if (rel.equals("__init__")) {
            return "__init__";
        }
        if (rel.endsWith("/__init__")) {
            rel = rel.substring(0, rel.length() - "/__init__".length());
        }
        return rel.replace('/', '.');
    }

    /**
     * The package a module's relative imports resolve against.
     */
    public static String packageName(ProjectFile file) {
        var module = moduleName(file);
        if (file.getFileName().equals("__init__.py")) {
            return module.equals("__init__") ? "" : module;
        }
        int lastDot = module.lastIndexOf('.');
        return lastDot < 0 ? "" : module.substring(0, lastDot);
    }
}
