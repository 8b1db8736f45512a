package io.github.jbellis.refactor.analyzer;

import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A lexical scope. Populated while a file is walked and read-only afterwards.
 */
public final class Scope {
    private final String id;
    private final ScopeKind kind;
    private final @Nullable Scope parent;
    private final ProjectFile file;
    private final ByteRange range;
    private final List<Scope> children = new ArrayList<>();
    private final Map<String, Binding> bindings = new LinkedHashMap<>();
    private final Set<String> globals = new HashSet<>();
    private final Set<String> nonlocals = new HashSet<>();
    private final List<String> wildcardImports = new ArrayList<>();

    // class scopes
    private final Map<String, Symbol> attributes = new LinkedHashMap<>();
    private final List<TSNode> superclasses = new ArrayList<>();

    // methods
    private @Nullable String selfName;
    private @Nullable Scope ownerClass;

    // named scopes: ids of the lambdas and comprehensions they own, keyed by node
    private final Map<String, String> anonymousIds = new HashMap<>();

    Scope(String id, ScopeKind kind, @Nullable Scope parent, ProjectFile file, ByteRange range) {
        this.id = id;
        this.kind = kind;
        this.parent = parent;
        this.file = file;
        this.range = range;
        if (parent != null) {
            parent.children.add(this);
        }
    }

    public String id() {
        return id;
    }

    public ScopeKind kind() {
        return kind;
    }

    public @Nullable Scope parent() {
        return parent;
    }

    public ProjectFile file() {
        return file;
    }

    /**
     * Bytes of the construct that opens the scope; the whole file for a module.
     */
    public ByteRange range() {
        return range;
    }

    public List<Scope> children() {
        return children;
    }

    public Map<String, Binding> bindings() {
        return bindings;
    }

    public @Nullable Binding binding(String name) {
        return bindings.get(name);
    }

    public Set<String> globals() {
        return globals;
    }

    public Set<String> nonlocals() {
        return nonlocals;
    }

    public List<String> wildcardImports() {
        return wildcardImports;
    }

    public Map<String, Symbol> attributes() {
        return attributes;
    }

    public List<TSNode> superclasses() {
        return superclasses;
    }

    public @Nullable String selfName() {
        return selfName;
    }

    public @Nullable Scope ownerClass() {
        return ownerClass;
    }

    void setSelf(String selfName, Scope ownerClass) {
        this.selfName = selfName;
        this.ownerClass = ownerClass;
    }

    Map<String, String> anonymousIds() {
        return anonymousIds;
    }

    /**
     * Module, class or function: the scopes that carry a name of their own.
     */
    public boolean isNamed() {
        return kind == ScopeKind.MODULE || kind == ScopeKind.CLASS || kind == ScopeKind.FUNCTION;
    }

    public Scope namedScope() {
        var current = this;
        while (!current.isNamed()) {
            current = current.parent;
            assert current != null : "anonymous scope without a named ancestor";
        }
        return current;
    }

    public Scope module() {
        var current = this;
        while (current.parent != null) {
            current = current.parent;
        }
        return current;
    }

    /**
     * True if {@code other} is this scope or one of its ancestors.
     */
    public boolean isWithin(Scope other) {
        for (var current = this; current != null; current = current.parent) {
            if (current == other) {
                return true;
            }
        }
        return false;
    }

    /**
     * Qualified names from the module down to this scope.
     */
    public List<String> chain() {
        var result = new ArrayList<String>();
        for (var current = this; current != null; current = current.parent) {
            result.add(0, current.id);
        }
        return result;
    }

    @Override
    public String toString() {
        return "Scope[" + kind + " " + id + "]";
    }
}
