package io.github.jbellis.refactor.analyzer;

import java.util.List;

/**
 * Outcome of resolving a user-supplied name.
 */
public sealed interface Resolution {
    String name();

    record Resolved(String name, Symbol symbol) implements Resolution {
    }

    /**
     * @param candidates qualified names of every match, shortest path first
     */
    record Ambiguous(String name, List<String> candidates) implements Resolution {
        public Ambiguous {
            candidates = List.copyOf(candidates);
        }
    }

    /**
     * @param suggestions qualified names of similarly named symbols, closest first
     */
    record NotFound(String name, List<String> suggestions) implements Resolution {
        public NotFound {
            suggestions = List.copyOf(suggestions);
        }
    }
}
