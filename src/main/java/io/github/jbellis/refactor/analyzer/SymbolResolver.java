package io.github.jbellis.refactor.analyzer;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Splitter;
import org.apache.commons.text.similarity.LevenshteinDistance;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Name lookups against a {@link SymbolTable}.
 */
public final class SymbolResolver {
    private static final Logger logger = LogManager.getLogger(SymbolResolver.class);

    private static final Splitter DOT = Splitter.on('.');

    /** Qualified names with fewer segments first, then shorter, then alphabetical. */
    static final Comparator<String> BY_PATH_LENGTH = Comparator
            .comparingInt((String qn) -> DOT.splitToList(qn).size())
            .thenComparingInt(String::length)
            .thenComparing(Comparator.naturalOrder());

    private final SymbolTable table;
    private final int suggestionLimit;
    private final LevenshteinDistance distance;

    /**
     * @param totalCount number of matches before the limit was applied
     * @param partial    the underlying scan was incomplete
     */
    public record FindOutcome(List<FindMatch> matches, int totalCount, boolean partial) {
    }

    public SymbolResolver(SymbolTable table, int suggestionLimit, int suggestionDistance) {
        this.table = table;
        this.suggestionLimit = suggestionLimit;
        this.distance = new LevenshteinDistance(suggestionDistance);
    }

    public SymbolTable table() {
        return table;
    }

    /**
     * Resolves a bare or dotted name. An exact qualified name wins; otherwise a dotted name matches every
     * qualified name ending in it ({@code auth.login} matches {@code app.auth.login}) and a bare name matches
     * every symbol with that name.
     */
    public Resolution resolve(String name) {
        var trimmed = name.strip();
        if (trimmed.isEmpty()) {
            return new Resolution.NotFound(name, List.of());
        }
        var exact = table.symbol(trimmed);
        if (exact.isPresent()) {
            return new Resolution.Resolved(trimmed, exact.get());
        }

        Predicate<Symbol> matches;
        if (trimmed.contains(".")) {
            var suffix = "." + trimmed;
            matches = s -> s.qualifiedName().endsWith(suffix);
        } else {
            matches = s -> s.name().equals(trimmed);
        }
        var candidates = table.symbols().stream()
                .filter(matches)
                .sorted(Comparator.comparing(Symbol::qualifiedName, BY_PATH_LENGTH))
                .toList();

        if (candidates.size() == 1) {
            return new Resolution.Resolved(trimmed, candidates.get(0));
        }
        if (candidates.size() > 1) {
            logger.debug("{} is ambiguous: {} candidates", trimmed, candidates.size());
            return new Resolution.Ambiguous(trimmed, candidates.stream().map(Symbol::qualifiedName).toList());
        }
        return new Resolution.NotFound(trimmed, suggestions(trimmed));
    }

    /**
     * Qualified names of symbols whose bare name is within the configured edit distance of the bare part
     * of {@code name}, closest first.
     */
    public List<String> suggestions(String name) {
        var parts = DOT.splitToList(name);
        var bare = parts.get(parts.size() - 1).toLowerCase(Locale.ROOT);
        record Candidate(String qualifiedName, int distance) {
        }
        var scored = new ArrayList<Candidate>();
        for (var symbol : table.symbols()) {
            int d = distance.apply(bare, symbol.name().toLowerCase(Locale.ROOT));
            if (d >= 0) {
                scored.add(new Candidate(symbol.qualifiedName(), d));
            }
        }
        return scored.stream()
                .sorted(Comparator.comparingInt(Candidate::distance)
                                .thenComparing(Candidate::qualifiedName, BY_PATH_LENGTH))
                .limit(suggestionLimit)
                .map(Candidate::qualifiedName)
                .toList();
    }

    /**
     * Case-insensitive search. {@code *} and {@code ?} are glob wildcards; a pattern without them matches
     * as a substring. A pattern containing a dot is matched against qualified names, otherwise against
     * bare names. Definitions come first, then imported names, each alphabetical by qualified name.
     */
    public FindOutcome find(String pattern, int limit) {
        var trimmed = pattern.strip();
        boolean qualified = trimmed.contains(".");
        var matcher = matcher(trimmed);

        var definitions = table.symbols().stream()
                .filter(s -> matcher.test(qualified ? s.qualifiedName() : s.name()))
                .sorted(Comparator.comparing(Symbol::qualifiedName))
                .map(FindMatch::of)
                .toList();

        var imports = new LinkedHashMap<String, FindMatch>();
        table.importedNames().stream()
                .filter(i -> matcher.test(qualified ? i.qualifiedName() : i.name()))
                .sorted(Comparator.comparing(ImportedName::qualifiedName).thenComparing(ImportedName::location))
                .forEach(i -> imports.putIfAbsent(i.qualifiedName() + "@" + i.location(), FindMatch.of(i)));

        var all = new ArrayList<FindMatch>(definitions);
        all.addAll(imports.values());
        int total = all.size();
        var capped = all.size() > limit ? List.copyOf(all.subList(0, limit)) : List.copyOf(all);
        return new FindOutcome(capped, total, table.partial());
    }

    @VisibleForTesting
    static Predicate<String> matcher(String pattern) {
        var lower = pattern.toLowerCase(Locale.ROOT);
        if (lower.indexOf('*') < 0 && lower.indexOf('?') < 0) {
            return s -> s.toLowerCase(Locale.ROOT).contains(lower);
        }
        var regex = new StringBuilder();
        var literal = new StringBuilder();
        for (char c : pattern.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        var compiled = Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        return s -> compiled.matcher(s).matches();
    }

    /**
     * Every reference of the symbol, its definition included.
     */
    public List<Reference> references(Symbol symbol) {
        return table.references(symbol.qualifiedName());
    }
}
