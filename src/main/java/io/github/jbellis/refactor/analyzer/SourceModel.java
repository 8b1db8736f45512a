package io.github.jbellis.refactor.analyzer;

import io.github.jbellis.refactor.IProject;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSNode;

import java.io.IOException;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Parsed files of one project. A file is parsed on first use and kept until it is invalidated, so callers
 * must report changes through {@link #invalidate}.
 */
public final class SourceModel {
    private static final Logger logger = LogManager.getLogger(SourceModel.class);

    private final IProject project;
    private final LanguageBackend backend;
    private final int maxFiles;
    private final Duration timeout;
    private final ConcurrentMap<ProjectFile, SourceFile> parsed = new ConcurrentHashMap<>();

    /**
     * @param files    successfully parsed files, sorted by path
     * @param warnings files left out, with the reason
     * @param partial  true if the scan hit its file or time bound
     */
    public record ScanResult(List<SourceFile> files, Map<ProjectFile, String> warnings, boolean partial) {
    }

    public SourceModel(IProject project, LanguageBackend backend, int maxFiles, Duration timeout) {
        this.project = project;
        this.backend = backend;
        this.maxFiles = maxFiles;
        this.timeout = timeout;
    }

    public LanguageBackend backend() {
        return backend;
    }

    /**
     * The parsed file.
     *
     * @throws ParseException if the file does not parse cleanly
     */
    public SourceFile get(ProjectFile file) throws IOException, ParseException {
        var cached = parsed.get(file);
        if (cached != null) {
            return cached;
        }
        var source = backend.parse(file);
        parsed.put(file, source);
        return source;
    }

    /**
     * The smallest node covering a position given as a 1-based line and a 0-based byte column.
     */
    public TSNode nodeAt(ProjectFile file, int line, int column) throws IOException, ParseException {
        var source = get(file);
        int offset = source.offset(line, column);
        int end = Math.min(offset + 1, source.content().length);
        return SyntaxNodes.smallestCovering(source.root(), new ByteRange(Math.min(offset, end), end));
    }

    /**
     * Parses every source file of the project, within the configured bounds. Files that fail to read or
     * parse are reported as warnings and left out; the others are still returned.
     */
    public ScanResult scan() {
        long deadline = System.nanoTime() + timeout.toNanos();
        var candidates = project.getAllFiles().stream()
                .filter(backend::isSourceFile)
                .sorted()
                .toList();
        var partial = new AtomicBoolean(candidates.size() > maxFiles);
        if (partial.get()) {
            logger.warn("{} has {} source files; analyzing the first {}", project.getRoot(), candidates.size(), maxFiles);
        }
        var selected = partial.get() ? candidates.subList(0, maxFiles) : candidates;

        var warnings = new ConcurrentHashMap<ProjectFile, String>();
        var sources = selected.parallelStream()
                .map(file -> {
                    if (System.nanoTime() > deadline) {
                        partial.set(true);
                        return null;
                    }
                    try {
                        return get(file);
                    } catch (ParseException e) {
                        logger.warn("Excluding {} from analysis: {}", file, e.getMessage());
                        warnings.put(file, e.getMessage());
                    } catch (IOException e) {
                        logger.warn("Could not read {}: {}", file, e.getMessage());
                        warnings.put(file, "unreadable: " + e.getMessage());
                    }
                    return null;
                })
                .filter(Objects::nonNull)
                .toList();

        if (partial.get() && sources.size() < selected.size() - warnings.size()) {
            logger.warn("Scan of {} hit its {} time limit after parsing {} files", project.getRoot(), timeout, sources.size());
        }
        logger.debug("Scanned {}: {} parsed, {} excluded{}", project.getRoot(), sources.size(), warnings.size(),
                     partial.get() ? ", partial" : "");
        return new ScanResult(sources, Map.copyOf(warnings), partial.get());
    }

    public void invalidate(Collection<ProjectFile> files) {
        files.forEach(parsed::remove);
    }

    public void invalidateAll() {
        parsed.clear();
    }
}
