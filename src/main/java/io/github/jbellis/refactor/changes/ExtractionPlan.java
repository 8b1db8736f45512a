package io.github.jbellis.refactor.changes;

import java.util.List;

/**
 * @param definition the text of the new function
 * @param parameters its parameter names, in order
 * @param returns    names whose values the new function returns to the call site
 */
public record ExtractionPlan(ChangeSet changes, String definition, List<String> parameters, List<String> returns) {
}
