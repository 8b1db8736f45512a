package io.github.jbellis.refactor.analyzer;

import java.util.Set;

/**
 * The node types a backend's grammar uses for the constructs the engine cares about.
 *
 * @param functionLikeNodeTypes    named, callable definitions
 * @param classLikeNodeTypes       class definitions
 * @param decoratedDefinitionType  wrapper node that carries decorators, or empty if the grammar has none
 * @param lambdaNodeTypes          anonymous functions
 * @param comprehensionNodeTypes   constructs that open their own scope without a name
 * @param operationNodeTypes       expression kinds that may be extracted, and that count towards an
 *                                 expression's complexity
 * @param blockOwnerNodeTypes      compound statements and clauses whose body block may be extracted
 * @param flowEscapeNodeTypes      statements that transfer control or rebind names out of a block
 * @param identifierFieldName      field holding a definition's name
 * @param bodyFieldName            field holding a definition's body
 * @param parametersFieldName      field holding a definition's parameters
 */
public record LanguageSyntaxProfile(
        Set<String> functionLikeNodeTypes,
        Set<String> classLikeNodeTypes,
        String decoratedDefinitionType,
        Set<String> lambdaNodeTypes,
        Set<String> comprehensionNodeTypes,
        Set<String> operationNodeTypes,
        Set<String> blockOwnerNodeTypes,
        Set<String> flowEscapeNodeTypes,
        String identifierFieldName,
        String bodyFieldName,
        String parametersFieldName
) {
    public boolean isDefinition(String nodeType) {
        return functionLikeNodeTypes.contains(nodeType) || classLikeNodeTypes.contains(nodeType);
    }
}
