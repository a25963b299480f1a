package org.frugal.ls.semantics;

import org.frugal.ls.frontend.tree.NodeKind;
import org.frugal.ls.frontend.tree.SyntaxNode;

/**
 * Decides whether an identifier occurrence declares a name or refers to one, using only
 * its structural position in the tree.
 * <p>
 * Only the immediate parent is consulted. An identifier in the name slot of a definition
 * (its first identifier child) declares that definition; the second identifier of a service
 * is its {@code extends} target; identifiers inside a type expression are type references.
 */
public final class IdentifierClassifier {

    private IdentifierClassifier() {}

    /**
     * Classifies an identifier or base type node.
     * @param node The node to classify.
     * @return The classification; never {@code null}.
     */
    public static IdentifierClassification classify(SyntaxNode node) {
        SyntaxNode parent = node == null ? null : node.parent();
        if (parent == null) {
            return IdentifierClassification.referenceOf(SemanticKind.IDENTIFIER);
        }
        if (parent.kind() == NodeKind.FIELD_TYPE) {
            return IdentifierClassification.referenceOf(SemanticKind.TYPE_REFERENCE);
        }

        SemanticKind declared = declaredKind(parent);
        if (declared == null || node.kind() != NodeKind.IDENTIFIER) {
            return IdentifierClassification.referenceOf(SemanticKind.IDENTIFIER);
        }
        if (DefinitionNames.isNameSlot(node)) {
            return IdentifierClassification.declarationOf(declared);
        }
        if (parent.kind() == NodeKind.SERVICE_DEFINITION) {
            // service Child extends Base
            return IdentifierClassification.referenceOf(SemanticKind.TYPE_REFERENCE);
        }
        return IdentifierClassification.referenceOf(SemanticKind.IDENTIFIER);
    }

    private static SemanticKind declaredKind(SyntaxNode parent) {
        return switch (parent.kind()) {
            case STRUCT_DEFINITION -> SemanticKind.STRUCT;
            case SERVICE_DEFINITION -> SemanticKind.SERVICE;
            case ENUM_DEFINITION -> SemanticKind.ENUM;
            case EXCEPTION_DEFINITION -> SemanticKind.EXCEPTION;
            case SCOPE_DEFINITION -> SemanticKind.SCOPE;
            case CONST_DEFINITION -> SemanticKind.CONSTANT;
            case TYPEDEF_DEFINITION -> SemanticKind.TYPEDEF;
            case FUNCTION_DEFINITION -> SemanticKind.METHOD;
            case FIELD -> isInFieldList(parent) ? SemanticKind.PARAMETER : SemanticKind.FIELD;
            case ENUM_FIELD -> SemanticKind.ENUM_VALUE;
            case SCOPE_OPERATION -> SemanticKind.EVENT;
            default -> null;
        };
    }

    private static boolean isInFieldList(SyntaxNode field) {
        SyntaxNode list = field.parent();
        return list != null && list.kind() == NodeKind.FIELD_LIST;
    }
}
