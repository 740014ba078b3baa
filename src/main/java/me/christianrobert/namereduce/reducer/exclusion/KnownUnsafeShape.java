package me.christianrobert.namereduce.reducer.exclusion;

import me.christianrobert.namereduce.syntax.SyntaxKind;
import me.christianrobert.namereduce.syntax.SyntaxNode;

/**
 * Node shapes the reducer is known to mishandle.
 */
public enum KnownUnsafeShape implements UnsafeShapeRule {

    /**
     * Invocation without arguments. The reducer drops the empty argument list, which turns a
     * call into a plain reference. A call written without parentheses counts as well.
     */
    EMPTY_ARGUMENT_INVOCATION("invocation with an empty argument list") {
        @Override
        public boolean isUnsafeToSimplify(SyntaxNode node) {
            if (node.getKind() != SyntaxKind.INVOCATION) {
                return false;
            }
            SyntaxNode argumentList = node.getFirstChild(SyntaxKind.ARGUMENT_LIST);
            return argumentList == null || argumentList.getFirstChild(SyntaxKind.ARGUMENT) == null;
        }
    },

    /**
     * Object construction. The reducer may produce an inferred member initializer, which is
     * illegal inside a construction.
     */
    OBJECT_CREATION_EXPRESSION("object construction") {
        @Override
        public boolean isUnsafeToSimplify(SyntaxNode node) {
            return node.getKind() == SyntaxKind.OBJECT_CREATION;
        }
    };

    private final String description;

    KnownUnsafeShape(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
