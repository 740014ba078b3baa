package me.christianrobert.namereduce.reducer.exclusion;

import me.christianrobert.namereduce.syntax.SyntaxNode;

/**
 * Decides whether a node has a shape the reducer is known to rewrite illegally.
 *
 * <p>An unsafe node is excluded from simplification together with all of its ancestors, and
 * the simplifier does not look below it.</p>
 */
@FunctionalInterface
public interface UnsafeShapeRule {

    UnsafeShapeRule NONE = node -> false;

    boolean isUnsafeToSimplify(SyntaxNode node);
}
