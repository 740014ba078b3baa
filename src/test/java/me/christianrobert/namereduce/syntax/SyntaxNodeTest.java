package me.christianrobert.namereduce.syntax;

import me.christianrobert.namereduce.grammar.Grammar;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SyntaxNodeTest {

    private final SyntaxFactory f = SyntaxFactory.forGrammar(Grammar.CSHARP);

    // ==================== REPLACEMENT ====================

    @Test
    void replaceNodesSharesUntouchedSubtrees() {
        SyntaxNode first = f.expressionStatement(f.invocation(f.memberAccess("Console.WriteLine")));
        SyntaxNode second = f.expressionStatement(f.invocation(f.memberAccess("Console.ReadLine")));
        SyntaxNode root = f.compilationUnit(first, second);
        SyntaxNode target = first.getChildren().get(0).getChildren().get(0);

        SyntaxNode rewritten = root.replaceNodes(List.of(target),
                (original, current) -> f.memberAccess("System.Console.WriteLine"));

        assertNotSame(root, rewritten);
        assertSame(second, rewritten.getChildren().get(1));
        assertEquals("System.Console.WriteLine();\nConsole.ReadLine();\n", rewritten.toFullString());
        // Original is untouched
        assertEquals("Console.WriteLine();\nConsole.ReadLine();\n", root.toFullString());
    }

    @Test
    void replaceNodesRunsBottomUp() {
        SyntaxNode inner = f.identifierName("sb");
        SyntaxNode outer = f.invocation(f.memberAccess("Console.WriteLine"), inner);
        SyntaxNode root = f.compilationUnit(f.expressionStatement(outer));

        SyntaxNode rewritten = root.replaceNodes(List.of(inner, outer), (original, current) -> {
            if (original == inner) {
                return f.identifierName("builder");
            }
            // The outer node already sees the replaced inner node
            assertTrue(current.getText().contains("builder"));
            return current.withAdditionalAnnotations(SyntaxAnnotation.SIMPLIFIER_MARKER);
        });

        assertEquals("Console.WriteLine(builder);\n", rewritten.toFullString());
        assertTrue(rewritten.getChildren().get(0).getChildren().get(0).hasAnnotations(SyntaxAnnotation.SIMPLIFY_KIND));
    }

    @Test
    void replaceNodesRejectsNullReplacement() {
        SyntaxNode name = f.identifierName("x");
        SyntaxNode root = f.compilationUnit(f.expressionStatement(name));

        assertThrows(IllegalStateException.class, () -> root.replaceNodes(List.of(name), (original, current) -> null));
    }

    @Test
    void withChildrenKeepsAnnotations() {
        SyntaxNode annotated = f.memberAccess("A.B").withAdditionalAnnotations(SyntaxAnnotation.conversionWarning("w"));

        SyntaxNode withTrivia = annotated.withTrailingTrivia(" ");

        assertEquals("A.B ", withTrivia.toFullString());
        assertEquals(1, withTrivia.getAnnotations(SyntaxAnnotation.CONVERSION_WARNING_KIND).size());
    }

    @Test
    void withoutAnnotationsRemovesOnlyThatKind() {
        SyntaxNode node = f.identifierName("x")
                .withAdditionalAnnotations(SyntaxAnnotation.SIMPLIFIER_MARKER, SyntaxAnnotation.conversionWarning("w"));

        SyntaxNode stripped = node.withoutAnnotations(SyntaxAnnotation.SIMPLIFY_KIND);

        assertFalse(stripped.hasAnnotations(SyntaxAnnotation.SIMPLIFY_KIND));
        assertTrue(stripped.hasAnnotations(SyntaxAnnotation.CONVERSION_WARNING_KIND));
    }

    // ==================== TRAVERSAL ====================

    @Test
    void descendantNodesExcludeSelfAndTokens() {
        SyntaxNode root = f.compilationUnit(f.importDirective("System.Text"));

        List<SyntaxKind> kinds = root.descendantNodes().stream()
                .map(SyntaxNode::getKind)
                .collect(Collectors.toList());

        assertEquals(List.of(SyntaxKind.IMPORT_DIRECTIVE, SyntaxKind.QUALIFIED_NAME,
                SyntaxKind.IDENTIFIER_NAME, SyntaxKind.IDENTIFIER_NAME), kinds);
    }

    @Test
    void descendantNodesPruneBelowRejectedNodes() {
        SyntaxNode root = f.compilationUnit(f.importDirective("System.Text"));

        List<SyntaxNode> visited = root.descendantNodes(node -> node.getKind() != SyntaxKind.QUALIFIED_NAME);

        // The rejected node itself is visited, its children are not
        assertEquals(2, visited.size());
        assertEquals(SyntaxKind.QUALIFIED_NAME, visited.get(1).getKind());
    }

    @Test
    void descendantNodesEmptyWhenStartNodeRejected() {
        SyntaxNode root = f.compilationUnit(f.importDirective("System.Text"));

        assertTrue(root.descendantNodes(node -> node != root).isEmpty());
    }

    @Test
    void equivalenceIgnoresTriviaAndAnnotations() {
        SyntaxNode plain = f.memberAccess("Console.WriteLine");
        SyntaxNode decorated = f.memberAccess("Console.WriteLine")
                .withTrailingTrivia("\n")
                .withAdditionalAnnotations(SyntaxAnnotation.conversionWarning("w"));

        assertTrue(plain.isEquivalentTo(decorated));
        assertFalse(plain.isEquivalentTo(f.memberAccess("Console.Write")));
    }
}
