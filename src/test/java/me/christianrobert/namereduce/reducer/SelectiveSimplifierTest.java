package me.christianrobert.namereduce.reducer;

import me.christianrobert.namereduce.SampleDocuments;
import me.christianrobert.namereduce.context.ConversionWarning;
import me.christianrobert.namereduce.context.WarningAnnotations;
import me.christianrobert.namereduce.grammar.Grammar;
import me.christianrobert.namereduce.reducer.exclusion.UnsafeShapeRule;
import me.christianrobert.namereduce.reducer.exclusion.UnsafeShapeTable;
import me.christianrobert.namereduce.semantic.SemanticOracle;
import me.christianrobert.namereduce.semantic.SemanticOracleException;
import me.christianrobert.namereduce.semantic.index.IndexedSemanticOracle;
import me.christianrobert.namereduce.syntax.SyntaxAnnotation;
import me.christianrobert.namereduce.syntax.SyntaxFactory;
import me.christianrobert.namereduce.syntax.SyntaxNode;
import me.christianrobert.namereduce.syntax.SyntaxTree;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SelectiveSimplifierTest {

    private final SyntaxFactory csharp = SyntaxFactory.forGrammar(Grammar.CSHARP);
    private final SyntaxFactory vb = SyntaxFactory.forGrammar(Grammar.VISUAL_BASIC);

    private static boolean hasMarkers(SyntaxTree tree) {
        return tree.getRoot().descendantNodesAndSelf().stream()
                .anyMatch(node -> node.hasAnnotations(SyntaxAnnotation.SIMPLIFY_KIND));
    }

    // ==================== SIMPLIFICATION ====================

    @Test
    void shortensFullyQualifiedNames() {
        SyntaxTree tree = csharp.tree("A.cs",
                csharp.importDirective("System"),
                csharp.importDirective("System.Text"),
                csharp.localDeclaration(csharp.qualifiedName("System.Text.StringBuilder"), "sb",
                        csharp.objectCreation(csharp.qualifiedName("System.Text.StringBuilder"))),
                csharp.expressionStatement(csharp.invocation(csharp.memberAccess("System.Console.WriteLine"),
                        csharp.identifierName("sb"))));
        SelectiveSimplifier simplifier = new SelectiveSimplifier(UnsafeShapeTable.CSHARP);

        SyntaxTree simplified = simplifier.simplify(tree,
                new IndexedSemanticOracle(SampleDocuments.csharpIndex()), "CS0246").join();

        assertEquals("using System;\nusing System.Text;\n"
                + "StringBuilder sb = new StringBuilder();\n"
                + "Console.WriteLine(sb);\n", simplified.getText());
        assertFalse(hasMarkers(simplified));
        assertTrue(WarningAnnotations.collect(simplified).isEmpty());
    }

    @Test
    void simplifyingMinimalTreeChangesNothing() {
        SyntaxTree tree = SampleDocuments.csharpProgram();
        SelectiveSimplifier simplifier = new SelectiveSimplifier(UnsafeShapeTable.CSHARP);
        IndexedSemanticOracle oracle = new IndexedSemanticOracle(SampleDocuments.csharpIndex());

        SyntaxTree once = simplifier.simplify(tree, oracle, "CS0246").join();
        SyntaxTree twice = simplifier.simplify(once, oracle, "CS0246").join();

        assertEquals(tree.getText(), once.getText());
        assertEquals(once.getText(), twice.getText());
        assertTrue(once.getRoot().isEquivalentTo(tree.getRoot()));
        assertFalse(hasMarkers(twice));
    }

    @Test
    void unresolvedImportKeepsItsText() {
        SyntaxTree tree = csharp.tree("A.cs",
                csharp.importDirective("System"),
                csharp.importDirective("Legacy.Data"),
                csharp.expressionStatement(csharp.invocation(csharp.memberAccess("System.Console.ReadLine"))));
        SelectiveSimplifier simplifier = new SelectiveSimplifier(UnsafeShapeTable.CSHARP);

        SyntaxTree simplified = simplifier.simplify(tree,
                new IndexedSemanticOracle(SampleDocuments.csharpIndex()), "CS0246").join();

        assertEquals("using System;\nusing Legacy.Data;\nConsole.ReadLine();\n", simplified.getText());
    }

    // ==================== VISUAL BASIC UNSAFE SHAPES ====================

    @Test
    void emptyArgumentInvocationAndItsParentsStayUntouched() {
        SyntaxNode unsafeStatement = vb.expressionStatement(vb.invocation(vb.memberAccess("System.Console.ReadLine")));
        SyntaxNode safeStatement = vb.expressionStatement(
                vb.invocation(vb.memberAccess("System.Console.Write"), vb.literal("\"x\"")));
        SyntaxTree tree = vb.tree("Program.vb", vb.importDirective("System"),
                vb.typeDeclaration("Program", vb.methodDeclaration("Run", List.of(), unsafeStatement, safeStatement)));
        SelectiveSimplifier simplifier = new SelectiveSimplifier(UnsafeShapeTable.VISUAL_BASIC);

        SyntaxTree simplified = simplifier.simplify(tree,
                new IndexedSemanticOracle(SampleDocuments.visualBasicIndex()), "BC30002").join();

        assertEquals("Imports System\n"
                + "Class Program\n"
                + "Sub Run()\n"
                + "System.Console.ReadLine()\n"
                + "Console.Write(\"x\")\n"
                + "End Sub\n"
                + "End Class\n", simplified.getText());
        assertFalse(hasMarkers(simplified));
    }

    @Test
    void objectCreationStaysQualifiedInVisualBasic() {
        SyntaxTree tree = vb.tree("Program.vb", vb.importDirective("System.Text"),
                vb.localDeclaration(vb.qualifiedName("System.Text.StringBuilder"), "sb",
                        vb.objectCreation(vb.qualifiedName("System.Text.StringBuilder"))));
        SelectiveSimplifier simplifier = new SelectiveSimplifier(UnsafeShapeTable.VISUAL_BASIC);

        SyntaxTree simplified = simplifier.simplify(tree,
                new IndexedSemanticOracle(SampleDocuments.visualBasicIndex()), "BC30002").join();

        assertEquals("Imports System.Text\nDim sb As StringBuilder = New System.Text.StringBuilder()\n",
                simplified.getText());
    }

    // ==================== FAILURES ====================

    @Test
    void nothingEligibleSkipsReduction() {
        SyntaxTree tree = vb.tree("A.vb",
                vb.expressionStatement(vb.invocationWithoutArgumentList(vb.memberAccess("System.Console.WriteLine"))));
        SemanticOracle oracle = mock(SemanticOracle.class);
        when(oracle.getDiagnostics(any())).thenReturn(CompletableFuture.completedFuture(List.of()));
        SelectiveSimplifier simplifier = new SelectiveSimplifier(UnsafeShapeTable.VISUAL_BASIC);

        SyntaxTree result = simplifier.simplify(tree, oracle, "BC30002").join();

        assertSame(tree, result);
        verify(oracle, never()).reduceToMinimalForm(any());
    }

    @Test
    void failedReductionReturnsInputWithOneDocumentWarning() {
        SyntaxTree tree = SampleDocuments.csharpProgram();
        SemanticOracle oracle = mock(SemanticOracle.class);
        when(oracle.getDiagnostics(any())).thenReturn(CompletableFuture.completedFuture(List.of()));
        when(oracle.reduceToMinimalForm(any()))
                .thenReturn(CompletableFuture.failedFuture(new SemanticOracleException("reducer crashed")));
        SelectiveSimplifier simplifier = new SelectiveSimplifier(UnsafeShapeRule.NONE);

        SyntaxTree result = simplifier.simplify(tree, oracle, "CS0246").join();

        assertEquals(tree.getText(), result.getText());
        assertTrue(result.getRoot().isEquivalentTo(tree.getRoot()));
        assertFalse(hasMarkers(result));
        List<ConversionWarning> warnings = WarningAnnotations.collect(result);
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).isDocumentLevel());
        assertTrue(warnings.get(0).getMessage().startsWith(WarningAnnotations.DOCUMENT_FAILURE_TEXT));
        assertTrue(warnings.get(0).getMessage().contains("reducer crashed"));
    }

    @Test
    void synchronousDiagnosticsFailureIsDocumentFailure() {
        SyntaxTree tree = SampleDocuments.csharpProgram();
        SemanticOracle oracle = mock(SemanticOracle.class);
        when(oracle.getDiagnostics(any())).thenThrow(new IllegalStateException("compilation unavailable"));
        SelectiveSimplifier simplifier = new SelectiveSimplifier(UnsafeShapeRule.NONE);

        SyntaxTree result = simplifier.simplify(tree, oracle, "CS0246").join();

        assertEquals(1, WarningAnnotations.countWarnings(result.getRoot()));
        assertEquals(tree.getText(), result.getText());
        verify(oracle, never()).reduceToMinimalForm(any());
    }

    @Test
    void nullReductionResultIsDocumentFailure() {
        SyntaxTree tree = SampleDocuments.csharpProgram();
        SemanticOracle oracle = mock(SemanticOracle.class);
        when(oracle.getDiagnostics(any())).thenReturn(CompletableFuture.completedFuture(List.of()));
        when(oracle.reduceToMinimalForm(any())).thenReturn(CompletableFuture.completedFuture(null));
        SelectiveSimplifier simplifier = new SelectiveSimplifier(UnsafeShapeRule.NONE);

        SyntaxTree result = simplifier.simplify(tree, oracle, "CS0246").join();

        assertEquals(1, WarningAnnotations.countWarnings(result.getRoot()));
        assertTrue(WarningAnnotations.collect(result).get(0).getMessage().contains("Reduction returned no tree"));
    }

    @Test
    void reductionReceivesMarkedSnapshot() {
        SyntaxTree tree = SampleDocuments.csharpProgram();
        SemanticOracle oracle = mock(SemanticOracle.class);
        when(oracle.getDiagnostics(any())).thenReturn(CompletableFuture.completedFuture(List.of()));
        when(oracle.reduceToMinimalForm(any())).thenAnswer(invocation -> {
            SyntaxTree marked = invocation.getArgument(0);
            assertTrue(hasMarkers(marked));
            assertFalse(marked.getRoot().hasAnnotations(SyntaxAnnotation.SIMPLIFY_KIND));
            return CompletableFuture.completedFuture(tree);
        });

        SyntaxTree result = new SelectiveSimplifier(UnsafeShapeRule.NONE).simplify(tree, oracle, "CS0246").join();

        assertSame(tree, result);
        verify(oracle, times(1)).getDiagnostics(tree);
    }
}
