package me.christianrobert.namereduce.syntax;

import me.christianrobert.namereduce.grammar.Grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds well-formed syntax nodes for one target grammar.
 *
 * <p>The translation stage and the tests use this factory so that keywords, terminators and
 * trivia come out the way each grammar writes them:</p>
 * <pre>
 * C#:            using System.Text;          System.Console.WriteLine("x");
 * Visual Basic:  Imports System.Text         System.Console.WriteLine("x")
 * </pre>
 *
 * <p>Dotted names in type positions and import directives are built as
 * {@link SyntaxKind#QUALIFIED_NAME}; dotted names in expressions as
 * {@link SyntaxKind#MEMBER_ACCESS}.</p>
 */
public class SyntaxFactory {

    private static final String NEWLINE = "\n";
    private static final String SPACE = " ";

    private final Grammar grammar;

    public SyntaxFactory(Grammar grammar) {
        if (grammar == null) {
            throw new IllegalArgumentException("Grammar cannot be null");
        }
        this.grammar = grammar;
    }

    public static SyntaxFactory forGrammar(Grammar grammar) {
        return new SyntaxFactory(grammar);
    }

    public Grammar getGrammar() {
        return grammar;
    }

    private boolean isCSharp() {
        return grammar == Grammar.CSHARP;
    }

    // ==================== NAMES ====================

    /**
     * Builds a dotted name from its segments.
     *
     * @param kind {@link SyntaxKind#QUALIFIED_NAME} or {@link SyntaxKind#MEMBER_ACCESS};
     *             a single segment always yields an {@link SyntaxKind#IDENTIFIER_NAME}
     * @param segments Name segments, outermost first
     */
    public static SyntaxNode dottedName(SyntaxKind kind, List<String> segments) {
        if (kind != SyntaxKind.QUALIFIED_NAME && kind != SyntaxKind.MEMBER_ACCESS) {
            throw new IllegalArgumentException("Dotted names are qualified names or member accesses, got: " + kind);
        }
        if (segments == null || segments.isEmpty()) {
            throw new IllegalArgumentException("Name needs at least one segment");
        }
        SyntaxNode name = identifier(segments.get(0));
        for (int i = 1; i < segments.size(); i++) {
            name = SyntaxNode.node(kind, name, SyntaxNode.token("."), identifier(segments.get(i)));
        }
        return name;
    }

    private static SyntaxNode identifier(String segment) {
        if (segment == null || segment.trim().isEmpty()) {
            throw new IllegalArgumentException("Name segment cannot be null or empty");
        }
        return SyntaxNode.node(SyntaxKind.IDENTIFIER_NAME, SyntaxNode.token(segment));
    }

    public SyntaxNode identifierName(String name) {
        return identifier(name);
    }

    /**
     * Name in a type position, e.g. {@code System.Collections.ArrayList}.
     */
    public SyntaxNode qualifiedName(String dottedName) {
        return dottedName(SyntaxKind.QUALIFIED_NAME, splitName(dottedName));
    }

    /**
     * Name in an expression, e.g. {@code System.Console.WriteLine}.
     */
    public SyntaxNode memberAccess(String dottedName) {
        return dottedName(SyntaxKind.MEMBER_ACCESS, splitName(dottedName));
    }

    /**
     * Member access on an arbitrary expression, e.g. {@code list.Count} or {@code Create().Name}.
     */
    public SyntaxNode memberAccess(SyntaxNode target, String memberName) {
        return SyntaxNode.node(SyntaxKind.MEMBER_ACCESS, target, SyntaxNode.token("."), identifier(memberName));
    }

    public static List<String> splitName(String dottedName) {
        if (dottedName == null || dottedName.trim().isEmpty()) {
            throw new IllegalArgumentException("Name cannot be null or empty");
        }
        return Arrays.asList(dottedName.split("\\."));
    }

    // ==================== EXPRESSIONS ====================

    public SyntaxNode literal(String text) {
        return SyntaxNode.node(SyntaxKind.LITERAL, SyntaxNode.token(text));
    }

    public SyntaxNode argumentList(SyntaxNode... arguments) {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(SyntaxNode.token("("));
        for (int i = 0; i < arguments.length; i++) {
            if (i > 0) {
                children.add(SyntaxNode.token(",", SPACE));
            }
            children.add(SyntaxNode.node(SyntaxKind.ARGUMENT, arguments[i]));
        }
        children.add(SyntaxNode.token(")"));
        return SyntaxNode.node(SyntaxKind.ARGUMENT_LIST, children);
    }

    public SyntaxNode invocation(SyntaxNode callee, SyntaxNode... arguments) {
        return SyntaxNode.node(SyntaxKind.INVOCATION, callee, argumentList(arguments));
    }

    /**
     * Visual Basic call without parentheses, e.g. {@code Console.WriteLine}.
     */
    public SyntaxNode invocationWithoutArgumentList(SyntaxNode callee) {
        return SyntaxNode.node(SyntaxKind.INVOCATION, callee);
    }

    public SyntaxNode objectCreation(SyntaxNode type, SyntaxNode... arguments) {
        return SyntaxNode.node(SyntaxKind.OBJECT_CREATION,
                SyntaxNode.token(grammar.newKeyword(), SPACE), type, argumentList(arguments));
    }

    // ==================== STATEMENTS ====================

    public SyntaxNode expressionStatement(SyntaxNode expression) {
        if (isCSharp()) {
            return SyntaxNode.node(SyntaxKind.EXPRESSION_STATEMENT, expression, SyntaxNode.token(";", NEWLINE));
        }
        return SyntaxNode.node(SyntaxKind.EXPRESSION_STATEMENT, expression.withTrailingTrivia(NEWLINE));
    }

    public SyntaxNode returnStatement(SyntaxNode expression) {
        SyntaxNode keyword = SyntaxNode.token(grammar.returnKeyword(), SPACE);
        if (isCSharp()) {
            return SyntaxNode.node(SyntaxKind.RETURN_STATEMENT, keyword, expression, SyntaxNode.token(";", NEWLINE));
        }
        return SyntaxNode.node(SyntaxKind.RETURN_STATEMENT, keyword, expression.withTrailingTrivia(NEWLINE));
    }

    /**
     * Local variable declaration.
     *
     * @param type Declared type name
     * @param variableName Variable name
     * @param initializer Initial value, or null
     */
    public SyntaxNode localDeclaration(SyntaxNode type, String variableName, SyntaxNode initializer) {
        List<SyntaxNode> children = new ArrayList<>();
        if (isCSharp()) {
            children.add(type.withTrailingTrivia(SPACE));
            if (initializer != null) {
                children.add(SyntaxNode.token(variableName, SPACE));
                children.add(SyntaxNode.token("=", SPACE));
                children.add(initializer);
            } else {
                children.add(SyntaxNode.token(variableName));
            }
            children.add(SyntaxNode.token(";", NEWLINE));
        } else {
            children.add(SyntaxNode.token("Dim", SPACE));
            children.add(SyntaxNode.token(variableName, SPACE));
            children.add(SyntaxNode.token("As", SPACE));
            if (initializer != null) {
                children.add(type.withTrailingTrivia(SPACE));
                children.add(SyntaxNode.token("=", SPACE));
                children.add(initializer.withTrailingTrivia(NEWLINE));
            } else {
                children.add(type.withTrailingTrivia(NEWLINE));
            }
        }
        return SyntaxNode.node(SyntaxKind.LOCAL_DECLARATION, children);
    }

    // ==================== DECLARATIONS ====================

    public SyntaxNode importDirective(String namespaceName) {
        SyntaxNode keyword = SyntaxNode.token(grammar.importKeyword(), SPACE);
        if (isCSharp()) {
            return SyntaxNode.node(SyntaxKind.IMPORT_DIRECTIVE,
                    keyword, qualifiedName(namespaceName), SyntaxNode.token(";", NEWLINE));
        }
        return SyntaxNode.node(SyntaxKind.IMPORT_DIRECTIVE,
                keyword, qualifiedName(namespaceName).withTrailingTrivia(NEWLINE));
    }

    public SyntaxNode parameter(SyntaxNode type, String parameterName) {
        if (isCSharp()) {
            return SyntaxNode.node(SyntaxKind.PARAMETER, type.withTrailingTrivia(SPACE), SyntaxNode.token(parameterName));
        }
        return SyntaxNode.node(SyntaxKind.PARAMETER,
                SyntaxNode.token(parameterName, SPACE), SyntaxNode.token("As", SPACE), type);
    }

    public SyntaxNode fieldDeclaration(SyntaxNode type, String fieldName) {
        if (isCSharp()) {
            return SyntaxNode.node(SyntaxKind.FIELD_DECLARATION,
                    type.withTrailingTrivia(SPACE), SyntaxNode.token(fieldName), SyntaxNode.token(";", NEWLINE));
        }
        return SyntaxNode.node(SyntaxKind.FIELD_DECLARATION,
                SyntaxNode.token("Private", SPACE), SyntaxNode.token(fieldName, SPACE),
                SyntaxNode.token("As", SPACE), type.withTrailingTrivia(NEWLINE));
    }

    /**
     * Method without return value ({@code void} in C#, {@code Sub} in Visual Basic).
     */
    public SyntaxNode methodDeclaration(String methodName, List<SyntaxNode> parameters, SyntaxNode... statements) {
        List<SyntaxNode> parameterChildren = new ArrayList<>();
        parameterChildren.add(SyntaxNode.token("("));
        for (int i = 0; i < parameters.size(); i++) {
            if (i > 0) {
                parameterChildren.add(SyntaxNode.token(",", SPACE));
            }
            parameterChildren.add(parameters.get(i));
        }
        parameterChildren.add(SyntaxNode.token(")", isCSharp() ? SPACE : NEWLINE));
        SyntaxNode parameterList = SyntaxNode.node(SyntaxKind.PARAMETER_LIST, parameterChildren);

        List<SyntaxNode> blockChildren = new ArrayList<>();
        if (isCSharp()) {
            blockChildren.add(SyntaxNode.token("{", NEWLINE));
            blockChildren.addAll(Arrays.asList(statements));
            blockChildren.add(SyntaxNode.token("}", NEWLINE));
        } else {
            blockChildren.addAll(Arrays.asList(statements));
            blockChildren.add(SyntaxNode.token("End", SPACE));
            blockChildren.add(SyntaxNode.token("Sub", NEWLINE));
        }
        SyntaxNode block = SyntaxNode.node(SyntaxKind.BLOCK, blockChildren);

        return SyntaxNode.node(SyntaxKind.METHOD_DECLARATION,
                SyntaxNode.token(isCSharp() ? "void" : "Sub", SPACE),
                SyntaxNode.token(methodName),
                parameterList,
                block);
    }

    public SyntaxNode typeDeclaration(String typeName, SyntaxNode... members) {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(SyntaxNode.token(grammar.classKeyword(), SPACE));
        if (isCSharp()) {
            children.add(SyntaxNode.token(typeName, SPACE));
            children.add(SyntaxNode.token("{", NEWLINE));
            children.addAll(Arrays.asList(members));
            children.add(SyntaxNode.token("}", NEWLINE));
        } else {
            children.add(SyntaxNode.token(typeName, NEWLINE));
            children.addAll(Arrays.asList(members));
            children.add(SyntaxNode.token("End", SPACE));
            children.add(SyntaxNode.token("Class", NEWLINE));
        }
        return SyntaxNode.node(SyntaxKind.TYPE_DECLARATION, children);
    }

    public SyntaxNode namespaceDeclaration(String namespaceName, SyntaxNode... members) {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(SyntaxNode.token(grammar.namespaceKeyword(), SPACE));
        if (isCSharp()) {
            children.add(qualifiedName(namespaceName).withTrailingTrivia(SPACE));
            children.add(SyntaxNode.token("{", NEWLINE));
            children.addAll(Arrays.asList(members));
            children.add(SyntaxNode.token("}", NEWLINE));
        } else {
            children.add(qualifiedName(namespaceName).withTrailingTrivia(NEWLINE));
            children.addAll(Arrays.asList(members));
            children.add(SyntaxNode.token("End", SPACE));
            children.add(SyntaxNode.token("Namespace", NEWLINE));
        }
        return SyntaxNode.node(SyntaxKind.NAMESPACE_DECLARATION, children);
    }

    public SyntaxNode compilationUnit(SyntaxNode... members) {
        return SyntaxNode.node(SyntaxKind.COMPILATION_UNIT, members);
    }

    public SyntaxTree tree(String documentName, SyntaxNode... members) {
        return new SyntaxTree(documentName, grammar, compilationUnit(members));
    }
}
