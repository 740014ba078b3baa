package me.christianrobert.namereduce.syntax;

/**
 * Kind tags for syntax nodes produced by the translation stage.
 *
 * <p>Both target grammars (C# and Visual Basic) share this tag set. Grammar-specific
 * differences live in the token text and in {@link me.christianrobert.namereduce.grammar.Grammar},
 * not in the kinds themselves.</p>
 */
public enum SyntaxKind {

    COMPILATION_UNIT(false),
    IMPORT_DIRECTIVE(false),
    NAMESPACE_DECLARATION(false),
    TYPE_DECLARATION(false),
    METHOD_DECLARATION(false),
    FIELD_DECLARATION(false),
    PARAMETER_LIST(false),
    PARAMETER(false),
    BLOCK(false),
    LOCAL_DECLARATION(false),
    EXPRESSION_STATEMENT(false),
    RETURN_STATEMENT(false),
    ARGUMENT_LIST(false),
    ARGUMENT(false),

    // Expressions
    IDENTIFIER_NAME(true),
    QUALIFIED_NAME(true),
    MEMBER_ACCESS(true),
    INVOCATION(true),
    OBJECT_CREATION(true),
    LITERAL(true),

    TOKEN(false);

    private final boolean expression;

    SyntaxKind(boolean expression) {
        this.expression = expression;
    }

    public boolean isExpression() {
        return expression;
    }

    /**
     * Name kinds are the ones that can form a dotted reference
     * (identifier, qualified name, member access).
     */
    public boolean isName() {
        return this == IDENTIFIER_NAME || this == QUALIFIED_NAME || this == MEMBER_ACCESS;
    }

    public boolean isToken() {
        return this == TOKEN;
    }
}
