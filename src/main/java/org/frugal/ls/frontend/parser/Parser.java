package org.frugal.ls.frontend.parser;

import org.frugal.ls.frontend.lexer.FrugalKeywords;
import org.frugal.ls.frontend.lexer.Token;
import org.frugal.ls.frontend.lexer.TokenType;
import org.frugal.ls.frontend.tree.NodeKind;
import org.frugal.ls.frontend.tree.SourcePoint;
import org.frugal.ls.frontend.tree.SyntaxNode;
import org.frugal.ls.frontend.tree.TreeNode;

import java.util.List;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * A recovering recursive-descent parser for the Frugal IDL. It consumes the tokens
 * of the {@link org.frugal.ls.frontend.lexer.Lexer} and produces a concrete syntax tree.
 * <p>
 * The parser never fails: tokens that fit nowhere are wrapped in {@link NodeKind#ERROR}
 * nodes and reported as {@code "Syntax error"}; absent required tokens are reported as
 * {@code "Missing '<token>'"}. Every loop consumes at least one token per iteration, so
 * parsing always terminates with a root node.
 * <p>
 * Type expressions are always wrapped in a {@link NodeKind#FIELD_TYPE} node, so the first
 * direct {@link NodeKind#IDENTIFIER} child of a definition node is its name.
 * A missing name produces an error but no node.
 */
public class Parser {

    private final List<Token> tokens;
    private final List<ParseError> errors;
    private int current = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The tokens to parse, terminated by {@link TokenType#END_OF_FILE}.
     * @param errors The sink for syntax errors.
     */
    public Parser(List<Token> tokens, List<ParseError> errors) {
        this.tokens = tokens;
        this.errors = errors;
    }

    /**
     * Parses the entire token stream.
     * @return The {@link NodeKind#SOURCE_FILE} root covering the whole source.
     */
    public SyntaxNode parse() {
        TreeNode root = TreeNode.root();
        while (!isAtEnd()) {
            root.add(declaration());
        }
        Token eof = peek();
        root.extendTo(eof.offset(), new SourcePoint(eof.line(), eof.column()));
        return root;
    }

    private TreeNode declaration() {
        Token token = peek();
        if (token.type() == TokenType.KEYWORD) {
            switch (token.text()) {
                case "include": return include();
                case "namespace": return namespace();
                case "const": return constDefinition();
                case "typedef": return typedef();
                case "enum": return enumDefinition();
                case "struct": return structLike(NodeKind.STRUCT_DEFINITION);
                case "exception": return structLike(NodeKind.EXCEPTION_DEFINITION);
                case "service": return service();
                case "scope": return scope();
                default: break;
            }
        }
        return errorNode(this::isTopLevelStart);
    }

    // --- Headers ---------------------------------------------------------------------------

    private TreeNode include() {
        TreeNode node = start(NodeKind.INCLUDE);
        node.add(leaf(advance()));
        expect(TokenType.STRING, "string", node);
        separator(node);
        return node;
    }

    private TreeNode namespace() {
        TreeNode node = start(NodeKind.NAMESPACE_DECLARATION);
        node.add(leaf(advance()));
        if (check(TokenType.STAR)) {
            node.add(leaf(advance()));
        } else {
            expect(TokenType.IDENTIFIER, "identifier", node);
        }
        expect(TokenType.IDENTIFIER, "identifier", node);
        separator(node);
        return node;
    }

    // --- Definitions -----------------------------------------------------------------------

    private TreeNode constDefinition() {
        TreeNode node = start(NodeKind.CONST_DEFINITION);
        node.add(leaf(advance()));
        addIfPresent(node, fieldType());
        expect(TokenType.IDENTIFIER, "identifier", node);
        if (expect(TokenType.EQUALS, "=", node)) {
            addIfPresent(node, constValue());
        }
        separator(node);
        return node;
    }

    private TreeNode typedef() {
        TreeNode node = start(NodeKind.TYPEDEF_DEFINITION);
        node.add(leaf(advance()));
        addIfPresent(node, fieldType());
        expect(TokenType.IDENTIFIER, "identifier", node);
        annotations(node);
        separator(node);
        return node;
    }

    private TreeNode enumDefinition() {
        TreeNode node = start(NodeKind.ENUM_DEFINITION);
        node.add(leaf(advance()));
        expect(TokenType.IDENTIFIER, "identifier", node);
        node.add(body(NodeKind.ENUM_BODY, t -> t.type() == TokenType.IDENTIFIER, this::enumField));
        annotations(node);
        return node;
    }

    private TreeNode enumField() {
        TreeNode node = start(NodeKind.ENUM_FIELD);
        node.add(leaf(advance()));
        if (check(TokenType.EQUALS)) {
            node.add(leaf(advance()));
            expect(TokenType.INTEGER, "integer", node);
        }
        annotations(node);
        separator(node);
        return node;
    }

    private TreeNode structLike(NodeKind kind) {
        TreeNode node = start(kind);
        node.add(leaf(advance()));
        expect(TokenType.IDENTIFIER, "identifier", node);
        node.add(body(NodeKind.STRUCT_BODY, this::isFieldStart, this::field));
        annotations(node);
        return node;
    }

    private TreeNode service() {
        TreeNode node = start(NodeKind.SERVICE_DEFINITION);
        node.add(leaf(advance()));
        expect(TokenType.IDENTIFIER, "identifier", node);
        if (checkWord("extends")) {
            node.add(leaf(advance()));
            expect(TokenType.IDENTIFIER, "identifier", node);
        }
        node.add(body(NodeKind.SERVICE_BODY, this::isFunctionStart, this::function));
        annotations(node);
        return node;
    }

    private TreeNode function() {
        TreeNode node = start(NodeKind.FUNCTION_DEFINITION);
        if (checkWord("oneway")) {
            node.add(leaf(advance()));
        }
        TreeNode returnType = start(NodeKind.FUNCTION_TYPE);
        if (checkWord("void")) {
            returnType.add(leaf(advance()));
            node.add(returnType);
        } else {
            TreeNode type = fieldType();
            if (type != null) {
                returnType.add(type);
                node.add(returnType);
            }
        }
        expect(TokenType.IDENTIFIER, "identifier", node);
        if (expect(TokenType.LEFT_PAREN, "(", node)) {
            node.add(fieldList());
            expect(TokenType.RIGHT_PAREN, ")", node);
        }
        if (checkWord("throws")) {
            node.add(leaf(advance(), NodeKind.THROWS));
            if (expect(TokenType.LEFT_PAREN, "(", node)) {
                node.add(fieldList());
                expect(TokenType.RIGHT_PAREN, ")", node);
            }
        }
        annotations(node);
        separator(node);
        return node;
    }

    private TreeNode fieldList() {
        TreeNode list = start(NodeKind.FIELD_LIST);
        members(list, TokenType.RIGHT_PAREN, this::isFieldStart, this::field);
        return list;
    }

    private TreeNode scope() {
        TreeNode node = start(NodeKind.SCOPE_DEFINITION);
        node.add(leaf(advance()));
        expect(TokenType.IDENTIFIER, "identifier", node);
        if (checkWord("prefix")) {
            node.add(leaf(advance()));
            expect(TokenType.STRING, "string", node);
        }
        node.add(body(NodeKind.SCOPE_BODY, t -> t.type() == TokenType.IDENTIFIER, this::scopeOperation));
        annotations(node);
        return node;
    }

    private TreeNode scopeOperation() {
        TreeNode node = start(NodeKind.SCOPE_OPERATION);
        node.add(leaf(advance()));
        if (expect(TokenType.COLON, ":", node)) {
            addIfPresent(node, fieldType());
        }
        annotations(node);
        separator(node);
        return node;
    }

    // --- Fields and types ------------------------------------------------------------------

    private TreeNode field() {
        TreeNode node = start(NodeKind.FIELD);
        if (check(TokenType.INTEGER)) {
            TreeNode id = start(NodeKind.FIELD_ID);
            id.add(leaf(advance()));
            expect(TokenType.COLON, ":", id);
            node.add(id);
        }
        if (checkWord("required") || checkWord("optional")) {
            node.add(leaf(advance(), NodeKind.FIELD_REQUIREDNESS));
        }
        addIfPresent(node, fieldType());
        expect(TokenType.IDENTIFIER, "identifier", node);
        if (check(TokenType.EQUALS)) {
            node.add(leaf(advance()));
            addIfPresent(node, constValue());
        }
        annotations(node);
        separator(node);
        return node;
    }

    /**
     * Parses a type expression wrapped in a {@link NodeKind#FIELD_TYPE} node.
     * @return The type node, or {@code null} (with an error recorded) if no type starts here.
     */
    private TreeNode fieldType() {
        Token token = peek();
        if (token.type() == TokenType.IDENTIFIER || token.type() == TokenType.BASE_TYPE) {
            TreeNode type = start(NodeKind.FIELD_TYPE);
            type.add(leaf(advance()));
            return type;
        }
        if (isContainerStart(token)) {
            TreeNode type = start(NodeKind.FIELD_TYPE);
            type.add(containerType());
            return type;
        }
        missing("type");
        return null;
    }

    private TreeNode containerType() {
        TreeNode node = start(NodeKind.CONTAINER_TYPE);
        Token keyword = advance();
        node.add(leaf(keyword));
        if (!expect(TokenType.LESS, "<", node)) {
            return node;
        }
        addIfPresent(node, fieldType());
        if (keyword.text().equals("map") && expect(TokenType.COMMA, ",", node)) {
            addIfPresent(node, fieldType());
        }
        expect(TokenType.GREATER, ">", node);
        return node;
    }

    // --- Constant values -------------------------------------------------------------------

    private TreeNode constValue() {
        Token token = peek();
        switch (token.type()) {
            case INTEGER, DOUBLE, STRING, IDENTIFIER -> {
                TreeNode value = start(NodeKind.CONST_VALUE);
                value.add(leaf(advance()));
                return value;
            }
            case LEFT_BRACKET -> {
                TreeNode value = start(NodeKind.CONST_VALUE);
                value.add(constList());
                return value;
            }
            case LEFT_BRACE -> {
                TreeNode value = start(NodeKind.CONST_VALUE);
                value.add(constMap());
                return value;
            }
            default -> {
                missing("value");
                return null;
            }
        }
    }

    private TreeNode constList() {
        TreeNode node = start(NodeKind.CONST_LIST);
        node.add(leaf(advance()));
        while (!check(TokenType.RIGHT_BRACKET) && isConstValueStart(peek())) {
            node.add(constValue());
            separator(node);
        }
        expect(TokenType.RIGHT_BRACKET, "]", node);
        return node;
    }

    private TreeNode constMap() {
        TreeNode node = start(NodeKind.CONST_MAP);
        node.add(leaf(advance()));
        while (!check(TokenType.RIGHT_BRACE) && isConstValueStart(peek())) {
            node.add(constValue());
            if (expect(TokenType.COLON, ":", node)) {
                addIfPresent(node, constValue());
            }
            separator(node);
        }
        expect(TokenType.RIGHT_BRACE, "}", node);
        return node;
    }

    // --- Annotations -----------------------------------------------------------------------

    private void annotations(TreeNode owner) {
        if (!check(TokenType.LEFT_PAREN)) {
            return;
        }
        TreeNode node = start(NodeKind.ANNOTATIONS);
        node.add(leaf(advance()));
        while (check(TokenType.IDENTIFIER)) {
            TreeNode annotation = start(NodeKind.ANNOTATION);
            annotation.add(leaf(advance()));
            if (check(TokenType.EQUALS)) {
                annotation.add(leaf(advance()));
                expect(TokenType.STRING, "string", annotation);
            }
            separator(annotation);
            node.add(annotation);
        }
        expect(TokenType.RIGHT_PAREN, ")", node);
        owner.add(node);
    }

    // --- Bodies and recovery ---------------------------------------------------------------

    private TreeNode body(NodeKind kind, Predicate<Token> memberStart, Supplier<TreeNode> member) {
        TreeNode body = start(kind);
        if (!expect(TokenType.LEFT_BRACE, "{", body)) {
            return body;
        }
        members(body, TokenType.RIGHT_BRACE, memberStart, member);
        expect(TokenType.RIGHT_BRACE, "}", body);
        return body;
    }

    private void members(TreeNode owner, TokenType close, Predicate<Token> memberStart, Supplier<TreeNode> member) {
        while (!check(close) && !isAtEnd()) {
            Token token = peek();
            if (memberStart.test(token)) {
                owner.add(member.get());
            } else if (isTopLevelStart(token)) {
                return;
            } else {
                owner.add(errorNode(t -> memberStart.test(t) || t.type() == close || isTopLevelStart(t)));
            }
        }
    }

    /**
     * Wraps the current token and every following token up to a recovery point in an
     * {@link NodeKind#ERROR} node. Always consumes at least one token.
     */
    private TreeNode errorNode(Predicate<Token> stop) {
        Token first = peek();
        errors.add(new ParseError("Syntax error", first.line(), first.column(), first.offset()));
        TreeNode node = start(NodeKind.ERROR);
        node.add(leaf(advance()));
        while (!isAtEnd() && !stop.test(peek())) {
            node.add(leaf(advance()));
        }
        return node;
    }

    private boolean expect(TokenType type, String display, TreeNode owner) {
        if (check(type)) {
            owner.add(leaf(advance()));
            return true;
        }
        TreeNode placeholder = missing(display);
        if (type != TokenType.IDENTIFIER) {
            owner.add(TreeNode.missing(kindOf(type), placeholder.startOffset(), placeholder.startPoint()));
        }
        return false;
    }

    /**
     * Records a missing token at the end of the previous token.
     * @return A detached zero-width node marking the position.
     */
    private TreeNode missing(String display) {
        int offset;
        SourcePoint point;
        if (current > 0) {
            Token prev = previous();
            offset = prev.endOffset();
            point = new SourcePoint(prev.line(), prev.endColumn());
        } else {
            Token next = peek();
            offset = next.offset();
            point = new SourcePoint(next.line(), next.column());
        }
        errors.add(new ParseError("Missing '" + display + "'", point.row(), point.column(), offset));
        return TreeNode.missing(NodeKind.ERROR, offset, point);
    }

    private void separator(TreeNode owner) {
        if (check(TokenType.COMMA) || check(TokenType.SEMICOLON)) {
            owner.add(leaf(advance()));
        }
    }

    private static void addIfPresent(TreeNode owner, TreeNode child) {
        if (child != null) {
            owner.add(child);
        }
    }

    // --- Token predicates ------------------------------------------------------------------

    private boolean isTopLevelStart(Token token) {
        return token.type() == TokenType.KEYWORD && FrugalKeywords.TOP_LEVEL.contains(token.text());
    }

    private boolean isContainerStart(Token token) {
        return token.type() == TokenType.KEYWORD && FrugalKeywords.CONTAINER_TYPES.contains(token.text());
    }

    private boolean isTypeStart(Token token) {
        return token.type() == TokenType.IDENTIFIER || token.type() == TokenType.BASE_TYPE || isContainerStart(token);
    }

    private boolean isFieldStart(Token token) {
        return token.type() == TokenType.INTEGER || token.is("required") || token.is("optional") || isTypeStart(token);
    }

    private boolean isFunctionStart(Token token) {
        return token.is("oneway") || token.is("void") || isTypeStart(token);
    }

    private boolean isConstValueStart(Token token) {
        return switch (token.type()) {
            case INTEGER, DOUBLE, STRING, IDENTIFIER, LEFT_BRACKET, LEFT_BRACE -> true;
            default -> false;
        };
    }

    // --- Node construction -----------------------------------------------------------------

    private TreeNode start(NodeKind kind) {
        Token token = peek();
        return TreeNode.branch(kind, token.offset(), new SourcePoint(token.line(), token.column()));
    }

    private TreeNode leaf(Token token) {
        return leaf(token, kindOf(token.type()));
    }

    private TreeNode leaf(Token token, NodeKind kind) {
        return TreeNode.leaf(kind, token.offset(), token.endOffset(),
                new SourcePoint(token.line(), token.column()),
                new SourcePoint(token.line(), token.endColumn()));
    }

    private static NodeKind kindOf(TokenType type) {
        return switch (type) {
            case IDENTIFIER -> NodeKind.IDENTIFIER;
            case INTEGER -> NodeKind.INTEGER;
            case DOUBLE -> NodeKind.DOUBLE;
            case STRING -> NodeKind.LITERAL_STRING;
            case KEYWORD -> NodeKind.KEYWORD;
            case BASE_TYPE -> NodeKind.BASE_TYPE;
            default -> NodeKind.PUNCTUATION;
        };
    }

    // --- Token cursor ----------------------------------------------------------------------

    private boolean checkWord(String word) {
        return peek().is(word);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }
}
