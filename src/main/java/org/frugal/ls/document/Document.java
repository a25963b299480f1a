package org.frugal.ls.document;

import org.frugal.ls.frontend.parser.FrugalParser;
import org.frugal.ls.frontend.parser.ParseResult;
import org.frugal.ls.frontend.tree.SyntaxNode;
import org.frugal.ls.semantics.Symbol;
import org.frugal.ls.semantics.SymbolExtractor;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * A source document as seen by the analysis code: URI, text and the parse result.
 * Instances are immutable; symbols are derived from the tree on every call.
 */
public final class Document {

    /** File extensions treated as Frugal sources when no configuration is supplied. */
    public static final List<String> DEFAULT_EXTENSIONS = List.of(".frugal");

    private final String uri;
    private final String source;
    private final ParseResult parseResult;
    private final boolean analyzable;

    /**
     * Creates a document that is analyzable if its URI ends with {@code .frugal}.
     * @param uri The document URI.
     * @param source The document text.
     * @param parseResult The parse result, or {@code null} if the document was not parsed.
     */
    public Document(String uri, String source, ParseResult parseResult) {
        this(uri, source, parseResult, DEFAULT_EXTENSIONS);
    }

    /**
     * Creates a document.
     * @param uri The document URI.
     * @param source The document text.
     * @param parseResult The parse result, or {@code null} if the document was not parsed.
     * @param extensions The file extensions that make a document analyzable.
     */
    public Document(String uri, String source, ParseResult parseResult, Collection<String> extensions) {
        this.uri = Objects.requireNonNull(uri, "uri");
        this.source = source == null ? "" : source;
        this.parseResult = parseResult;
        this.analyzable = extensions.stream().anyMatch(uri::endsWith);
    }

    /**
     * Creates a document and parses it if it is analyzable.
     * @param uri The document URI.
     * @param source The document text.
     * @return The document.
     */
    public static Document parse(String uri, String source) {
        return parse(uri, source, DEFAULT_EXTENSIONS);
    }

    /**
     * Creates a document and parses it if its URI carries one of the given extensions.
     * @param uri The document URI.
     * @param source The document text.
     * @param extensions The file extensions that make a document analyzable.
     * @return The document; non-analyzable documents carry no parse result.
     */
    public static Document parse(String uri, String source, Collection<String> extensions) {
        boolean frugal = extensions.stream().anyMatch(uri::endsWith);
        return new Document(uri, source, frugal ? FrugalParser.parse(source) : null, extensions);
    }

    public String uri() {
        return uri;
    }

    public String source() {
        return source;
    }

    /**
     * Returns the parse result.
     * @return The parse result, or {@code null} if the document was never parsed.
     */
    public ParseResult parseResult() {
        return parseResult;
    }

    /**
     * Returns the root of the syntax tree.
     * @return The root, or {@code null} if there is no parse result or no tree.
     */
    public SyntaxNode tree() {
        return parseResult == null ? null : parseResult.root();
    }

    /**
     * Checks whether the document is a Frugal source that analysis should look at.
     * @return {@code true} if the URI carries one of the configured extensions.
     */
    public boolean isAnalyzable() {
        return analyzable;
    }

    /**
     * Extracts the top-level symbols of this document. Not cached.
     * @return The symbols in document order; empty if there is no tree.
     */
    public List<Symbol> symbols() {
        return SymbolExtractor.extractSymbols(tree(), source);
    }

    @Override
    public String toString() {
        return "Document[" + uri + "]";
    }
}
