package io.github.istanbulize.syntax;

/** Parses JavaScript source text into a {@link SyntaxTree}. */
public interface JsParser {

    /**
     * @param sourceText the text exactly as the engine evaluated it
     * @param sourceType whether module syntax is permitted
     * @throws SourceParseException if the text is not valid for the given source type
     */
    SyntaxTree parse(String sourceText, SourceType sourceType);
}
