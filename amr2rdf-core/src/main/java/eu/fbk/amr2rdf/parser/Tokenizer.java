package eu.fbk.amr2rdf.parser;

import java.util.List;
import java.util.Locale;

import com.google.common.collect.ImmutableList;

import eu.fbk.amr2rdf.MalformedInputException;

/**
 * Splits normalized Penman text into {@link Token}s. Tokens other than quoted strings are
 * lowercased.
 */
final class Tokenizer {

    private final String text;

    private int pos;

    private Tokenizer(final String text) {
        this.text = text;
        this.pos = 0;
    }

    static List<Token> tokenize(final String text) {
        return new Tokenizer(text).run();
    }

    private List<Token> run() {
        final ImmutableList.Builder<Token> builder = ImmutableList.builder();
        final int length = this.text.length();
        while (this.pos < length) {
            final char c = this.text.charAt(this.pos);
            if (Character.isWhitespace(c)) {
                ++this.pos;
            } else if (c == '(') {
                builder.add(new Token(Token.Type.OPEN, "(", this.pos++));
            } else if (c == ')') {
                builder.add(new Token(Token.Type.CLOSE, ")", this.pos++));
            } else if (c == '/') {
                builder.add(new Token(Token.Type.SLASH, "/", this.pos++));
            } else if (c == '"') {
                builder.add(readString());
            } else if (c == ':') {
                final int start = this.pos;
                builder.add(new Token(Token.Type.ROLE, readSymbol(), start));
            } else {
                final int start = this.pos;
                builder.add(new Token(Token.Type.SYMBOL, readSymbol(), start));
            }
        }
        return builder.build();
    }

    private Token readString() {
        final int start = this.pos;
        final int end = this.text.indexOf('"', start + 1);
        if (end < 0) {
            throw new MalformedInputException(this.text, start, "Unterminated string");
        }
        this.pos = end + 1;
        return new Token(Token.Type.STRING, this.text.substring(start + 1, end), start);
    }

    private String readSymbol() {
        final int start = this.pos;
        final int length = this.text.length();
        while (this.pos < length) {
            final char c = this.text.charAt(this.pos);
            if (Character.isWhitespace(c) || c == '(' || c == ')' || c == '"') {
                break;
            }
            if (c == '/' && !isRationalSlash(this.pos)) {
                break;
            }
            ++this.pos;
        }
        return this.text.substring(start, this.pos).toLowerCase(Locale.ROOT);
    }

    private boolean isRationalSlash(final int index) {
        return index > 0 && index + 1 < this.text.length()
                && Character.isDigit(this.text.charAt(index - 1))
                && Character.isDigit(this.text.charAt(index + 1));
    }

}
