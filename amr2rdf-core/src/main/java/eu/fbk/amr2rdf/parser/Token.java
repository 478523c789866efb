package eu.fbk.amr2rdf.parser;

import com.google.common.base.Preconditions;

/**
 * A lexical token of the Penman notation.
 */
final class Token {

    enum Type {
        OPEN,
        CLOSE,
        SLASH,
        ROLE,
        STRING,
        SYMBOL
    }

    private final Type type;

    private final String text;

    private final int offset;

    Token(final Type type, final String text, final int offset) {
        this.type = Preconditions.checkNotNull(type);
        this.text = Preconditions.checkNotNull(text);
        this.offset = offset;
    }

    Type getType() {
        return this.type;
    }

    String getText() {
        return this.text;
    }

    int getOffset() {
        return this.offset;
    }

    boolean is(final Type type) {
        return this.type == type;
    }

    @Override
    public String toString() {
        return this.type == Type.STRING ? "\"" + this.text + "\"" : this.text;
    }

}
