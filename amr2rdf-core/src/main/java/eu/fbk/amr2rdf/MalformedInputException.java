package eu.fbk.amr2rdf;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

/**
 * Signals that an AMR text cannot be parsed at all.
 * <p>
 * This exception is thrown only for structurally unrecoverable input, such as an unmatched
 * closing parenthesis, an unterminated string or a text containing no AMR graph; other problems
 * are recovered locally by the parser and reported as {@link Diagnostic}s. No partial graph is
 * produced for a text that fails with this exception.
 * </p>
 */
public class MalformedInputException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String parsedString;

    private final int offset;

    /**
     * Creates a new instance with the parsed string, the error offset and the optional error
     * message specified.
     *
     * @param parsedString
     *            the parsed AMR text, for debugging purposes
     * @param offset
     *            the offset in the (normalized) text where the error was detected, or -1 if
     *            unknown
     * @param message
     *            an optional error message, to which the offset and parsed string are
     *            concatenated
     */
    public MalformedInputException(final String parsedString, final int offset,
            @Nullable final String message) {
        this(parsedString, offset, message, null);
    }

    /**
     * Creates a new instance with the parsed string, error offset, optional message and cause
     * specified.
     *
     * @param parsedString
     *            the parsed AMR text, for debugging purposes
     * @param offset
     *            the error offset, or -1 if unknown
     * @param message
     *            an optional error message
     * @param cause
     *            the optional cause of this exception
     */
    public MalformedInputException(final String parsedString, final int offset,
            @Nullable final String message, @Nullable final Throwable cause) {

        super(message + (offset < 0 ? "" : " (offset " + offset + ")")
                + (parsedString == null ? "" : "\nParsed string:\n\n" + parsedString), cause);

        Preconditions.checkNotNull(parsedString);
        this.parsedString = parsedString;
        this.offset = offset;
    }

    /**
     * Returns the parsed string. This property is intended for debugging purposes.
     *
     * @return the parsed string
     */
    public final String getParsedString() {
        return this.parsedString;
    }

    /**
     * Returns the offset where the error was detected.
     *
     * @return the offset, or -1 if unknown
     */
    public final int getOffset() {
        return this.offset;
    }

}
