package eu.fbk.amr2rdf;

import javax.annotation.Nullable;

/**
 * Signals a failure in serializing an RDF graph, either because the requested format is not
 * supported or because the graph cannot be written in that format.
 * <p>
 * The failure concerns only the serialization call that raised it: the graph and the other
 * results of the translation remain valid and can be serialized again in another format.
 * </p>
 */
public class SerializationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SerializationException(@Nullable final String message) {
        super(message);
    }

    public SerializationException(@Nullable final String message,
            @Nullable final Throwable cause) {
        super(message, cause);
    }

}
