package eu.fbk.amr2rdf;

import java.io.IOException;

import javax.annotation.Nullable;

/**
 * Signals the failure of an external collaborator, such as a remote text-to-AMR service.
 * <p>
 * The failure is terminal for the request that triggered it: callers receive this exception
 * and no output is fabricated in place of the missing input.
 * </p>
 */
public class UpstreamUnavailableException extends IOException {

    private static final long serialVersionUID = 1L;

    @Nullable
    private final String service;

    public UpstreamUnavailableException(@Nullable final String service,
            @Nullable final String message) {
        this(service, message, null);
    }

    public UpstreamUnavailableException(@Nullable final String service,
            @Nullable final String message, @Nullable final Throwable cause) {
        super((service == null ? "" : "[" + service + "] ") + message, cause);
        this.service = service;
    }

    /**
     * Returns the name or URL of the service that failed, if known.
     *
     * @return the service, possibly null
     */
    @Nullable
    public String getService() {
        return this.service;
    }

}
