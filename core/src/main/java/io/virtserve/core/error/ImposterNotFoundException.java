package io.virtserve.core.error;

/** Thrown by admin mutations that address a port with no imposter. */
public final class ImposterNotFoundException extends VirtServeException {

    private static final long serialVersionUID = 1L;

    public ImposterNotFoundException(int port) {
        super("No imposter registered on port " + port, String.valueOf(port), Phase.ADMIN);
    }
}
