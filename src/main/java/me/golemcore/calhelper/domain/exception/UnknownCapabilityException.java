package me.golemcore.calhelper.domain.exception;

/**
 * Thrown when a capability name is not present in the registry.
 */
public class UnknownCapabilityException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String capabilityName;

    public UnknownCapabilityException(String capabilityName) {
        super("Unknown capability: " + capabilityName);
        this.capabilityName = capabilityName;
    }

    public String getCapabilityName() {
        return capabilityName;
    }
}
