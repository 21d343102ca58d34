package me.golemcore.calhelper.domain.exception;

/**
 * Thrown when a capability name is registered twice.
 */
public class DuplicateCapabilityException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String capabilityName;

    public DuplicateCapabilityException(String capabilityName) {
        super("Capability already registered: " + capabilityName);
        this.capabilityName = capabilityName;
    }

    public String getCapabilityName() {
        return capabilityName;
    }
}
