package org.tanzu.pvemcp.pve;

import java.util.Locale;

/**
 * Lifecycle operations on a guest, with the state a guest must be in for the
 * operation to make sense.
 */
public enum VmOperationType {
    START("Start"),
    STOP("Stop"),
    SHUTDOWN("Shutdown"),
    REBOOT("Reboot"),
    RESET("Reset"),
    MIGRATE("Migrate"),
    DELETE("Delete");

    private final String label;

    VmOperationType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Checks whether the operation applies to the guest in its current state.
     * Templates can only be migrated or deleted.
     */
    public boolean isEligible(VmInfo vm) {
        if (vm.isTemplate() && this != MIGRATE && this != DELETE) {
            return false;
        }
        switch (this) {
            case START:
            case DELETE:
                return !vm.isRunning();
            case STOP:
            case SHUTDOWN:
            case REBOOT:
                return vm.isRunning();
            case RESET:
                return vm.isRunning() && vm.isQemu();
            case MIGRATE:
            default:
                return true;
        }
    }

    /**
     * Parses a label or constant name, case-insensitively.
     *
     * @throws IllegalArgumentException if the name matches no operation
     */
    public static VmOperationType fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toUpperCase(Locale.ROOT);
            for (VmOperationType type : values()) {
                if (type.name().equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown VM operation: " + name);
    }
}
