package org.tanzu.vcenterperf.vcenter;

import java.util.Objects;

/**
 * Reference to a server-side managed object, e.g. VirtualMachine "vm-42".
 */
public final class ManagedObjectReference {

    private final String type;
    private final String value;

    public ManagedObjectReference(String type, String value) {
        this.type = Objects.requireNonNull(type, "type");
        this.value = Objects.requireNonNull(value, "value");
    }

    public String getType() { return type; }

    public String getValue() { return value; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ManagedObjectReference)) return false;
        ManagedObjectReference that = (ManagedObjectReference) o;
        return type.equals(that.type) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        return type + ":" + value;
    }
}
