package org.tanzu.vcenterperf.inventory;

import org.tanzu.vcenterperf.vcenter.ManagedObjectReference;

import java.util.Objects;

/**
 * A virtual machine of the inventory: its managed object reference and display name.
 */
public final class VirtualMachineRef {

    private final ManagedObjectReference reference;
    private final String name;

    public VirtualMachineRef(ManagedObjectReference reference, String name) {
        this.reference = Objects.requireNonNull(reference, "reference");
        this.name = Objects.requireNonNull(name, "name");
    }

    public ManagedObjectReference getReference() { return reference; }

    public String getName() { return name; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VirtualMachineRef)) return false;
        VirtualMachineRef that = (VirtualMachineRef) o;
        return reference.equals(that.reference) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(reference, name);
    }

    @Override
    public String toString() {
        return name + " (" + reference.getValue() + ")";
    }
}
