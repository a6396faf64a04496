package org.tanzu.vcenterperf.inventory;

import org.junit.jupiter.api.Test;
import org.tanzu.vcenterperf.session.VSphereSession;
import org.tanzu.vcenterperf.vcenter.FakeVimApi;
import org.tanzu.vcenterperf.vcenter.RunCancelledException;
import org.tanzu.vcenterperf.vcenter.VimFaultException;
import org.tanzu.vcenterperf.vcenter.VimTransportException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InventoryEnumeratorTest {

    private final InventoryEnumerator enumerator = new InventoryEnumerator();

    private static VSphereSession sessionOf(FakeVimApi vim) {
        return new VSphereSession(vim, "admin", FakeVimApi.SESSION_ID, FakeVimApi.CONTENT);
    }

    @Test
    void listsVirtualMachinesInServerOrder() {
        FakeVimApi vim = new FakeVimApi()
                .withVm("vm-1", "web-01")
                .withVm("vm-2", "db-01");

        List<VirtualMachineRef> vms = enumerator.listVirtualMachines(sessionOf(vim));

        assertThat(vms).extracting(VirtualMachineRef::getName).containsExactly("web-01", "db-01");
        assertThat(vms.get(0).getReference()).isEqualTo(FakeVimApi.vmRef("vm-1"));
        assertThat(vim.viewsCreated).hasValue(1);
        assertThat(vim.viewsDestroyed).hasValue(1);
    }

    @Test
    void followsContinuationTokens() {
        FakeVimApi vim = new FakeVimApi().withPageSize(2);
        for (int i = 1; i <= 5; i++) {
            vim.withVm("vm-" + i, "vm" + i);
        }

        List<VirtualMachineRef> vms = enumerator.listVirtualMachines(sessionOf(vim));

        assertThat(vms).extracting(VirtualMachineRef::getName)
                .containsExactly("vm1", "vm2", "vm3", "vm4", "vm5");
    }

    @Test
    void emptyInventoryIsNotAnError() {
        FakeVimApi vim = new FakeVimApi();

        assertThat(enumerator.listVirtualMachines(sessionOf(vim))).isEmpty();
        assertThat(vim.viewsDestroyed).hasValue(1);
    }

    @Test
    void viewIsDestroyedWhenRetrievalFails() {
        FakeVimApi vim = new FakeVimApi()
                .withVm("vm-1", "web-01")
                .failRetrieve(new VimFaultException("ManagedObjectNotFound", 500, "view gone"));

        assertThatThrownBy(() -> enumerator.listVirtualMachines(sessionOf(vim)))
                .isInstanceOfSatisfying(InventoryException.class, e -> {
                    assertThat(e.getStep()).isEqualTo("inventory");
                    assertThat(e.getMessage()).startsWith("Error retrieving virtual machines");
                });
        assertThat(vim.viewsDestroyed).hasValue(1);
    }

    @Test
    void viewCreationFailureIsAnInventoryFailure() {
        FakeVimApi vim = new FakeVimApi()
                .failCreateView(new VimTransportException("Connection reset", null));

        assertThatThrownBy(() -> enumerator.listVirtualMachines(sessionOf(vim)))
                .isInstanceOf(InventoryException.class)
                .hasMessageStartingWith("Error creating container view");
        assertThat(vim.viewsDestroyed).hasValue(0);
    }

    @Test
    void cancellationIsNotWrapped() {
        FakeVimApi vim = new FakeVimApi().failRetrieve(new RunCancelledException("interrupted"));

        assertThatThrownBy(() -> enumerator.listVirtualMachines(sessionOf(vim)))
                .isInstanceOf(RunCancelledException.class);
    }
}
