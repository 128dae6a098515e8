package org.tanzu.pvemcp.pve;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VmOperationTypeTest {

    private static VmInfo guest(String type, String status, boolean template) {
        return new VmInfo(101, "guest", "pve1", type, status, 0, 0, 1, 0, 0, template, "lab", false);
    }

    @Test
    void startNeedsAStoppedGuest() {
        assertTrue(VmOperationType.START.isEligible(guest(VmInfo.TYPE_QEMU, VmInfo.STATUS_STOPPED, false)));
        assertFalse(VmOperationType.START.isEligible(guest(VmInfo.TYPE_QEMU, VmInfo.STATUS_RUNNING, false)));
    }

    @Test
    void powerOperationsNeedARunningGuest() {
        VmInfo stopped = guest(VmInfo.TYPE_LXC, VmInfo.STATUS_STOPPED, false);
        VmInfo running = guest(VmInfo.TYPE_LXC, VmInfo.STATUS_RUNNING, false);

        for (VmOperationType type : new VmOperationType[] {
                VmOperationType.STOP, VmOperationType.SHUTDOWN, VmOperationType.REBOOT}) {
            assertTrue(type.isEligible(running), type.name());
            assertFalse(type.isEligible(stopped), type.name());
        }
    }

    @Test
    void resetOnlyAppliesToRunningQemuGuests() {
        assertTrue(VmOperationType.RESET.isEligible(guest(VmInfo.TYPE_QEMU, VmInfo.STATUS_RUNNING, false)));
        assertFalse(VmOperationType.RESET.isEligible(guest(VmInfo.TYPE_LXC, VmInfo.STATUS_RUNNING, false)));
    }

    @Test
    void templatesCanOnlyBeMigratedOrDeleted() {
        VmInfo template = guest(VmInfo.TYPE_QEMU, VmInfo.STATUS_STOPPED, true);

        assertFalse(VmOperationType.START.isEligible(template));
        assertTrue(VmOperationType.MIGRATE.isEligible(template));
        assertTrue(VmOperationType.DELETE.isEligible(template));
    }

    @Test
    void namesParseCaseInsensitively() {
        assertEquals(VmOperationType.SHUTDOWN, VmOperationType.fromName(" shutdown "));
        assertThrows(IllegalArgumentException.class, () -> VmOperationType.fromName("hibernate"));
    }
}
