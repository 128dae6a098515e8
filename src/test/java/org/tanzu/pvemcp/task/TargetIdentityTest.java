package org.tanzu.pvemcp.task;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TargetIdentityTest {

    @Test
    void equalFieldsMeanEqualTargets() {
        TargetIdentity first = TargetIdentity.vm("lab", "pve1", 101);
        TargetIdentity second = new TargetIdentity("lab", "pve1", 101, ResourceKind.VM);

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void namesThatWouldCollideWhenJoinedStayDistinct() {
        TargetIdentity first = TargetIdentity.vm("a-b", "c", 100);
        TargetIdentity second = TargetIdentity.vm("a", "b-c", 100);

        assertNotEquals(first, second);

        Map<TargetIdentity, String> map = new HashMap<>();
        map.put(first, "one");
        map.put(second, "two");
        assertEquals(2, map.size());
    }

    @Test
    void nodeAndVmWithSameNamesDiffer() {
        assertNotEquals(TargetIdentity.node("lab", "pve1"), TargetIdentity.vm("lab", "pve1", 0));
    }

    @Test
    void nodeTargetsRequireResourceIdZero() {
        assertEquals(0, TargetIdentity.node("lab", "pve1").getResourceId());
        assertThrows(IllegalArgumentException.class,
                () -> new TargetIdentity("lab", "pve1", 5, ResourceKind.NODE));
    }

    @Test
    void nullFieldsAreRejected() {
        assertThrows(NullPointerException.class, () -> TargetIdentity.vm(null, "pve1", 100));
        assertThrows(NullPointerException.class, () -> TargetIdentity.vm("lab", null, 100));
    }
}
