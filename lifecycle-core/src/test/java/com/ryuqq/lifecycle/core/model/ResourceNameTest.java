package com.ryuqq.lifecycle.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ResourceName, ResourceType, ResourceId 검증 테스트.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
class ResourceNameTest {

    @Test
    void resourceName_ValidValue_ToStringIsRawValue() {
        ResourceName name = ResourceName.of("remote_stack");

        assertEquals("remote_stack", name.getValue());
        assertEquals("remote_stack", name.toString());
        assertEquals(ResourceName.of("remote_stack"), name);
    }

    @Test
    void resourceName_InvalidValues_ThrowException() {
        assertThrows(IllegalArgumentException.class, () -> ResourceName.of(null));
        assertThrows(IllegalArgumentException.class, () -> ResourceName.of(""));
        assertThrows(IllegalArgumentException.class, () -> ResourceName.of("remote stack"));
        assertThrows(IllegalArgumentException.class, () -> ResourceName.of("a".repeat(256)));
    }

    @Test
    void resourceType_AllowsHeatStyleNames() {
        assertEquals("OS::Neutron::FirewallPolicy", ResourceType.of("OS::Neutron::FirewallPolicy").getValue());
    }

    @Test
    void resourceType_InvalidValues_ThrowException() {
        assertThrows(IllegalArgumentException.class, () -> ResourceType.of(" "));
        assertThrows(IllegalArgumentException.class, () -> ResourceType.of("OS::Heat Stack"));
        assertThrows(IllegalArgumentException.class, () -> ResourceType.of("x".repeat(101)));
    }

    @Test
    void resourceId_EqualityByValue() {
        assertEquals(ResourceId.of("abc"), ResourceId.of("abc"));
        assertNotEquals(ResourceId.of("abc"), ResourceId.of("abd"));
        assertThrows(IllegalArgumentException.class, () -> ResourceId.of(" "));
    }
}
