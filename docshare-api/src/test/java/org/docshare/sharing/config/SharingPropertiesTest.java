package org.docshare.sharing.config;

import org.docshare.sharing.enums.Visibility;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SharingPropertiesTest {

    @Test
    void validate_withDefaultValues_noException() {
        SharingProperties props = new SharingProperties();
        assertDoesNotThrow(props::validate);
        assertEquals(50, props.getAuditTrailLimit());
        assertEquals("admin", props.getAdminRole());
        assertEquals("sub_admin", props.getDelegatedAdminRole());
        assertEquals(Visibility.RESTRICTED, props.getDefaultVisibility());
    }

    @Test
    void validate_withZeroAuditTrailLimit_throwsException() {
        SharingProperties props = new SharingProperties();
        props.setAuditTrailLimit(0);
        assertThrows(IllegalArgumentException.class, props::validate);
    }

    @Test
    void validate_withBlankAdminRole_throwsException() {
        SharingProperties props = new SharingProperties();
        props.setAdminRole(" ");
        assertThrows(IllegalArgumentException.class, props::validate);
    }

    @Test
    void validate_withNullDefaultVisibility_fallsBackToRestricted() {
        SharingProperties props = new SharingProperties();
        props.setDefaultVisibility(null);
        props.validate();
        assertEquals(Visibility.RESTRICTED, props.getDefaultVisibility());
    }

    @Test
    void clientProperties_withDefaultValues_noException() {
        PermissionClientProperties props = new PermissionClientProperties();
        assertDoesNotThrow(props::validate);
        assertEquals(Duration.ofSeconds(10), props.getTimeout());
    }

    @Test
    void clientProperties_withNegativeTimeout_throwsException() {
        PermissionClientProperties props = new PermissionClientProperties();
        props.setTimeout(Duration.ofSeconds(-1));
        assertThrows(IllegalArgumentException.class, props::validate);
    }

    @Test
    void clientProperties_withBlankBaseUrl_throwsException() {
        PermissionClientProperties props = new PermissionClientProperties();
        props.setBaseUrl("");
        assertThrows(IllegalArgumentException.class, props::validate);
    }
}
