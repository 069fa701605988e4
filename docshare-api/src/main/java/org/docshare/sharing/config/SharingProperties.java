package org.docshare.sharing.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.docshare.sharing.enums.Visibility;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for permission resolution and mutation.
 * Maps to docshare.sharing.* properties in application.yml
 */
@Slf4j
@Data
@Configuration
@ConfigurationProperties(prefix = "docshare.sharing")
public class SharingProperties {

    /**
     * Maximum number of entries kept in a document audit trail. Oldest entries are dropped first.
     */
    private int auditTrailLimit = 50;

    /**
     * Role granting full access to every document.
     */
    private String adminRole = "admin";

    /**
     * Role allowing access to documents of the teams listed in the caller's delegated teams.
     */
    private String delegatedAdminRole = "sub_admin";

    /**
     * Visibility of a permission record created on first access.
     */
    private Visibility defaultVisibility = Visibility.RESTRICTED;

    @PostConstruct
    public void validate() {
        if (auditTrailLimit <= 0) {
            throw new IllegalArgumentException(
                    "docshare.sharing.audit-trail-limit must be > 0. Current value: " + auditTrailLimit);
        }
        if (adminRole == null || adminRole.isBlank()) {
            throw new IllegalArgumentException("docshare.sharing.admin-role must not be blank");
        }
        if (defaultVisibility == null) {
            defaultVisibility = Visibility.RESTRICTED;
        }
        log.info("Audit trail limited to {} entries, administrator role is '{}', delegated administrator role is '{}'",
                auditTrailLimit, adminRole, delegatedAdminRole);
    }
}
