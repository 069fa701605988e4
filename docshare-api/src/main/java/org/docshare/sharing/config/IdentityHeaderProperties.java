package org.docshare.sharing.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Names of the request headers set by the upstream authentication proxy.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "docshare.identity")
public class IdentityHeaderProperties {

    private String userIdHeader = "X-User-Id";

    private String emailHeader = "X-User-Email";

    private String rolesHeader = "X-User-Roles";

    private String assignmentsHeader = "X-User-Assignments";

    private String delegatedTeamsHeader = "X-Delegated-Teams";
}
