package org.docshare.sharing.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Documents exposed by the in-memory catalog.
 * Maps to docshare.catalog.* properties in application.yml
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "docshare.catalog")
public class CatalogProperties {

    private List<DocumentSeed> documents = new ArrayList<>();

    @Data
    public static class DocumentSeed {

        private String id;

        private String title;

        private String team;

        private String ownerId;

        private Set<String> requiredRoles = new LinkedHashSet<>();

        private Set<String> assignedUserIds = new LinkedHashSet<>();
    }
}
