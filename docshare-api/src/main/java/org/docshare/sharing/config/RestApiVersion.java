package org.docshare.sharing.config;

public interface RestApiVersion {

    String API_VERSION = "v1";
    String API_PREFIX = "/api/" + API_VERSION;

    String ENDPOINT_PERMISSIONS = "/permissions";
    String ENDPOINT_DOCUMENTS = "/documents";
}
