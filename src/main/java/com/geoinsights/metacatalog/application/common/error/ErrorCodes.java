package com.geoinsights.metacatalog.application.common.error;

/**
 * {@link CatalogAdminException} 에러 코드 모음.
 */
public final class ErrorCodes {
    private ErrorCodes() {}

    public static final String PATH_NOT_FOUND = "PATH_NOT_FOUND";
    public static final String EXPORT_DIR_UNAVAILABLE = "EXPORT_DIR_UNAVAILABLE";
    public static final String PROVISION_FAILED = "PROVISION_FAILED";
    public static final String INVALID_COMMAND = "INVALID_COMMAND";
    public static final String CONFIRMATION_REQUIRED = "CONFIRMATION_REQUIRED";
    public static final String INVALID_XML = "INVALID_XML";
    public static final String HTTP_POST_FAILED = "HTTP_POST_FAILED";
    public static final String IO_ERROR = "IO_ERROR";
}
