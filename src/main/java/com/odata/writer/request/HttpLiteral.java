package com.odata.writer.request;

import lombok.experimental.UtilityClass;

/**
 * HTTP methods and header literals used when building request messages.
 */
@UtilityClass
public class HttpLiteral {
    public static final String GET = "GET";
    public static final String POST = "POST";
    public static final String PUT = "PUT";
    public static final String PATCH = "PATCH";
    public static final String MERGE = "MERGE";
    public static final String DELETE = "DELETE";

    public static final String CONTENT_ID = "Content-ID";
    public static final String CONTENT_TYPE = "Content-Type";
    public static final String IF_MATCH = "If-Match";
    public static final String ANY_ETAG = "*";

    public static boolean isUpdateOrDelete(String method) {
        return PUT.equalsIgnoreCase(method) || PATCH.equalsIgnoreCase(method)
                || MERGE.equalsIgnoreCase(method) || DELETE.equalsIgnoreCase(method);
    }
}
