package com.polysearch.search.provider;

import org.springframework.web.util.UriBuilder;

import java.net.URI;
import java.util.HashMap;
import java.util.Map;

/**
 * Appends query parameters as URI variables, so names and values are strictly encoded and
 * characters such as {@code +}, {@code &} or braces reach the upstream unchanged.
 */
final class QueryParams {

    private QueryParams() {
    }

    static URI build(UriBuilder uriBuilder, String path, Map<String, String> params) {
        uriBuilder.path(path);
        Map<String, Object> variables = new HashMap<>();
        int i = 0;
        for (Map.Entry<String, String> e : params.entrySet()) {
            uriBuilder.queryParam("{n" + i + "}", "{v" + i + "}");
            variables.put("n" + i, e.getKey());
            variables.put("v" + i, e.getValue());
            i++;
        }
        return uriBuilder.build(variables);
    }
}
