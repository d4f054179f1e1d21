package com.polysearch.search.cache;

import com.polysearch.search.provider.ProviderBinding;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public final class CacheKeys {

    private CacheKeys() {
    }

    public static String searchKey(
            List<ProviderBinding> bindings,
            String query,
            int page,
            int perPage,
            Map<String, String> extra
    ) {
        StringBuilder key = new StringBuilder("polysearch:search:");
        for (int i = 0; i < bindings.size(); i++) {
            ProviderBinding binding = bindings.get(i);
            if (i > 0) {
                key.append(',');
            }
            key.append(encode(binding.provider().cacheScope()))
                    .append('@').append(binding.weight())
                    .append('/').append(binding.hasTimeout() ? binding.timeoutMs() : "-");
        }
        key.append(":q:").append(encode(query == null ? "" : query))
                .append(":page:").append(page)
                .append(":per:").append(perPage);
        if (extra != null && !extra.isEmpty()) {
            key.append(":extra");
            for (Map.Entry<String, String> e : new TreeMap<>(extra).entrySet()) {
                key.append(':').append(encode(e.getKey())).append('=').append(encode(e.getValue() == null ? "" : e.getValue()));
            }
        }
        return key.toString();
    }

    private static String encode(String value) {
        return Base64.getUrlEncoder().withoutPadding()
                .encodeToString(value.getBytes(StandardCharsets.UTF_8));
    }
}
