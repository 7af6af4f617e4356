package ippnotify.auth.util;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.HashMultimap;
import com.google.common.collect.Multimap;

import io.netty.handler.codec.http.HttpHeaders;

public class HttpHeaderUtils {

    public static Multimap<String,String> toMultimap(HttpHeaders headers) {
        Multimap<String,String> headerMultimap = HashMultimap.create();
        if (headers != null) {
            for (Map.Entry<String,String> e : headers.entries()) {
                // header names are case-insensitive
                headerMultimap.put(e.getKey().toLowerCase(), e.getValue());
            }
        }
        return headerMultimap;
    }

    public static String getSingleHeader(Multimap<String,String> headers, String headerName, boolean enforceOneValue) throws IllegalArgumentException {
        if (headers == null) {
            return null;
        } else {
            Set<String> values = new HashSet<>();
            values.addAll(headers.get(headerName));
            values.addAll(headers.get(headerName.toLowerCase()));
            if (values.size() > 1 && enforceOneValue) {
                throw new IllegalArgumentException(headerName + " was specified multiple times, which is not allowed");
            }
            return values.stream().findFirst().orElse(null);
        }
    }
}
