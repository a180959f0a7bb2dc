package com.rev.saas.engine.service.decision;

import java.util.Locale;

/**
 * Derives a display company name from a website URL: "https://www.acme.io/pricing" gives "Acme".
 */
public final class CompanyNames {

    public static final String UNKNOWN = "Unknown Company";

    private CompanyNames() {
    }

    public static String fromUrl(String websiteUrl) {
        if (websiteUrl == null) return UNKNOWN;
        String host = websiteUrl.trim().toLowerCase(Locale.ROOT);
        int scheme = host.indexOf("://");
        if (scheme >= 0) host = host.substring(scheme + 3);
        if (host.startsWith("www.")) host = host.substring(4);

        for (char stop : new char[]{'/', '?', '#', ':'}) {
            int idx = host.indexOf(stop);
            if (idx >= 0) host = host.substring(0, idx);
        }
        int dot = host.indexOf('.');
        String name = dot >= 0 ? host.substring(0, dot) : host;
        if (name.isEmpty()) return UNKNOWN;
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }
}
