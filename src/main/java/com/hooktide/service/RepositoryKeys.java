package com.hooktide.service;

import java.util.Locale;

/**
 * Normalizes repository URLs into registry lookup keys.
 *
 *   https://GitHub.com/Acme/Svc-A.git   → github.com/acme/svc-a
 *   git@github.com:acme/svc-a.git       → github.com/acme/svc-a
 *   ssh://git@gitlab.local:2222/a/b/    → gitlab.local/a/b
 *
 * Lower-cased, scheme, credentials and port removed, trailing ".git" and "/" removed.
 */
public final class RepositoryKeys {

    private RepositoryKeys() {
    }

    public static String normalize(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Repository URL must not be blank");
        }
        String key = url.trim().toLowerCase(Locale.ROOT);
        boolean hadScheme = false;

        int scheme = key.indexOf("://");
        if (scheme >= 0) {
            key = key.substring(scheme + 3);
            hadScheme = true;
        }

        int slash = key.indexOf('/');
        String authority = slash >= 0 ? key.substring(0, slash) : key;
        String path = slash >= 0 ? key.substring(slash) : "";

        int at = authority.lastIndexOf('@');
        if (at >= 0) {
            authority = authority.substring(at + 1);
        }

        int colon = authority.indexOf(':');
        if (colon >= 0) {
            String afterColon = authority.substring(colon + 1);
            if (!hadScheme && !afterColon.chars().allMatch(Character::isDigit)) {
                // scp-like syntax: host:owner/repo
                path = "/" + afterColon + path;
            }
            authority = authority.substring(0, colon);
        }

        key = authority + path;
        while (key.endsWith("/")) {
            key = key.substring(0, key.length() - 1);
        }
        if (key.endsWith(".git")) {
            key = key.substring(0, key.length() - ".git".length());
        }
        while (key.endsWith("/")) {
            key = key.substring(0, key.length() - 1);
        }
        return key;
    }
}
