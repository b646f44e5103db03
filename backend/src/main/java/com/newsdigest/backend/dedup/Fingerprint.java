package com.newsdigest.backend.dedup;

import com.newsdigest.backend.model.json.IsoInstants;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;

/**
 * Stable identity of a news item: lowercase hex SHA-1 of the guid, else the link, else
 * {@code source + title + published} with the published instant in its stored text form.
 */
public final class Fingerprint {

    private Fingerprint() {
    }

    public static String of(String guid, String link, String source, String title, Instant publishedAt) {
        return sha1Hex(identityKey(guid, link, source, title, publishedAt));
    }

    static String identityKey(String guid, String link, String source, String title, Instant publishedAt) {
        if (guid != null && !guid.isBlank()) {
            return guid.trim();
        }
        if (link != null && !link.isBlank()) {
            return link.trim();
        }
        String published = publishedAt != null ? IsoInstants.format(publishedAt) : "";
        return nullToEmpty(source) + nullToEmpty(title) + published;
    }

    static String sha1Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-1
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
