package com.newsdigest.backend.store;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.Optional;

/**
 * Partition keys are local dates written as {@code MM-dd-yyyy}.
 */
public final class PartitionDates {

    public static final String JSON_SUFFIX = ".json";
    public static final String DIGEST_PREFIX = "digest-";

    private static final DateTimeFormatter KEY_FORMAT =
            DateTimeFormatter.ofPattern("MM-dd-uuuu").withResolverStyle(ResolverStyle.STRICT);

    private PartitionDates() {
    }

    public static String format(LocalDate date) {
        return KEY_FORMAT.format(date);
    }

    public static Optional<LocalDate> parse(String key) {
        if (key == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(key, KEY_FORMAT));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    public static boolean isPartitionKey(String key) {
        return parse(key).isPresent();
    }

    /**
     * Partition key of a file name such as {@code 05-02-2024.json}
     */
    public static Optional<String> keyOfPartitionFile(String fileName) {
        if (fileName == null || !fileName.endsWith(JSON_SUFFIX)) {
            return Optional.empty();
        }
        String key = fileName.substring(0, fileName.length() - JSON_SUFFIX.length());
        return isPartitionKey(key) ? Optional.of(key) : Optional.empty();
    }

    /**
     * Partition key of a digest file name such as {@code digest-05-02-2024.json}
     */
    public static Optional<String> keyOfDigestFile(String fileName) {
        if (fileName == null || !fileName.startsWith(DIGEST_PREFIX)) {
            return Optional.empty();
        }
        return keyOfPartitionFile(fileName.substring(DIGEST_PREFIX.length()));
    }

    public static String digestFileName(String key) {
        return DIGEST_PREFIX + key + JSON_SUFFIX;
    }
}
