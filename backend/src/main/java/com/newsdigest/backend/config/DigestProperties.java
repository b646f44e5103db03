package com.newsdigest.backend.config;

import java.nio.file.Path;
import java.time.ZoneId;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Output location, local timezone and clustering/summarization settings.
 */
@Component
@ConfigurationProperties(prefix = "digest")
@Data
public class DigestProperties {

    private String outputDir = "docs/news";
    private String timezone = "Asia/Ho_Chi_Minh";
    private double clusterThreshold = 0.75;
    private int itemsPerPartition = 15;
    private Ai ai = new Ai();

    public Path outputPath() {
        return Path.of(outputDir);
    }

    public ZoneId zoneId() {
        return ZoneId.of(timezone);
    }

    @Data
    public static class Ai {
        private String apiKey;
        private String baseUrl = "https://openrouter.ai/api";
        private String model = "xiaomi/mimo-v2-flash:free";
        private String language = "Vietnamese";
        private double temperature = 0.3;
    }
}
