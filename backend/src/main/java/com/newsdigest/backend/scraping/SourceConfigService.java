package com.newsdigest.backend.scraping;

import com.newsdigest.backend.model.dto.SourceDefinition;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads the list of sources from the YAML configuration file
 */
@Service
@Slf4j
public class SourceConfigService {

    public List<SourceDefinition> loadSources(Path configPath) {
        Object root;
        try (InputStream inputStream = Files.newInputStream(configPath)) {
            root = new Yaml().load(inputStream);
        } catch (IOException | YAMLException e) {
            log.error("❌ Error loading source configuration from {}", configPath, e);
            throw new IllegalStateException("Failed to load source configuration from " + configPath, e);
        }

        if (!(root instanceof Map) || !(((Map<?, ?>) root).get("sources") instanceof List)) {
            throw new IllegalStateException("Source configuration " + configPath + " has no 'sources' list");
        }
        List<?> entries = (List<?>) ((Map<?, ?>) root).get("sources");

        List<SourceDefinition> sources = new ArrayList<>();
        for (Object entry : entries) {
            if (!(entry instanceof Map)) {
                log.warn("Ignoring malformed source entry: {}", entry);
                continue;
            }
            Map<?, ?> sourceData = (Map<?, ?>) entry;
            SourceDefinition source = createDefinitionFromMap(sourceData);
            if (source.getName() == null || source.getName().isBlank()) {
                log.warn("Ignoring source entry without a name: {}", sourceData);
                continue;
            }
            if (source.getUrls().isEmpty()) {
                log.warn("Source {} has no URLs", source.getName());
            }
            sources.add(source);
            log.info("Loaded source {} ({}, {} URLs)", source.getName(), source.getType(), source.getUrls().size());
        }

        log.info("Successfully loaded {} sources from {}", sources.size(), configPath);
        return sources;
    }

    private SourceDefinition createDefinitionFromMap(Map<?, ?> data) {
        SourceDefinition source = new SourceDefinition();
        Object name = data.get("name");
        source.setName(name != null ? name.toString().trim() : null);

        Object type = data.get("type");
        if (type != null && !type.toString().isBlank()) {
            source.setType(type.toString().trim());
        }

        List<String> urls = new ArrayList<>();
        Object rawUrls = data.containsKey("urls") ? data.get("urls") : data.get("url");
        if (rawUrls instanceof List) {
            ((List<?>) rawUrls).stream().filter(u -> u != null && !u.toString().isBlank()).forEach(u -> urls.add(u.toString().trim()));
        } else if (rawUrls != null && !rawUrls.toString().isBlank()) {
            urls.add(rawUrls.toString().trim());
        }
        source.setUrls(urls);
        return source;
    }
}
