package com.bizplanner.orchestrator.util;

import com.bizplanner.orchestrator.exception.DefinitionLoadException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Reads YAML definition files from Spring resource locations.
 *
 * <p>Patterns ({@code classpath:agents/*.yaml}) are read in file-name order so
 * registration order is stable across platforms.
 */
@Slf4j
public final class YamlDefinitionReader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final PathMatchingResourcePatternResolver RESOLVER = new PathMatchingResourcePatternResolver();

    private YamlDefinitionReader() {
    }

    public static ObjectMapper mapper() {
        return YAML_MAPPER;
    }

    public static <T> T read(String location, Class<T> type) {
        Resource resource = RESOLVER.getResource(location);
        if (!resource.exists()) {
            throw new DefinitionLoadException("Definition not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            return YAML_MAPPER.readValue(in, type);
        } catch (IOException e) {
            throw new DefinitionLoadException("Failed to parse " + location, e);
        }
    }

    public static <T> List<T> readAll(String pattern, Class<T> type) {
        Resource[] resources;
        try {
            resources = RESOLVER.getResources(pattern);
        } catch (IOException e) {
            throw new DefinitionLoadException("Failed to resolve " + pattern, e);
        }

        Arrays.sort(resources, Comparator.comparing(r -> String.valueOf(r.getFilename())));

        List<T> result = new ArrayList<>();
        for (Resource resource : resources) {
            try (InputStream in = resource.getInputStream()) {
                result.add(YAML_MAPPER.readValue(in, type));
            } catch (IOException e) {
                throw new DefinitionLoadException("Failed to parse " + resource.getFilename(), e);
            }
        }
        log.debug("Read {} definitions from {}", result.size(), pattern);
        return result;
    }
}
