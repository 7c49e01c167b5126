package org.carball.deckforge.ontology;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Reads the YAML registry tables shipped under {@code /registry} on the classpath.
 */
@Slf4j
final class RegistryLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private RegistryLoader() {
    }

    /**
     * @throws IllegalStateException when the resource is missing or malformed
     */
    static <T> List<T> loadList(String resource, Class<T> elementType) {
        JavaType listType = YAML_MAPPER.getTypeFactory().constructCollectionType(List.class, elementType);
        try (InputStream in = RegistryLoader.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Registry resource not found: " + resource);
            }
            List<T> entries = YAML_MAPPER.readValue(in, listType);
            log.debug("Loaded {} {} entries from {}", entries.size(), elementType.getSimpleName(), resource);
            return List.copyOf(entries);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load registry " + resource + ": " + e.getMessage(), e);
        }
    }
}
