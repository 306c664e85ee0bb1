package org.ndfcclient.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reads and validates YAML request documents.
 *
 * Unknown keys are rejected. Each item is checked against its Bean Validation
 * constraints and every violation is reported as {@code config[i].<field>: <message>}.
 */
@Component
public class ConfigFileReader {

    private static final Logger logger = LoggerFactory.getLogger(ConfigFileReader.class);

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    private final Validator validator;

    public ConfigFileReader(Validator validator) {
        this.validator = validator;
    }

    /**
     * Reads the request items of a YAML document.
     *
     * @param file YAML file
     * @param itemType Request item type
     * @return Validated request items, in document order
     * @throws IllegalArgumentException if the file cannot be read, is not a valid
     *         request document, or an item violates its constraints
     */
    public <T> List<T> read(Path file, Class<T> itemType) {
        if (!Files.isReadable(file)) {
            throw new IllegalArgumentException("Config file " + file + " does not exist or is not readable");
        }
        JavaType type = yamlMapper.getTypeFactory().constructParametricType(ConfigFile.class, itemType);
        ConfigFile<T> configFile;
        try {
            configFile = yamlMapper.readValue(file.toFile(), type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid config file " + file + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new IllegalArgumentException("Unable to read config file " + file + ": " + e.getMessage(), e);
        }
        if (configFile == null || configFile.getConfig() == null) {
            throw new IllegalArgumentException("Config file " + file + " must contain a 'config' list");
        }

        List<T> items = configFile.getConfig();
        List<String> violations = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            T item = items.get(i);
            if (item == null) {
                violations.add("config[" + i + "]: must not be empty");
                continue;
            }
            Set<ConstraintViolation<T>> itemViolations = validator.validate(item);
            for (ConstraintViolation<T> violation : itemViolations) {
                violations.add("config[" + i + "]." + yamlPath(itemType, violation.getPropertyPath()) + ": "
                        + violation.getMessage());
            }
        }
        if (!violations.isEmpty()) {
            violations.sort(null);
            throw new IllegalArgumentException("Invalid config file " + file + ": " + String.join("; ", violations));
        }
        logger.debug("Read {} {} item(s) from {}", items.size(), itemType.getSimpleName(), file);
        return items;
    }

    /**
     * Renders a violation path with the YAML key of its first property, for example
     * "vrf_vlan_id" instead of "vrfVlanId".
     */
    private String yamlPath(Class<?> itemType, jakarta.validation.Path propertyPath) {
        String path = propertyPath.toString();
        int end = path.length();
        for (int i = 0; i < path.length(); i++) {
            if (path.charAt(i) == '.' || path.charAt(i) == '[') {
                end = i;
                break;
            }
        }
        String property = path.substring(0, end);
        BeanDescription description = yamlMapper.getDeserializationConfig()
                .introspect(yamlMapper.constructType(itemType));
        for (BeanPropertyDefinition definition : description.findProperties()) {
            if (definition.getInternalName().equals(property)) {
                return definition.getName() + path.substring(end);
            }
        }
        return path;
    }
}
