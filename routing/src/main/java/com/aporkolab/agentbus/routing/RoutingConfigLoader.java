package com.aporkolab.agentbus.routing;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.agentbus.exception.ConfigurationException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

/**
 * Reads and writes routing topology documents in YAML.
 * 
 * Usage:
 * <pre>
 * RoutingConfigLoader loader = new RoutingConfigLoader();
 * MessageRoutingConfig config = loader.load(Path.of("config/routing.yaml"));
 * </pre>
 */
public class RoutingConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(RoutingConfigLoader.class);

    private final ObjectMapper yamlMapper;

    public RoutingConfigLoader() {
        this(new ObjectMapper(new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES))
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    public RoutingConfigLoader(ObjectMapper yamlMapper) {
        this.yamlMapper = yamlMapper;
    }

    /**
     * Load a topology, falling back to {@link MessageRoutingConfig#defaults()} if the
     * document cannot be read or is inconsistent.
     */
    public MessageRoutingConfig load(Path path) {
        try {
            MessageRoutingConfig config = read(path);
            log.info("Loaded routing configuration from {}", path);
            return config;
        } catch (ConfigurationException e) {
            log.error("Failed to load routing configuration: {}", e.getMessage(), e);
            log.info("Using default configuration");
            return MessageRoutingConfig.defaults();
        }
    }

    /**
     * Read a topology without fallback.
     *
     * @throws ConfigurationException if the document is missing, malformed or references unknown entries
     */
    public MessageRoutingConfig read(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, path.toString());
        } catch (IOException e) {
            throw ConfigurationException.unreadable(path.toString(), e);
        }
    }

    public MessageRoutingConfig read(InputStream in, String location) {
        RoutingDocument document;
        try {
            document = yamlMapper.readValue(in, RoutingDocument.class);
        } catch (IOException e) {
            throw ConfigurationException.unreadable(location, e);
        }
        if (document == null) {
            throw new ConfigurationException("Routing configuration at " + location + " is empty");
        }
        try {
            return document.toConfig(MessageRoutingConfig.defaults());
        } catch (ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw ConfigurationException.unreadable(location, e);
        }
    }

    /**
     * Persist the topology so that {@link #read(Path)} reproduces equivalent tables.
     *
     * @throws ConfigurationException if the file cannot be written
     */
    public void save(MessageRoutingConfig config, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(path)) {
                yamlMapper.writeValue(out, RoutingDocument.from(config));
            }
            log.info("Saved routing configuration to {}", path);
        } catch (IOException e) {
            throw ConfigurationException.unwritable(path.toString(), e);
        }
    }

    /**
     * Re-read {@code path} and swap the tables of {@code target} in place.
     * The current tables are kept if the document cannot be read.
     *
     * @return true if the tables were replaced
     */
    public boolean reload(MessageRoutingConfig target, Path path) {
        try {
            target.replaceWith(read(path));
            return true;
        } catch (ConfigurationException e) {
            log.error("Routing configuration reload from {} failed, keeping current tables: {}",
                    path, e.getMessage());
            return false;
        }
    }
}
