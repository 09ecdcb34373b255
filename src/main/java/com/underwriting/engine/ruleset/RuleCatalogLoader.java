package com.underwriting.engine.ruleset;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.underwriting.engine.domain.Rule;
import com.underwriting.engine.domain.RuleCatalog;
import com.underwriting.engine.domain.RuleConfiguration;
import com.underwriting.engine.domain.RuleType;
import com.underwriting.engine.util.AlertLogger;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Loads rule catalogs from configuration files.
 * <p>
 * Each {@link RuleType} has one file named after {@link RuleType#getFileBaseName()}
 * with a {@code .json}, {@code .yaml} or {@code .yml} extension. Files are
 * looked up in {@code app.rules.config-dir} first and on the classpath under
 * {@code rules/} second. A type without any file yields an empty catalog.
 * <p>
 * A catalog is validated as a whole before any rule is mapped; an invalid
 * file fails with {@link RuleLoadException} carrying every error found.
 */
@ApplicationScoped
public class RuleCatalogLoader {

    private static final Logger LOG = Logger.getLogger(RuleCatalogLoader.class);

    static final String CLASSPATH_PREFIX = "rules/";
    private static final List<String> EXTENSIONS = List.of(".json", ".yaml", ".yml");

    @ConfigProperty(name = "app.rules.config-dir")
    Optional<String> configDir = Optional.empty();

    @ConfigProperty(name = "app.rules.classpath-fallback.enabled", defaultValue = "true")
    boolean classpathFallbackEnabled = true;

    @Inject
    RuleValidator validator;

    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    /**
     * Loads all catalogs into a new configuration snapshot.
     *
     * @throws RuleLoadException if any catalog fails; nothing is returned partially
     */
    public RuleConfiguration loadAll() {
        Map<RuleType, RuleCatalog> catalogs = new EnumMap<>(RuleType.class);
        for (RuleType type : RuleType.values()) {
            catalogs.put(type, load(type));
        }
        return new RuleConfiguration(catalogs, Instant.now());
    }

    public RuleCatalog load(RuleType type) {
        Optional<JsonNode> document = readDocument(type);
        if (document.isEmpty()) {
            LOG.warnf("No configuration found for %s rules, using an empty catalog", type.getValue());
            return RuleCatalog.empty(type);
        }
        return parseCatalog(type, document.get());
    }

    /**
     * Validates and maps one catalog document.
     */
    public RuleCatalog parseCatalog(RuleType type, JsonNode document) {
        if (document == null || !document.isObject()) {
            throw new RuleLoadException(type, "Catalog for " + type.getValue() + " must be a JSON object");
        }

        JsonNode rulesNode = document.path(type.getListProperty());
        if (rulesNode.isMissingNode() || rulesNode.isNull()) {
            rulesNode = jsonMapper.createArrayNode();
        }

        ValidationResult validation = validator.validateBatch(type, rulesNode);
        for (ValidationIssue warning : validation.getWarnings()) {
            LOG.warnf("Rule configuration warning in %s: %s", type.getValue(), warning);
        }
        if (!validation.isValid()) {
            List<ValidationIssue> errors = validation.getErrors();
            AlertLogger.invalidRuleConfiguration(type.getValue(), errors.size(), errors.get(0).toString());
            throw new RuleLoadException(type,
                    "Invalid " + type.getValue() + " rule configuration: " + errors.size() + " error(s)", errors);
        }

        List<Rule> rules = new ArrayList<>(rulesNode.size());
        for (JsonNode ruleNode : rulesNode) {
            try {
                rules.add(jsonMapper.treeToValue(ruleNode, Rule.class));
            } catch (JsonProcessingException e) {
                throw new RuleLoadException(type,
                        "Failed to map rule " + ruleNode.path("id").asText() + ": " + e.getOriginalMessage(), e);
            }
        }

        RuleCatalog catalog = new RuleCatalog(type,
                document.path("version").asText("1.0.0"),
                document.path("lastModified").asText(null),
                rules);
        LOG.infof("Loaded %s catalog v%s with %d rule(s)", type.getValue(), catalog.getVersion(), catalog.size());
        return catalog;
    }

    private Optional<JsonNode> readDocument(RuleType type) {
        Optional<JsonNode> fromDir = configDir
                .filter(dir -> !dir.isBlank())
                .flatMap(dir -> readFromDirectory(type, Path.of(dir)));
        if (fromDir.isPresent() || !classpathFallbackEnabled) {
            return fromDir;
        }
        return readFromClasspath(type);
    }

    private Optional<JsonNode> readFromDirectory(RuleType type, Path dir) {
        for (String extension : EXTENSIONS) {
            Path file = dir.resolve(type.getFileBaseName() + extension);
            if (Files.isRegularFile(file)) {
                LOG.debugf("Reading %s rules from %s", type.getValue(), file);
                try (InputStream in = Files.newInputStream(file)) {
                    return Optional.of(mapperFor(extension).readTree(in));
                } catch (IOException e) {
                    throw new RuleLoadException(type, "Failed to read " + file + ": " + e.getMessage(), e);
                }
            }
        }
        return Optional.empty();
    }

    private Optional<JsonNode> readFromClasspath(RuleType type) {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = RuleCatalogLoader.class.getClassLoader();
        }
        for (String extension : EXTENSIONS) {
            String resource = CLASSPATH_PREFIX + type.getFileBaseName() + extension;
            try (InputStream in = classLoader.getResourceAsStream(resource)) {
                if (in != null) {
                    LOG.debugf("Reading %s rules from classpath:%s", type.getValue(), resource);
                    return Optional.of(mapperFor(extension).readTree(in));
                }
            } catch (IOException e) {
                throw new RuleLoadException(type, "Failed to read classpath:" + resource + ": " + e.getMessage(), e);
            }
        }
        return Optional.empty();
    }

    private ObjectMapper mapperFor(String extension) {
        return ".json".equals(extension) ? jsonMapper : yamlMapper;
    }
}
