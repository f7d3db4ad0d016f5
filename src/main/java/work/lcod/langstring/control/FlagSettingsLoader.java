package work.lcod.langstring.control;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.langstring.LangStringException;

/**
 * Reads {@link FlagSettings} from TOML, JSON or YAML documents shaped as
 *
 * <pre>
 * [global]
 * STRIP_TEXT = true
 *
 * [lang_string]
 * PRINT_WITH_QUOTES = false
 * </pre>
 *
 * Global entries are applied first (and cascade), scoped entries afterwards.
 */
public final class FlagSettingsLoader {
    private static final Logger log = LoggerFactory.getLogger(FlagSettingsLoader.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private FlagSettingsLoader() {}

    /**
     * Loads a settings file; {@code .json} files are read as JSON, {@code .yaml}/{@code .yml} as YAML,
     * anything else as TOML.
     */
    public static FlagSettings load(Path file) {
        if (file == null) {
            throw LangStringException.typeError("Settings file path cannot be null.");
        }
        String content;
        try {
            content = Files.readString(file);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read flag settings: " + file, ex);
        }
        String fileName = file.getFileName() == null ? "" : file.getFileName().toString().toLowerCase(Locale.ROOT);
        FlagSettings settings;
        if (fileName.endsWith(".json")) {
            settings = fromJson(content);
        } else if (fileName.endsWith(".yaml") || fileName.endsWith(".yml")) {
            settings = fromYaml(content);
        } else {
            settings = fromToml(content);
        }
        log.debug("Loaded flag settings from {}: {}", file, settings);
        return settings;
    }

    public static FlagSettings fromToml(String content) {
        TomlParseResult result = Toml.parse(content == null ? "" : content);
        if (result.hasErrors()) {
            throw new IllegalStateException("toml parse error: " + result.errors().get(0).toString());
        }
        List<Assignment> assignments = new ArrayList<>();
        for (Map.Entry<String, Object> section : result.entrySet()) {
            FlagNamespace namespace = FlagNamespace.fromConfigKey(section.getKey());
            if (!(section.getValue() instanceof TomlTable table)) {
                throw LangStringException.unexpectedType(section.getValue(), "a table of flags for '" + section.getKey() + "'");
            }
            for (Map.Entry<String, Object> entry : table.entrySet()) {
                assignments.add(assignment(namespace, entry.getKey(), entry.getValue()));
            }
        }
        return apply(assignments);
    }

    public static FlagSettings fromJson(String content) {
        return fromTree(JSON, "json", content);
    }

    public static FlagSettings fromYaml(String content) {
        return fromTree(YAML, "yaml", content);
    }

    private static FlagSettings fromTree(ObjectMapper mapper, String format, String content) {
        JsonNode root;
        try {
            root = mapper.readTree(content == null || content.isBlank() ? "{}" : content);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException(format + " parse error: " + ex.getOriginalMessage(), ex);
        }
        if (root == null || !root.isObject()) {
            throw LangStringException.unexpectedType(root, "a " + format + " mapping of flag tables");
        }
        List<Assignment> assignments = new ArrayList<>();
        for (Iterator<Map.Entry<String, JsonNode>> sections = root.fields(); sections.hasNext(); ) {
            var section = sections.next();
            FlagNamespace namespace = FlagNamespace.fromConfigKey(section.getKey());
            if (!section.getValue().isObject()) {
                throw LangStringException.unexpectedType(section.getValue(), "an object of flags for '" + section.getKey() + "'");
            }
            for (Iterator<Map.Entry<String, JsonNode>> fields = section.getValue().fields(); fields.hasNext(); ) {
                var field = fields.next();
                JsonNode value = field.getValue();
                assignments.add(assignment(namespace, field.getKey(), value.isBoolean() ? value.booleanValue() : value));
            }
        }
        return apply(assignments);
    }

    private static Assignment assignment(FlagNamespace namespace, String name, Object value) {
        Flag flag = namespace.requireFlag(name == null ? null : name.trim().toUpperCase(Locale.ROOT));
        if (!(value instanceof Boolean state)) {
            throw LangStringException.unexpectedType(value, "a boolean for " + flag.qualifiedName());
        }
        return new Assignment(flag, state);
    }

    private static FlagSettings apply(List<Assignment> assignments) {
        var builder = FlagSettings.builder();
        for (Assignment assignment : assignments) {
            if (assignment.flag() instanceof GlobalFlag) {
                builder.set(assignment.flag(), assignment.state());
            }
        }
        for (Assignment assignment : assignments) {
            if (!(assignment.flag() instanceof GlobalFlag)) {
                builder.set(assignment.flag(), assignment.state());
            }
        }
        return builder.build();
    }

    private record Assignment(Flag flag, boolean state) {}
}
