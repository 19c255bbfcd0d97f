package no.cantara.siren.project;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Project settings from {@code siren/siren.config.yaml}.
 *
 * @param projectName display name of the project
 * @param parallel    extract files on a parallel stream
 */
public record SirenConfig(String projectName, boolean parallel) {

    public static final String DEFAULT_PROJECT_NAME = "Siren Project";

    // SafeConstructor keeps YAML tags from instantiating arbitrary Java types.
    private static final Yaml YAML = new Yaml(new SafeConstructor(new LoaderOptions()));

    public static SirenConfig defaults() {
        return new SirenConfig(DEFAULT_PROJECT_NAME, true);
    }

    /**
     * Reads the config file, or returns {@link #defaults()} when it does not exist.
     *
     * @throws IllegalArgumentException if the file is not a YAML mapping with the expected value types
     * @throws org.yaml.snakeyaml.error.YAMLException if the file is not valid YAML
     */
    public static SirenConfig load(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            return defaults();
        }
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is);
        }
    }

    public static SirenConfig parse(InputStream is) {
        Object data = YAML.load(is);
        if (data == null) {
            return defaults();
        }
        if (!(data instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("Expected a mapping at the top level of the config file");
        }
        return fromMap(map);
    }

    static SirenConfig fromMap(Map<?, ?> data) {
        Object name = data.get("project_name");
        Object parallel = data.get("parallel");
        if (parallel != null && !(parallel instanceof Boolean)) {
            throw new IllegalArgumentException("'parallel' must be true or false, was: " + parallel);
        }
        return new SirenConfig(
                name != null ? name.toString() : DEFAULT_PROJECT_NAME,
                parallel == null || (Boolean) parallel
        );
    }
}
