package no.cantara.siren.project;

import no.cantara.siren.SirenDecoder;
import no.cantara.siren.ir.IRContext;
import no.cantara.siren.parser.ParseError;
import no.cantara.siren.parser.ParseResult;
import no.cantara.siren.parser.SirenParserAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds, parses and decodes every {@code .siren} file under a project's
 * {@code siren/} directory.
 * <p>
 * Files are parsed and extracted independently, in parallel unless the config
 * turns it off. Cycle, duplicate and dangling-reference analysis runs once after
 * every file is done. Files with syntax errors are skipped with a warning.
 */
public class ProjectLoader {

    private static final Logger log = LoggerFactory.getLogger(ProjectLoader.class);

    public static final String SIREN_DIR = "siren";
    public static final String CONFIG_FILE = "siren.config.yaml";
    public static final String EXTENSION = ".siren";

    private final SirenParserAdapter parser;
    private final SirenDecoder decoder;

    public ProjectLoader(SirenParserAdapter parser) {
        this(parser, new SirenDecoder());
    }

    public ProjectLoader(SirenParserAdapter parser, SirenDecoder decoder) {
        this.parser = parser;
        this.decoder = decoder;
    }

    private record FileResult(Path file, ParseResult parseResult, SirenDecoder.Extraction extraction) {
    }

    public SirenProject load(Path rootDir) throws IOException {
        Path sirenDir = rootDir.resolve(SIREN_DIR);
        List<String> warnings = new ArrayList<>();
        SirenConfig config = loadConfig(rootDir, sirenDir.resolve(CONFIG_FILE), warnings);
        List<Path> files = findSirenFiles(sirenDir);
        log.debug("Loading {} files from {}", files.size(), sirenDir);

        List<FileResult> results;
        try (Stream<Path> stream = config.parallel() ? files.parallelStream() : files.stream()) {
            results = stream.map(file -> process(rootDir, file)).collect(Collectors.toList());
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }

        List<SirenDecoder.Extraction> extractions = new ArrayList<>();
        List<ParseError> parseErrors = new ArrayList<>();
        for (FileResult result : results) {
            if (result.extraction() == null) {
                String name = relativeName(rootDir, result.file());
                log.debug("Skipping {}: {} syntax error(s)", name, result.parseResult().errors().size());
                warnings.add("Warning: skipping " + name + " (parse error)");
                parseErrors.addAll(result.parseResult().errors());
            } else {
                extractions.add(result.extraction());
            }
        }
        IRContext ir = IRContext.fromExtractions(extractions);
        return new SirenProject(rootDir, sirenDir, config, files, ir, warnings, parseErrors);
    }

    private FileResult process(Path rootDir, Path file) {
        try {
            String source = Files.readString(file, StandardCharsets.UTF_8);
            ParseResult parseResult = parser.parse(source, relativeName(rootDir, file));
            if (!parseResult.success()) {
                return new FileResult(file, parseResult, null);
            }
            return new FileResult(file, parseResult, decoder.extract(parseResult.tree()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    private static SirenConfig loadConfig(Path rootDir, Path configFile, List<String> warnings) throws IOException {
        try {
            return SirenConfig.load(configFile);
        } catch (YAMLException | IllegalArgumentException e) {
            String name = relativeName(rootDir, configFile);
            log.debug("Ignoring {}: {}", name, e.getMessage());
            warnings.add("Warning: ignoring " + name + " (" + firstLine(e.getMessage()) + ")");
            return SirenConfig.defaults();
        }
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "invalid config";
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }

    /**
     * All {@code .siren} files below {@code dir}, sorted by path. A missing
     * directory has none.
     */
    public static List<Path> findSirenFiles(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(EXTENSION))
                    .sorted()
                    .toList();
        }
    }

    static String relativeName(Path rootDir, Path file) {
        return rootDir.relativize(file).toString().replace('\\', '/');
    }
}
