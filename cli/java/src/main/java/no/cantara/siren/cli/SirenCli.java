package no.cantara.siren.cli;

import no.cantara.siren.parser.SirenParser;
import no.cantara.siren.parser.SirenParserAdapter;
import no.cantara.siren.project.ProjectLoader;
import no.cantara.siren.project.SirenProject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Command-line interface for Siren projects.
 * Usage: java -jar siren-cli.jar &lt;command&gt; [options]
 */
public class SirenCli {

    private static final Logger log = LoggerFactory.getLogger(SirenCli.class);

    public static final String VERSION = "0.1.0";

    private final SirenParserAdapter parser;
    private final PrintStream out;
    private final PrintStream err;

    public SirenCli(SirenParserAdapter parser, PrintStream out, PrintStream err) {
        this.parser = parser;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        SirenCli cli = new SirenCli(new SirenParser(), System.out, System.err);
        System.exit(cli.run(Path.of("").toAbsolutePath(), args));
    }

    /**
     * Runs one command against the project in {@code cwd}.
     *
     * @return process exit status
     */
    public int run(Path cwd, String... args) {
        if (args.length == 0) {
            printUsage(out);
            return 0;
        }
        String command = args[0];
        List<String> options = Arrays.asList(args).subList(1, args.length);
        if (command.equals("--version")) {
            out.println("Siren CLI v" + VERSION);
            return 0;
        }
        try {
            if (command.equals("init")) {
                return InitCommand.run(cwd, out);
            }
            SirenProject project = new ProjectLoader(parser).load(cwd);
            project.warnings().forEach(err::println);
            switch (command) {
                case "list":
                    return ListCommand.list(project, options.contains("-t") || options.contains("--tasks"), out);
                case "show":
                    if (options.isEmpty()) {
                        err.println("Missing entry id. Usage: siren show <entry-id>");
                        return 1;
                    }
                    return ListCommand.show(project, options.get(0), out, err);
                case "format":
                    return FormatCommand.run(project, parser, options.contains("--dry-run"),
                            options.contains("--verbose"), out, err);
                case "check":
                    return CheckCommand.run(project, options.contains("--json"), out);
                default:
                    err.println("Unknown command: " + command);
                    printUsage(err);
                    return 1;
            }
        } catch (IOException | UncheckedIOException e) {
            log.debug("Command '{}' failed", command, e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    static void printUsage(PrintStream stream) {
        stream.println("Siren CLI v" + VERSION);
        stream.println();
        stream.println("Usage: siren <command>");
        stream.println();
        stream.println("Commands:");
        stream.println("  init      Initialize a new Siren project in the current directory");
        stream.println("  list      List all milestone IDs from .siren files");
        stream.println("    -t, --tasks    Show incomplete tasks under each milestone");
        stream.println("  show      Show a single entry's dependency tree (milestone or task)");
        stream.println("  format    Rewrite .siren files in canonical layout, keeping comments");
        stream.println("    --dry-run      Print the result instead of writing files");
        stream.println("    --verbose      List the updated files and explain skipped ones");
        stream.println("  check     Report diagnostics; exits 1 on errors");
        stream.println("    --json         Print diagnostics as JSON");
        stream.println();
        stream.println("Options:");
        stream.println("  --version    Show version number");
    }
}
