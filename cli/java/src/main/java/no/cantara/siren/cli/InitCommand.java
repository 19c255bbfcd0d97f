package no.cantara.siren.cli;

import no.cantara.siren.project.ProjectLoader;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code siren init}: creates the {@code siren/} directory with a config file and an
 * empty {@code main.siren}. Existing files are left alone.
 */
final class InitCommand {

    static final String MAIN_FILE = "main.siren";
    static final String CONFIG_CONTENTS = "# project_name: Siren Project\n";

    record InitResult(List<String> created, List<String> skipped) {
    }

    private InitCommand() {
    }

    static InitResult init(Path cwd) throws IOException {
        List<String> created = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        Path sirenDir = cwd.resolve(ProjectLoader.SIREN_DIR);
        if (Files.exists(sirenDir)) {
            skipped.add(ProjectLoader.SIREN_DIR);
        } else {
            Files.createDirectories(sirenDir);
            created.add(ProjectLoader.SIREN_DIR);
        }
        createFile(sirenDir.resolve(ProjectLoader.CONFIG_FILE), CONFIG_CONTENTS,
                ProjectLoader.SIREN_DIR + "/" + ProjectLoader.CONFIG_FILE, created, skipped);
        createFile(sirenDir.resolve(MAIN_FILE), "",
                ProjectLoader.SIREN_DIR + "/" + MAIN_FILE, created, skipped);
        return new InitResult(created, skipped);
    }

    private static void createFile(Path file, String contents, String name,
                                   List<String> created, List<String> skipped) throws IOException {
        if (Files.exists(file)) {
            skipped.add(name);
        } else {
            Files.writeString(file, contents, StandardCharsets.UTF_8);
            created.add(name);
        }
    }

    static int run(Path cwd, PrintStream out) throws IOException {
        InitResult result = init(cwd);
        result.created().forEach(p -> out.println("Created " + p));
        result.skipped().forEach(p -> out.println("Skipped " + p + " (already exists)"));
        return 0;
    }
}
