package no.cantara.siren.cli;

import no.cantara.siren.ir.DependencyChains;
import no.cantara.siren.model.Resource;
import no.cantara.siren.project.SirenProject;

import java.io.PrintStream;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * {@code siren list [-t]} and {@code siren show <id>}.
 */
final class ListCommand {

    private ListCommand() {
    }

    static int list(SirenProject project, boolean showTasks, PrintStream out) {
        List<Resource> resources = project.ir().resources();
        for (String milestoneId : project.milestones()) {
            out.println(milestoneId);
            if (showTasks) {
                List<List<String>> chains = DependencyChains.incompleteLeafChains(milestoneId, resources);
                DependencyChainRenderer.render(chains).forEach(out::println);
            }
        }
        return 0;
    }

    static int show(SirenProject project, String entryId, PrintStream out, PrintStream err) {
        Resource resource;
        try {
            resource = project.ir().findResourceById(entryId);
        } catch (NoSuchElementException e) {
            err.println(e.getMessage());
            return 1;
        }
        List<List<String>> chains = DependencyChains.incompleteLeafChains(entryId, project.ir().resources());
        out.println(entryId);
        DependencyChainRenderer.render(chains, resource.dependsOn()).forEach(out::println);
        return 0;
    }
}
