package no.cantara.siren.ir;

import no.cantara.siren.DecodeResult;
import no.cantara.siren.SirenDecoder;
import no.cantara.siren.cst.DocumentNode;
import no.cantara.siren.model.Cycle;
import no.cantara.siren.model.DependencyTree;
import no.cantara.siren.model.Diagnostic;
import no.cantara.siren.model.Document;
import no.cantara.siren.model.Resource;
import no.cantara.siren.model.ResourceType;
import no.cantara.siren.parser.ParseResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Immutable, queryable view of decoded resources together with their diagnostics.
 * <p>
 * {@link #allResources()} keeps every decoded resource, duplicates included, in
 * decode order. Queries run over {@link #resources()}, where the first resource
 * declaring an id wins.
 */
public final class IRContext {

    private final List<Resource> allResources;
    private final List<Resource> resources;
    private final Map<String, Resource> byId;
    private final List<Diagnostic> diagnostics;
    private final List<Cycle> cycles;
    private final String source;

    private IRContext(List<Resource> allResources, List<Diagnostic> diagnostics, List<Cycle> cycles, String source) {
        this.allResources = List.copyOf(allResources);
        Map<String, Resource> unique = new LinkedHashMap<>();
        for (Resource resource : allResources) {
            unique.putIfAbsent(resource.id(), resource);
        }
        this.byId = unique;
        this.resources = List.copyOf(unique.values());
        this.diagnostics = List.copyOf(diagnostics);
        this.cycles = List.copyOf(cycles);
        this.source = source;
    }

    /**
     * Context over already decoded resources; cycle, duplicate and dangling
     * reference diagnostics are computed here.
     */
    public static IRContext fromResources(List<Resource> resources) {
        SirenDecoder.Analysis analysis = SirenDecoder.analyze(resources);
        return new IRContext(resources, analysis.diagnostics(), analysis.cycles(), null);
    }

    public static IRContext fromCst(DocumentNode cst) {
        return fromDocument(new SirenDecoder().decode(cst));
    }

    public static IRContext fromParseResult(ParseResult parseResult) {
        return fromDocument(new SirenDecoder().decode(parseResult));
    }

    /**
     * Joins per-document extractions and analyses the merged resources.
     */
    public static IRContext fromExtractions(List<SirenDecoder.Extraction> extractions) {
        return fromDocument(SirenDecoder.join(extractions));
    }

    public static IRContext fromDocument(DecodeResult result) {
        Document document = result.document();
        if (document == null) {
            return new IRContext(List.of(), result.diagnostics(), List.of(), null);
        }
        return new IRContext(document.resources(), result.diagnostics(), document.cycles(), document.source());
    }

    public List<Resource> allResources() {
        return allResources;
    }

    public List<Resource> resources() {
        return resources;
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    public List<Cycle> cycles() {
        return cycles;
    }

    public String source() {
        return source;
    }

    /**
     * @throws NoSuchElementException if no resource has the id
     */
    public Resource findResourceById(String id) {
        Resource resource = byId.get(id);
        if (resource == null) {
            throw new NoSuchElementException("Resource with ID '" + id + "' not found");
        }
        return resource;
    }

    public List<String> getMilestoneIds() {
        List<String> ids = new ArrayList<>();
        for (Resource resource : resources) {
            if (resource.type() == ResourceType.MILESTONE) {
                ids.add(resource.id());
            }
        }
        return ids;
    }

    /**
     * For every milestone, the incomplete tasks at the bottom of its task-only
     * dependency tree: complete tasks and milestones are left out, and a task is
     * listed only when no incomplete task hangs below it.
     */
    public Map<String, List<Resource>> getTasksByMilestone() {
        TraversePredicate incompleteTasks = (resource, parent) -> {
            if (parent == null) {
                return TraversalControl.INCLUDE_AND_EXPAND;
            }
            return TraversalControl.of(resource.type() == ResourceType.TASK && !resource.complete());
        };
        Map<String, List<Resource>> tasksByMilestone = new LinkedHashMap<>();
        for (String milestoneId : getMilestoneIds()) {
            DependencyTree tree = DependencyTrees.build(milestoneId, resources, incompleteTasks);
            Map<String, Resource> leaves = new LinkedHashMap<>();
            for (DependencyTree child : tree.dependencies()) {
                collectLeaves(child, leaves);
            }
            tasksByMilestone.put(milestoneId, List.copyOf(leaves.values()));
        }
        return tasksByMilestone;
    }

    private static void collectLeaves(DependencyTree node, Map<String, Resource> leaves) {
        if (node.cycle() || node.missing()) {
            return;
        }
        boolean hasTaskBelow = false;
        for (DependencyTree child : node.dependencies()) {
            if (!child.cycle() && !child.missing()) {
                hasTaskBelow = true;
                collectLeaves(child, leaves);
            }
        }
        if (!hasTaskBelow) {
            leaves.putIfAbsent(node.id(), node.resource());
        }
    }

    /**
     * Listing view of {@code rootId}'s dependencies: complete resources are left
     * out and milestones other than the root are shown without their own
     * dependencies.
     */
    public DependencyTree getDependencyTree(String rootId) {
        return getDependencyTree(rootId, (resource, parent) -> {
            if (parent == null) {
                return TraversalControl.INCLUDE_AND_EXPAND;
            }
            if (resource.complete()) {
                return TraversalControl.EXCLUDE;
            }
            if (resource.type() == ResourceType.MILESTONE && !resource.id().equals(rootId)) {
                return TraversalControl.LEAF;
            }
            return TraversalControl.INCLUDE_AND_EXPAND;
        });
    }

    /**
     * @throws NoSuchElementException if no resource has id {@code rootId}
     */
    public DependencyTree getDependencyTree(String rootId, TraversePredicate predicate) {
        return DependencyTrees.build(rootId, resources, predicate);
    }
}
