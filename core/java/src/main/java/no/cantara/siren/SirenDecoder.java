package no.cantara.siren;

import no.cantara.siren.cst.AttributeNode;
import no.cantara.siren.cst.DocumentNode;
import no.cantara.siren.cst.ExpressionNode;
import no.cantara.siren.cst.ExpressionNode.ArrayNode;
import no.cantara.siren.cst.ExpressionNode.LiteralNode;
import no.cantara.siren.cst.ExpressionNode.ReferenceNode;
import no.cantara.siren.cst.Origin;
import no.cantara.siren.cst.ResourceNode;
import no.cantara.siren.graph.DirectedGraph;
import no.cantara.siren.model.Attribute;
import no.cantara.siren.model.AttributeValue;
import no.cantara.siren.model.Cycle;
import no.cantara.siren.model.Diagnostic;
import no.cantara.siren.model.Diagnostic.CircularDependency;
import no.cantara.siren.model.Diagnostic.DanglingDependency;
import no.cantara.siren.model.Diagnostic.DuplicateId;
import no.cantara.siren.model.Diagnostic.ParseDiagnostic;
import no.cantara.siren.model.DiagnosticCode;
import no.cantara.siren.model.Document;
import no.cantara.siren.model.Resource;
import no.cantara.siren.model.ResourceType;
import no.cantara.siren.parser.ParseError;
import no.cantara.siren.parser.ParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns parsed Siren documents into resources and semantic diagnostics.
 * <p>
 * Decoding runs in two phases. {@link #extract(DocumentNode)} converts one document
 * and only reports problems local to a resource (W001, W002, W003). It has no shared
 * state and may run on many documents concurrently. {@link #analyze(List)} then runs
 * once over the merged resources of every document and reports cycles (W004),
 * duplicate ids (W006) and dangling references (W005).
 * <p>
 * Semantic problems never throw; they are returned as diagnostics.
 */
public class SirenDecoder {

    private static final Logger log = LoggerFactory.getLogger(SirenDecoder.class);

    static final String COMPLETE = "complete";

    /** Resources and local diagnostics of one document. */
    public record Extraction(List<Resource> resources, List<Diagnostic> diagnostics, String document) {
        public Extraction {
            resources = List.copyOf(resources);
            diagnostics = List.copyOf(diagnostics);
        }
    }

    /** Result of the global pass over merged resources. */
    public record Analysis(List<Cycle> cycles, List<Diagnostic> diagnostics) {
        public Analysis {
            cycles = List.copyOf(cycles);
            diagnostics = List.copyOf(diagnostics);
        }
    }

    private final Set<ResourceType> completableTypes;

    public SirenDecoder() {
        this(EnumSet.allOf(ResourceType.class));
    }

    /**
     * @param completableTypes resource types that may carry completion status
     */
    public SirenDecoder(Set<ResourceType> completableTypes) {
        this.completableTypes = completableTypes.isEmpty()
                ? EnumSet.noneOf(ResourceType.class)
                : EnumSet.copyOf(completableTypes);
    }

    public DecodeResult decode(DocumentNode cst) {
        if (cst == null) {
            return new DecodeResult(null, List.of());
        }
        return decodeAll(List.of(cst));
    }

    /**
     * Decodes a parse result, placing its syntax errors first as E001 diagnostics.
     * A partial tree is still decoded.
     */
    public DecodeResult decode(ParseResult parseResult) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (ParseError error : parseResult.errors()) {
            diagnostics.add(syntaxError(error));
        }
        if (parseResult.tree() == null) {
            return new DecodeResult(null, diagnostics);
        }
        DecodeResult decoded = decode(parseResult.tree());
        diagnostics.addAll(decoded.diagnostics());
        return new DecodeResult(decoded.document(), diagnostics);
    }

    /**
     * Extracts every document, then analyses their resources together.
     */
    public DecodeResult decodeAll(List<DocumentNode> documents) {
        List<Extraction> extractions = new ArrayList<>();
        for (DocumentNode document : documents) {
            extractions.add(extract(document));
        }
        return join(extractions);
    }

    /**
     * Merges extractions in the given order and runs the global analysis.
     */
    public static DecodeResult join(List<Extraction> extractions) {
        List<Resource> resources = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Extraction extraction : extractions) {
            resources.addAll(extraction.resources());
            diagnostics.addAll(extraction.diagnostics());
        }
        Analysis analysis = analyze(resources);
        diagnostics.addAll(analysis.diagnostics());
        String source = extractions.size() == 1 ? extractions.get(0).document() : null;
        return new DecodeResult(new Document(resources, analysis.cycles(), source), diagnostics);
    }

    public static Diagnostic syntaxError(ParseError error) {
        return new ParseDiagnostic(DiagnosticCode.E001, error.message(), error.document(),
                error.line(), Math.max(0, error.column() - 1));
    }

    public Extraction extract(DocumentNode cst) {
        List<Resource> resources = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (ResourceNode node : cst.resources()) {
            Optional<ResourceType> type = ResourceType.fromKeyword(node.resourceType());
            if (type.isEmpty()) {
                log.debug("Skipping resource '{}' of unknown type '{}'", node.identifier().value(), node.resourceType());
                continue;
            }
            resources.add(extractResource(node, type.get(), cst.document(), diagnostics));
        }
        log.debug("Extracted {} resources from {}", resources.size(), cst.document());
        return new Extraction(resources, diagnostics, cst.document());
    }

    private Resource extractResource(ResourceNode node, ResourceType type, String document, List<Diagnostic> diagnostics) {
        String id = node.identifier().value();
        Origin origin = node.origin() == null || node.origin().document() != null || document == null
                ? node.origin()
                : node.origin().withDocument(document);

        List<Attribute> attributes = new ArrayList<>();
        Attribute completeAttribute = null;
        for (AttributeNode attributeNode : node.body()) {
            Attribute attribute = convertAttribute(attributeNode);
            if (attribute.key().equals(COMPLETE)) {
                completeAttribute = attribute;
            }
            attributes.add(attribute);
        }

        boolean keyword = node.complete();
        boolean complete;
        if (!completableTypes.contains(type)) {
            if (keyword || completeAttribute != null) {
                diagnostics.add(notice(DiagnosticCode.W003, "Resource type '" + type.keyword()
                        + "' does not support the 'complete' keyword. It will be ignored.", origin));
            }
            complete = false;
        } else if (keyword) {
            complete = true;
            if (node.completeKeywordCount() > 1) {
                diagnostics.add(notice(DiagnosticCode.W002, "Resource '" + id
                        + "' has 'complete' keyword specified more than once. Only one is allowed; "
                        + "resource will be treated as complete: true.", origin));
            }
            if (completeAttribute != null && !isTrue(completeAttribute.value())) {
                diagnostics.add(notice(DiagnosticCode.W001, "Resource has both 'complete' keyword and a "
                        + "'complete' attribute whose value is not true. The resource will be treated as complete.", origin));
            }
        } else {
            complete = completeAttribute != null && isTrue(completeAttribute.value());
        }
        return new Resource(type, id, complete, attributes, origin);
    }

    private static boolean isTrue(AttributeValue value) {
        return value instanceof AttributeValue.BooleanValue bool && bool.value();
    }

    private static Attribute convertAttribute(AttributeNode node) {
        ExpressionNode expression = node.value();
        String raw = null;
        if (expression instanceof LiteralNode literal) {
            raw = literal.text();
        } else if (expression instanceof ReferenceNode reference) {
            raw = reference.identifier().text();
        }
        return new Attribute(node.key().value(), convertValue(expression), raw, node.origin());
    }

    static AttributeValue convertValue(ExpressionNode expression) {
        if (expression instanceof LiteralNode literal) {
            switch (literal.literalType()) {
                case STRING:
                    return AttributeValue.string(literal.value());
                case NUMBER:
                    return AttributeValue.NumberValue.of(literal.text());
                case BOOLEAN:
                    return AttributeValue.bool(Boolean.parseBoolean(literal.text()));
                default:
                    return AttributeValue.nullValue();
            }
        }
        if (expression instanceof ReferenceNode reference) {
            return AttributeValue.reference(reference.identifier().value());
        }
        ArrayNode array = (ArrayNode) expression;
        List<AttributeValue> elements = new ArrayList<>();
        for (ExpressionNode element : array.elements()) {
            elements.add(convertValue(element));
        }
        return new AttributeValue.ArrayValue(elements);
    }

    private static ParseDiagnostic notice(DiagnosticCode code, String message, Origin origin) {
        return new ParseDiagnostic(code, message, file(origin), line(origin), column(origin));
    }

    /**
     * Cycle, duplicate-id and dangling-reference detection over resources merged
     * from every document, in that diagnostic order.
     */
    public static Analysis analyze(List<Resource> resources) {
        Map<String, Resource> firstById = new LinkedHashMap<>();
        List<Diagnostic> duplicates = new ArrayList<>();
        for (Resource resource : resources) {
            Resource first = firstById.putIfAbsent(resource.id(), resource);
            if (first != null) {
                Origin origin = first.origin();
                duplicates.add(new DuplicateId(resource.id(), resource.type(),
                        file(resource.origin()), line(resource.origin()), column(resource.origin()),
                        file(origin), line(origin), column(origin)));
            }
        }

        DirectedGraph graph = new DirectedGraph();
        for (Resource resource : resources) {
            graph.addNode(resource.id());
            for (String dependency : resource.dependsOn()) {
                graph.addEdge(resource.id(), dependency);
            }
        }
        List<Cycle> cycles = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (List<String> nodes : graph.cycles()) {
            cycles.add(new Cycle(nodes));
            Origin origin = firstById.get(nodes.get(0)).origin();
            diagnostics.add(new CircularDependency(nodes, file(origin), line(origin), column(origin)));
        }
        diagnostics.addAll(duplicates);

        Set<String> reported = new LinkedHashSet<>();
        for (Resource resource : resources) {
            for (String dependency : resource.dependsOn()) {
                if (!firstById.containsKey(dependency) && reported.add(resource.id() + "\u0000" + dependency)) {
                    Origin origin = resource.origin();
                    diagnostics.add(new DanglingDependency(resource.id(), resource.type(), dependency,
                            file(origin), line(origin), column(origin)));
                }
            }
        }
        return new Analysis(cycles, diagnostics);
    }

    private static String file(Origin origin) {
        return origin != null ? origin.document() : null;
    }

    private static Integer line(Origin origin) {
        return origin != null ? origin.startRow() + 1 : null;
    }

    private static Integer column(Origin origin) {
        return origin != null ? origin.startColumn() : null;
    }
}
