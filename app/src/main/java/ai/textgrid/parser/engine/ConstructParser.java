package ai.textgrid.parser.engine;

import ai.textgrid.parser.classify.Classification;
import ai.textgrid.parser.classify.ClassificationListener;
import ai.textgrid.parser.classify.ConstructClassifier;
import ai.textgrid.parser.cluster.CellCluster;
import ai.textgrid.parser.cluster.ClusterFinder;
import ai.textgrid.parser.cluster.MalformedClusterException;
import ai.textgrid.parser.construct.Construct;
import ai.textgrid.parser.construct.ConstructBuilder;
import ai.textgrid.parser.construct.DomainRegion;
import ai.textgrid.parser.construct.DomainStatus;
import ai.textgrid.parser.construct.TreeConstruct;
import ai.textgrid.parser.domain.TreeDomainResolver;
import ai.textgrid.parser.surface.CellRange;
import ai.textgrid.parser.surface.GridSurface;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the detection pipeline: clusters, classifies and builds every construct on a
 * surface, then resolves tree domains by parsing them again one level deeper.
 */
public class ConstructParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConstructParser.class);

    private final ParserSettings settings;
    private final ClusterFinder clusterFinder;
    private final ConstructClassifier classifier;
    private final ConstructBuilder builder;
    private final TreeDomainResolver domainResolver;

    public ConstructParser() {
        this(ParserSettings.defaults());
    }

    public ConstructParser(ParserSettings settings) {
        this(settings, ClassificationListener.NONE);
    }

    public ConstructParser(ParserSettings settings, ClassificationListener listener) {
        this(settings,
                new ClusterFinder(settings.adjacency()),
                new ConstructClassifier(settings.adjacency(), listener),
                new ConstructBuilder(settings.indentWidth()),
                new TreeDomainResolver(settings.maxNestingDepth(), settings.nestedMinCells()));
    }

    ConstructParser(ParserSettings settings,
                    ClusterFinder clusterFinder,
                    ConstructClassifier classifier,
                    ConstructBuilder builder,
                    TreeDomainResolver domainResolver) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clusterFinder = Objects.requireNonNull(clusterFinder, "clusterFinder");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.builder = Objects.requireNonNull(builder, "builder");
        this.domainResolver = Objects.requireNonNull(domainResolver, "domainResolver");
    }

    public ParserSettings settings() {
        return settings;
    }

    public ParseResult parse(GridSurface surface) {
        Objects.requireNonNull(surface, "surface");
        ParseRun run = new ParseRun();
        List<CellCluster> clusters = clusterFinder.findClusters(surface);
        List<Construct> constructs = new ArrayList<>();
        List<CellCluster> unclassified = new ArrayList<>();
        for (CellCluster cluster : clusters) {
            Optional<Construct> construct = run.detect(cluster, surface, 0);
            if (construct.isPresent()) {
                constructs.add(construct.get());
            } else {
                unclassified.add(cluster);
            }
        }
        LOGGER.info("Detected {} constructs in {} clusters ({} unclassified)",
                constructs.size(), clusters.size(), unclassified.size());
        return new ParseResult(constructs, clusters, unclassified, run.diagnostics);
    }

    /**
     * State of one {@link #parse} call. A nested tree re-resolves the domains of the descendants it
     * was built from, so nested results are cached by region and depth and each is parsed once.
     */
    private final class ParseRun {

        private final List<ParseDiagnostic> diagnostics = new ArrayList<>();
        private final Map<RegionKey, Optional<Construct>> nestedResults = new HashMap<>();

        private Optional<Construct> parseRegion(GridSurface region, int depth) {
            RegionKey key = new RegionKey(region.bounds(), depth);
            Optional<Construct> cached = nestedResults.get(key);
            if (cached != null) {
                return cached;
            }
            Optional<Construct> result = Optional.empty();
            for (CellCluster cluster : clusterFinder.findClusters(region)) {
                result = detect(cluster, region, depth);
                if (result.isPresent()) {
                    break;
                }
            }
            nestedResults.put(key, result);
            return result;
        }

        private Optional<Construct> detect(CellCluster cluster, GridSurface surface, int depth) {
            Optional<Classification> classification;
            try {
                classification = classifier.classify(cluster, surface);
            } catch (MalformedClusterException e) {
                LOGGER.error("Skipping malformed cluster {} at depth {}: {}", cluster.bounds(), depth, e.getMessage());
                diagnostics.add(new ParseDiagnostic(ParseDiagnostic.Kind.MALFORMED_CLUSTER, e.getMessage(),
                        cluster.bounds(), depth));
                return Optional.empty();
            }
            if (classification.isEmpty()) {
                return Optional.empty();
            }
            Construct construct = builder.build(cluster, surface, classification.get());
            if (construct instanceof TreeConstruct tree) {
                TreeConstruct resolved = domainResolver.resolve(tree, surface, depth, this::parseRegion);
                recordDepthLimits(resolved, depth, diagnostics);
                return Optional.of(resolved);
            }
            return Optional.of(construct);
        }
    }

    private record RegionKey(CellRange range, int depth) {
    }

    private static void recordDepthLimits(TreeConstruct tree, int depth, List<ParseDiagnostic> diagnostics) {
        for (DomainRegion domain : tree.domains().values()) {
            if (domain.status() != DomainStatus.DEPTH_LIMIT_EXCEEDED) {
                continue;
            }
            String parent = tree.element(domain.parentIndex()).content();
            diagnostics.add(new ParseDiagnostic(ParseDiagnostic.Kind.DEPTH_LIMIT_EXCEEDED,
                    "domain of '" + parent + "' not parsed", domain.range().orElse(tree.bounds()), depth + 1));
        }
    }
}
