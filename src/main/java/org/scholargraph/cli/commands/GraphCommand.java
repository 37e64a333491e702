package org.scholargraph.cli.commands;

import org.scholargraph.ScholarGraphEngine;
import org.scholargraph.analytics.GraphAnalytics;
import org.scholargraph.api.model.Graph;
import org.scholargraph.api.model.GraphKind;
import org.scholargraph.api.model.NodeMetrics;
import org.scholargraph.api.model.PaperTable;
import org.scholargraph.cli.CommandLineInterface;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "graph",
    description = "Build a citation or collaboration network and report its most important nodes"
)
public class GraphCommand implements Callable<Integer> {

    @Option(
        names = {"-t", "--type"},
        description = "Network type: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "CITATION"
    )
    private GraphKind kind;

    @Option(
        names = {"-y", "--years"},
        description = "Lookback window in years (default: filter.defaultLookbackYears)"
    )
    private Integer years;

    @Option(
        names = {"-n", "--top"},
        description = "Number of nodes to list, by importance (default: ${DEFAULT-VALUE})",
        defaultValue = "10"
    )
    private int top;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        try (ScholarGraphEngine engine = parent.openEngine()) {
            int window = years != null ? years : engine.defaultLookbackYears();
            PaperTable papers = engine.pipeline().filteredPapers(window);
            Graph graph = kind == GraphKind.CITATION
                ? engine.graphBuilder().buildCitationGraph(papers)
                : engine.graphBuilder().buildCollaborationGraph(papers);

            GraphAnalytics analytics = engine.analytics();
            Map<String, NodeMetrics> metrics = analytics.computeNodeMetrics(graph);
            Map<String, Integer> communities = analytics.detectCommunities(graph);

            List<Map.Entry<String, NodeMetrics>> ranked = new ArrayList<>(metrics.entrySet());
            ranked.sort(Comparator.comparingDouble((Map.Entry<String, NodeMetrics> e) -> e.getValue().importance())
                .reversed()
                .thenComparing(Map.Entry::getKey));

            List<Map<String, Object>> topNodes = new ArrayList<>();
            for (Map.Entry<String, NodeMetrics> entry : ranked.subList(0, Math.min(Math.max(top, 0), ranked.size()))) {
                NodeMetrics m = entry.getValue();
                Map<String, Object> node = new LinkedHashMap<>();
                node.put("id", entry.getKey());
                node.putAll(graph.attributes(entry.getKey()).asMap());
                node.put("degree", m.degree());
                node.put("degree_centrality", m.degreeCentrality());
                node.put("importance", m.importance());
                node.put("betweenness", m.betweenness());
                node.put("clustering", m.clustering());
                node.put("community", communities.get(entry.getKey()));
                topNodes.add(node);
            }

            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("type", kind.name().toLowerCase(Locale.ROOT));
            summary.put("lookback_years", window);
            summary.put("nodes", graph.nodeCount());
            summary.put("edges", graph.edgeCount());
            summary.put("communities", communities.values().stream().distinct().count());
            summary.put("community_detector", analytics.communityDetector().name());
            summary.put("top_nodes", topNodes);
            JsonOutput.print(spec.commandLine().getOut(), summary);
            return 0;
        }
    }
}
