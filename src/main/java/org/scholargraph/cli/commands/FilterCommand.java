package org.scholargraph.cli.commands;

import org.scholargraph.ScholarGraphEngine;
import org.scholargraph.api.model.PaperTable;
import org.scholargraph.cli.CommandLineInterface;
import org.scholargraph.filter.CorpusFilterPipeline;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "filter",
    description = "Filter the corpus to the configured institution and field and summarize the result"
)
public class FilterCommand implements Callable<Integer> {

    @Option(
        names = {"-y", "--years"},
        description = "Lookback window in years (default: filter.defaultLookbackYears)"
    )
    private Integer years;

    @Option(
        names = {"--ids"},
        description = "Include the filtered paper ids in the output"
    )
    private boolean includeIds;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        try (ScholarGraphEngine engine = parent.openEngine()) {
            int window = years != null ? years : engine.defaultLookbackYears();
            CorpusFilterPipeline pipeline = engine.pipeline();
            PaperTable papers = pipeline.filteredPapers(window);
            Map<String, Long> patents = pipeline.patentCounts(window);

            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("lookback_years", window);
            summary.put("criteria", pipeline.criteria().describe());
            summary.put("signature", pipeline.signature());
            summary.put("paper_count", papers.size());
            summary.put("min_year", papers.minYear().isPresent() ? papers.minYear().getAsInt() : null);
            summary.put("papers_with_patents", patents.values().stream().filter(count -> count > 0).count());
            if (includeIds) {
                summary.put("paper_ids", papers.paperIds());
            }
            JsonOutput.print(spec.commandLine().getOut(), summary);
            return 0;
        }
    }
}
