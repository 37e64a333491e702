package org.scholargraph.cli.commands;

import org.scholargraph.ScholarGraphEngine;
import org.scholargraph.api.resources.store.CorpusTable;
import org.scholargraph.cli.CommandLineInterface;
import org.scholargraph.sample.SampleDatasetExporter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "export-sample",
    description = "Write the filtered corpus as the sample_*.parquet files read by the query command"
)
public class ExportSampleCommand implements Callable<Integer> {

    @Option(
        names = {"-y", "--years"},
        description = "Lookback window in years (default: filter.defaultLookbackYears)"
    )
    private Integer years;

    @Option(
        names = {"-o", "--output"},
        description = "Target directory (default: the query store's dataDirectory)"
    )
    private Path output;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        try (ScholarGraphEngine engine = parent.openEngine()) {
            int window = years != null ? years : engine.defaultLookbackYears();
            Path target = output != null ? output.toAbsolutePath() : engine.sampleDirectory();
            Map<CorpusTable, Long> counts = engine.sampleExporter().export(window, target);

            Map<String, Object> files = new LinkedHashMap<>();
            counts.forEach((table, rows) -> files.put(SampleDatasetExporter.SAMPLE_FILES.get(table), rows));
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("lookback_years", window);
            summary.put("directory", target.toString());
            summary.put("files", files);
            JsonOutput.print(spec.commandLine().getOut(), summary);
            return 0;
        }
    }
}
