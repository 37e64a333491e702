package org.scholargraph.cli.commands;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import org.scholargraph.ScholarGraphEngine;
import org.scholargraph.cli.CommandLineInterface;
import org.scholargraph.query.QueryOperation;
import org.scholargraph.query.QueryResponse;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "query",
    description = "Run an ad-hoc query against the sample dataset"
)
public class QueryCommand implements Callable<Integer> {

    private static final TypeReference<Map<String, Object>> PARAMS_TYPE = new TypeReference<>() {
    };

    @Parameters(
        index = "0",
        description = "Operation, e.g. query_papers_by_field or PAPERS_BY_FIELD"
    )
    private String operationName;

    @Option(
        names = {"-p", "--params"},
        description = "Parameters as a JSON object, e.g. '{\"field\": \"machine learning\", \"limit\": 5}'"
    )
    private String params;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        final QueryOperation operation;
        final Map<String, Object> parameters;
        try {
            operation = QueryOperation.fromName(operationName);
            parameters = params == null || params.isBlank()
                ? Map.of()
                : JsonOutput.mapper().readValue(params, PARAMS_TYPE);
        } catch (IllegalArgumentException | JsonProcessingException e) {
            spec.commandLine().getErr().println("Invalid query: " + e.getMessage());
            return 2;
        }

        try (ScholarGraphEngine engine = parent.openEngine()) {
            QueryResponse response = engine.queryService().execute(operation, parameters);
            Map<String, Object> output = new LinkedHashMap<>();
            output.put("operation", operation.toolName());
            output.put("row_count", response.rowCount());
            output.put("stats", response.stats());
            output.put("rows", JsonOutput.rows(response.rows()));
            JsonOutput.print(spec.commandLine().getOut(), output);
            return 0;
        }
    }
}
