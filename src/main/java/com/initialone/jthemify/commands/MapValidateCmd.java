package com.initialone.jthemify.commands;

import com.initialone.jthemify.mapping.MappingLoader;
import com.initialone.jthemify.mapping.MappingValidator;
import com.initialone.jthemify.model.MappingTable;
import com.initialone.jthemify.model.ValidationReport;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

@CommandLine.Command(
        name = "map-validate",
        description = "Check a mapping file (YAML or JSON) for malformed names, targets and conflicts"
)
public class MapValidateCmd implements Runnable {

    @CommandLine.Parameters(index = "0", description = "Mapping file (.yaml, .yml or .json)")
    String mappingFile;

    @Override
    public void run() {
        Path p = Paths.get(mappingFile);
        MappingTable table = loadMapping(new CommandLine(this), p);
        ValidationReport report = new MappingValidator().validate(table, p.getFileName().toString());
        report.print(System.out, "[map-validate]");
        if (!report.isValid()) {
            throw new CommandLine.ExecutionException(new CommandLine(this),
                    "mapping has " + report.errors().size() + " errors: " + p);
        }
    }

    static MappingTable loadMapping(CommandLine cmd, Path p) {
        try {
            return new MappingLoader().load(p);
        } catch (IOException e) {
            throw new CommandLine.ParameterException(cmd, "cannot load mapping " + p.toAbsolutePath() + ": " + e.getMessage(), e);
        }
    }
}
