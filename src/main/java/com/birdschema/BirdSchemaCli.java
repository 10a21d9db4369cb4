package com.birdschema;

import com.birdschema.cli.ExportCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
        name = "bird-schema",
        description = "Export Postgres schemas with column-level PK/FK metadata for BIRD databases",
        mixinStandardHelpOptions = true,
        version = BirdSchemaCli.VERSION,
        subcommands = {
                ExportCommand.class
        }
)
public class BirdSchemaCli implements Runnable {
    public static final String VERSION = "0.1.0";

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new BirdSchemaCli()).execute(args);
        System.exit(exitCode);
    }
}
