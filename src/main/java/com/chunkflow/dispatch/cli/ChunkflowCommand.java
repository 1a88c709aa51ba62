package com.chunkflow.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Chunkflow.
 * Routes to subcommands: segment, frames, analyze.
 */
@Command(
        name = "chunkflow",
        mixinStandardHelpOptions = true,
        version = "Chunkflow 0.1.0",
        description = "Segments videos and analyzes chunks with a retrying job engine and ordered batch dispatch",
        subcommands = {
                SegmentCommand.class,
                FramesCommand.class,
                AnalyzeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ChunkflowCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
