package com.chunkflow.dispatch.cli;

import com.chunkflow.config.ChunkflowProperties;
import com.chunkflow.media.FrameExtractor;
import com.chunkflow.media.MediaProcessingException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: chunkflow frames &lt;chunk&gt; --out &lt;dir&gt;
 */
@Command(name = "frames", mixinStandardHelpOptions = true, description = "Extract sampled frames from one chunk")
@Component
public class FramesCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Chunk video file")
    private Path chunk;

    @Option(names = {"--out", "-o"}, required = true, description = "Output directory for frames")
    private Path outDir;

    @Option(names = "--fps", description = "Sampling rate in frames per second (default: chunkflow.media.fps)")
    private Double fps;

    private final FrameExtractor frameExtractor;
    private final ChunkflowProperties properties;

    public FramesCommand(FrameExtractor frameExtractor, ChunkflowProperties properties) {
        this.frameExtractor = frameExtractor;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        double rate = fps != null ? fps : properties.getMedia().getFps();
        try {
            var frames = frameExtractor.extract(chunk, outDir, rate);
            System.out.printf("  %-6s %-10s %s%n", "INDEX", "TIME(s)", "FILE");
            for (var frame : frames) {
                System.out.printf("  %-6d %-10.3f %s%n",
                        frame.frameIndex(), frame.timestampSeconds(), frame.jpegPath().getFileName());
            }
            ConsoleOutput.success("Extracted " + frames.size() + " frame(s)");
            return 0;
        } catch (MediaProcessingException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
