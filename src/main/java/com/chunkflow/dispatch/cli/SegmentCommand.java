package com.chunkflow.dispatch.cli;

import com.chunkflow.config.ChunkflowProperties;
import com.chunkflow.media.MediaProcessingException;
import com.chunkflow.media.VideoSegmenter;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: chunkflow segment &lt;video&gt; --out &lt;dir&gt;
 * <p>
 * Cuts a video into fixed-length chunks and writes {@code manifest.json}.
 */
@Command(name = "segment", mixinStandardHelpOptions = true, description = "Split a video into chunks and write a manifest")
@Component
public class SegmentCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Input video file")
    private Path video;

    @Option(names = {"--out", "-o"}, required = true, description = "Output directory for chunks and manifest")
    private Path outDir;

    @Option(names = "--chunk-seconds", description = "Chunk length in seconds, 10-60 (default: chunkflow.media.chunk-seconds)")
    private Integer chunkSeconds;

    @Option(names = "--exact", description = "Re-encode so chunks cut exactly on boundaries")
    private boolean exact;

    @Option(names = "--cleanup", description = "Delete chunk files from a previous run first")
    private boolean cleanup;

    @Option(names = "--keep-segment-list", description = "Keep ffmpeg's segments.csv")
    private boolean keepSegmentList;

    private final VideoSegmenter segmenter;
    private final ChunkflowProperties properties;

    public SegmentCommand(VideoSegmenter segmenter, ChunkflowProperties properties) {
        this.segmenter = segmenter;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        int seconds = chunkSeconds != null ? chunkSeconds : properties.getMedia().getChunkSeconds();
        ConsoleOutput.info("Segmenting " + video + " into " + seconds + "s chunks...");
        try {
            var manifest = segmenter.segment(video, outDir, seconds, exact, cleanup, keepSegmentList);
            ConsoleOutput.success("Wrote " + manifest.size() + " chunk(s) to " + outDir.toAbsolutePath());
            return 0;
        } catch (IllegalArgumentException | MediaProcessingException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
