package com.chunkflow.media;

import com.chunkflow.config.ChunkflowProperties;
import com.chunkflow.core.model.FrameItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Samples JPEG frames from a chunk with ffmpeg at a fixed rate.
 */
@Component
public class FrameExtractor {

    private static final Logger log = LoggerFactory.getLogger(FrameExtractor.class);

    static final String FRAME_PATTERN = "frame_%05d.jpg";

    private final ProcessRunner processRunner;
    private final String ffmpegPath;

    @Autowired
    public FrameExtractor(ProcessRunner processRunner, ChunkflowProperties properties) {
        this(processRunner, properties.getMedia().getFfmpegPath());
    }

    FrameExtractor(ProcessRunner processRunner, String ffmpegPath) {
        this.processRunner = processRunner;
        this.ffmpegPath = ffmpegPath;
    }

    /**
     * Extracts frames from {@code chunk} into {@code outDir}.
     *
     * @param fps sampling rate in frames per second (0.5 = one frame every 2 seconds)
     * @return frames in file-name order, indexed from 0 with derived timestamps
     */
    public List<FrameItem> extract(Path chunk, Path outDir, double fps) {
        Path chunkPath = chunk.toAbsolutePath().normalize();
        Path out = outDir.toAbsolutePath().normalize();
        try {
            Files.createDirectories(out);
        } catch (IOException e) {
            throw new MediaProcessingException("Could not create frames directory " + out, e);
        }

        processRunner.run(List.of(
                ffmpegPath, "-hide_banner", "-y",
                "-i", chunkPath.toString(),
                "-vf", "fps=" + formatRate(fps),
                "-q:v", "2",
                out.resolve(FRAME_PATTERN).toString()));

        List<Path> frameFiles = listFrames(out);
        var frames = new ArrayList<FrameItem>(frameFiles.size());
        for (int i = 0; i < frameFiles.size(); i++) {
            frames.add(FrameItem.sampled(i, fps, frameFiles.get(i)));
        }
        log.info("Extracted {} frame(s) from {} at {} fps", frames.size(), chunkPath.getFileName(), fps);
        return frames;
    }

    static String formatRate(double fps) {
        return BigDecimal.valueOf(fps).stripTrailingZeros().toPlainString();
    }

    private static List<Path> listFrames(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> {
                        String n = p.getFileName().toString();
                        return n.startsWith("frame_") && n.endsWith(".jpg");
                    })
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new MediaProcessingException("Could not list frames in " + dir, e);
        }
    }
}
