package com.chunkflow.media;

import com.chunkflow.config.ChunkflowProperties;
import com.chunkflow.core.model.ChunkSegment;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Cuts a video into fixed-length chunks with the ffmpeg segment muxer and writes
 * the chunk manifest the analysis pipeline consumes.
 */
@Component
public class VideoSegmenter {

    private static final Logger log = LoggerFactory.getLogger(VideoSegmenter.class);

    static final int MIN_CHUNK_SECONDS = 10;
    static final int MAX_CHUNK_SECONDS = 60;

    private final ProcessRunner processRunner;
    private final ManifestStore manifestStore;
    private final ObjectMapper objectMapper;
    private final String ffmpegPath;
    private final String ffprobePath;

    @Autowired
    public VideoSegmenter(ProcessRunner processRunner, ManifestStore manifestStore,
                          ObjectMapper objectMapper, ChunkflowProperties properties) {
        this(processRunner, manifestStore, objectMapper,
                properties.getMedia().getFfmpegPath(), properties.getMedia().getFfprobePath());
    }

    VideoSegmenter(ProcessRunner processRunner, ManifestStore manifestStore, ObjectMapper objectMapper,
                   String ffmpegPath, String ffprobePath) {
        this.processRunner = processRunner;
        this.manifestStore = manifestStore;
        this.objectMapper = objectMapper;
        this.ffmpegPath = ffmpegPath;
        this.ffprobePath = ffprobePath;
    }

    /**
     * Segments {@code inputVideo} into {@code outDir/chunk_NNNNN.mp4} files.
     *
     * @param chunkSeconds     target chunk length, 10 to 60 seconds
     * @param exactBoundaries  re-encode with forced key frames so chunks cut exactly;
     *                         otherwise stream-copy and cut at the nearest key frame
     * @param cleanupExisting  delete chunk files left by a previous run first
     * @param keepSegmentList  keep ffmpeg's {@code segments.csv} next to the manifest
     * @return the written manifest
     */
    public List<ChunkSegment> segment(Path inputVideo, Path outDir, int chunkSeconds,
                                      boolean exactBoundaries, boolean cleanupExisting,
                                      boolean keepSegmentList) {
        if (chunkSeconds < MIN_CHUNK_SECONDS || chunkSeconds > MAX_CHUNK_SECONDS) {
            throw new IllegalArgumentException("chunkSeconds must be between "
                    + MIN_CHUNK_SECONDS + " and " + MAX_CHUNK_SECONDS + ", got " + chunkSeconds);
        }
        if (!processRunner.isAvailable(ffmpegPath) || !processRunner.isAvailable(ffprobePath)) {
            throw new MediaProcessingException("ffmpeg/ffprobe not found on PATH. Install FFmpeg and try again.");
        }
        Path input = inputVideo.toAbsolutePath().normalize();
        if (!Files.exists(input)) {
            throw new MediaProcessingException("Input video not found: " + input);
        }
        Path out = outDir.toAbsolutePath().normalize();
        try {
            Files.createDirectories(out);
        } catch (IOException e) {
            throw new MediaProcessingException("Could not create output directory " + out, e);
        }
        if (cleanupExisting) {
            cleanupChunkFiles(out, false);
        }

        Path segmentList = out.resolve(ManifestStore.SEGMENT_LIST_FILE);
        processRunner.run(buildSegmentCommand(input, out, chunkSeconds, exactBoundaries, segmentList));

        List<ChunkSegment> manifest = manifestStore.writeManifest(
                out, chunkSeconds, probeDurationSeconds(input), segmentList);

        if (!keepSegmentList) {
            try {
                Files.deleteIfExists(segmentList);
            } catch (IOException e) {
                log.warn("Could not remove segment list {}: {}", segmentList, e.getMessage());
            }
        }
        log.info("Segmented {} into {} chunk(s) of {}s", input.getFileName(), manifest.size(), chunkSeconds);
        return manifest;
    }

    List<String> buildSegmentCommand(Path input, Path out, int chunkSeconds,
                                     boolean exactBoundaries, Path segmentList) {
        var cmd = new ArrayList<String>(List.of(ffmpegPath, "-hide_banner", "-y", "-i", input.toString(), "-map", "0"));
        if (!exactBoundaries) {
            cmd.addAll(List.of("-c", "copy"));
        } else {
            cmd.addAll(List.of(
                    "-c:v", "libx264", "-preset", "veryfast", "-crf", "23",
                    "-force_key_frames", "expr:gte(t,n_forced*" + chunkSeconds + ")",
                    "-c:a", "aac", "-b:a", "128k"));
        }
        cmd.addAll(List.of(
                "-f", "segment",
                "-segment_time", String.valueOf(chunkSeconds),
                "-reset_timestamps", "1",
                "-segment_list", segmentList.toString(),
                "-segment_list_type", "csv",
                out.resolve("chunk_%05d.mp4").toString()));
        return cmd;
    }

    /**
     * Reads the container duration with ffprobe's JSON output.
     */
    public double probeDurationSeconds(Path video) {
        var result = processRunner.run(List.of(
                ffprobePath, "-v", "error",
                "-show_entries", "format=duration",
                "-of", "json",
                video.toString()));
        try {
            JsonNode duration = objectMapper.readTree(result.stdout()).path("format").path("duration");
            if (duration.isMissingNode() || duration.isNull()) {
                throw new MediaProcessingException("ffprobe reported no duration for " + video);
            }
            return duration.asDouble();
        } catch (IOException e) {
            throw new MediaProcessingException("Unparseable ffprobe output for " + video, e);
        }
    }

    /**
     * Deletes chunk files and the segment list from {@code outDir}.
     *
     * @return number of files deleted
     */
    public int cleanupChunkFiles(Path outDir, boolean removeManifest) {
        if (!Files.isDirectory(outDir)) {
            return 0;
        }
        var targets = new ArrayList<>(ManifestStore.listChunkFiles(outDir));
        targets.add(outDir.resolve(ManifestStore.SEGMENT_LIST_FILE));
        if (removeManifest) {
            targets.add(outDir.resolve(ManifestStore.MANIFEST_FILE));
        }
        int deleted = 0;
        for (Path target : targets) {
            try {
                if (Files.deleteIfExists(target)) {
                    deleted++;
                }
            } catch (IOException e) {
                throw new MediaProcessingException("Could not delete " + target, e);
            }
        }
        return deleted;
    }
}
