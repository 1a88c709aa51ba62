package com.chunkflow.media;

import com.chunkflow.core.model.ChunkSegment;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Reads and writes chunk manifests ({@code manifest.json}) and the ffmpeg segment
 * list ({@code segments.csv}) they are built from.
 */
@Component
public class ManifestStore {

    private static final Logger log = LoggerFactory.getLogger(ManifestStore.class);

    public static final String MANIFEST_FILE = "manifest.json";
    public static final String SEGMENT_LIST_FILE = "segments.csv";
    static final String CHUNK_PREFIX = "chunk_";
    static final String CHUNK_SUFFIX = ".mp4";

    private final ObjectMapper objectMapper;

    public ManifestStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses an ffmpeg CSV segment list ({@code file,start,end} per row).
     * Rows with fewer than three columns or non-numeric times are skipped but still
     * consume their index, so chunk indexes line up with file order.
     */
    public List<ChunkSegment> readSegmentTimings(Path segmentList) {
        if (!Files.exists(segmentList)) {
            return List.of();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(segmentList, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MediaProcessingException("Could not read segment list " + segmentList, e);
        }

        Path base = segmentList.toAbsolutePath().getParent();
        var segments = new ArrayList<ChunkSegment>();
        for (int index = 0; index < lines.size(); index++) {
            String[] row = lines.get(index).split(",");
            if (row.length < 3) {
                continue;
            }
            double start;
            double end;
            try {
                start = Double.parseDouble(row[1].trim());
                end = Double.parseDouble(row[2].trim());
            } catch (NumberFormatException e) {
                log.debug("Skipping malformed segment row {}: {}", index, lines.get(index));
                continue;
            }
            segments.add(new ChunkSegment(index, round3(start), round3(end),
                    base.resolve(row[0].trim()).normalize().toString()));
        }
        return segments;
    }

    /**
     * Builds and writes {@code manifest.json} in {@code outDir}.
     * Segment-list timings are preferred; otherwise timings are derived from the sorted
     * chunk files at fixed {@code chunkSeconds} intervals, capped at the video duration.
     *
     * @param segmentList segment list to read, or null for {@code outDir/segments.csv}
     * @param durationSeconds source duration, required when no segment list is usable
     * @throws IllegalArgumentException if timings must be derived and no duration is given
     */
    public List<ChunkSegment> writeManifest(Path outDir, int chunkSeconds, Double durationSeconds, Path segmentList) {
        Path out = outDir.toAbsolutePath().normalize();
        Path source = segmentList != null ? segmentList : out.resolve(SEGMENT_LIST_FILE);

        List<ChunkSegment> manifest = readSegmentTimings(source);
        if (manifest.isEmpty()) {
            if (durationSeconds == null) {
                throw new IllegalArgumentException("durationSeconds is required when no segment list is available");
            }
            List<Path> chunks = listChunkFiles(out);
            var derived = new ArrayList<ChunkSegment>(chunks.size());
            for (int i = 0; i < chunks.size(); i++) {
                double start = (double) i * chunkSeconds;
                double end = Math.min((double) (i + 1) * chunkSeconds, durationSeconds);
                derived.add(new ChunkSegment(i, round3(start), round3(end), chunks.get(i).toString()));
            }
            manifest = derived;
        }

        Path manifestPath = out.resolve(MANIFEST_FILE);
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(manifestPath.toFile(), manifest);
        } catch (IOException e) {
            throw new MediaProcessingException("Could not write manifest " + manifestPath, e);
        }
        log.info("Wrote manifest with {} chunk(s) to {}", manifest.size(), manifestPath);
        return manifest;
    }

    public List<ChunkSegment> readManifest(Path manifestPath) {
        try {
            return objectMapper.readValue(manifestPath.toFile(), new TypeReference<List<ChunkSegment>>() {});
        } catch (IOException e) {
            throw new MediaProcessingException("Could not read manifest " + manifestPath, e);
        }
    }

    static List<Path> listChunkFiles(Path dir) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> {
                        String n = p.getFileName().toString();
                        return n.startsWith(CHUNK_PREFIX) && n.endsWith(CHUNK_SUFFIX);
                    })
                    .map(p -> p.toAbsolutePath().normalize())
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new MediaProcessingException("Could not list chunks in " + dir, e);
        }
    }

    static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
