package com.chunkflow.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "chunkflow")
public class ChunkflowProperties {

    static final String DEFAULT_PROMPT =
            "For each image, describe what the user is looking at, and extract any readable text "
                    + "(prices, labels, signs). Return one JSON object per image.";

    private Runner runner = new Runner();
    private Batch batch = new Batch();
    private Vision vision = new Vision();
    private Media media = new Media();

    public Runner getRunner() { return runner; }
    public void setRunner(Runner runner) { this.runner = runner; }
    public Batch getBatch() { return batch; }
    public void setBatch(Batch batch) { this.batch = batch; }
    public Vision getVision() { return vision; }
    public void setVision(Vision vision) { this.vision = vision; }
    public Media getMedia() { return media; }
    public void setMedia(Media media) { this.media = media; }

    public static class Runner {
        private int workers = 2;
        private int maxRetries = 3;
        private long pollIntervalMs = 50;
        /** Pause between inline retries; 0 retries immediately. */
        private long retryBackoffMs = 0;
        private long shutdownTimeoutSeconds = 1;

        public int getWorkers() { return workers; }
        public void setWorkers(int workers) { this.workers = workers; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public long getPollIntervalMs() { return pollIntervalMs; }
        public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }
        public long getRetryBackoffMs() { return retryBackoffMs; }
        public void setRetryBackoffMs(long retryBackoffMs) { this.retryBackoffMs = retryBackoffMs; }
        public long getShutdownTimeoutSeconds() { return shutdownTimeoutSeconds; }
        public void setShutdownTimeoutSeconds(long shutdownTimeoutSeconds) { this.shutdownTimeoutSeconds = shutdownTimeoutSeconds; }
    }

    public static class Batch {
        private int size = 10;
        private int maxParallel = 1;

        public int getSize() { return size; }
        public void setSize(int size) { this.size = size; }
        public int getMaxParallel() { return maxParallel; }
        public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
    }

    public static class Vision {
        private String endpointUrl = "http://localhost:11434/vision/batch";
        private int timeoutSeconds = 120;
        private String prompt = DEFAULT_PROMPT;

        public String getEndpointUrl() { return endpointUrl; }
        public void setEndpointUrl(String endpointUrl) { this.endpointUrl = endpointUrl; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public String getPrompt() { return prompt; }
        public void setPrompt(String prompt) { this.prompt = prompt; }
    }

    public static class Media {
        private String ffmpegPath = "ffmpeg";
        private String ffprobePath = "ffprobe";
        private double fps = 0.5;
        private int chunkSeconds = 30;

        public String getFfmpegPath() { return ffmpegPath; }
        public void setFfmpegPath(String ffmpegPath) { this.ffmpegPath = ffmpegPath; }
        public String getFfprobePath() { return ffprobePath; }
        public void setFfprobePath(String ffprobePath) { this.ffprobePath = ffprobePath; }
        public double getFps() { return fps; }
        public void setFps(double fps) { this.fps = fps; }
        public int getChunkSeconds() { return chunkSeconds; }
        public void setChunkSeconds(int chunkSeconds) { this.chunkSeconds = chunkSeconds; }
    }
}
