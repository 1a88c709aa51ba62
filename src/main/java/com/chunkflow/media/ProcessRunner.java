package com.chunkflow.media;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs external command-line tools (ffmpeg, ffprobe) and captures their output.
 */
@Component
public class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

    static final int STDERR_TAIL_CHARS = 4000;

    /**
     * Captured result of a finished process.
     *
     * @param exitCode process exit code
     * @param stdout   full standard output
     * @param stderr   full standard error
     */
    public record Result(int exitCode, String stdout, String stderr) {}

    /**
     * Runs {@code command} to completion.
     *
     * @throws MediaProcessingException if the process cannot start or exits non-zero
     */
    public Result run(List<String> command) {
        log.debug("Executing command: {}", command);
        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new MediaProcessingException("Could not start command: " + String.join(" ", command), e);
        }

        // Drain stderr on a separate thread so a chatty tool cannot block on a full pipe
        var stderrBuffer = new StringBuilder();
        Thread stderrReader = new Thread(() -> {
            try (var reader = new BufferedReader(
                    new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    synchronized (stderrBuffer) {
                        stderrBuffer.append(line).append('\n');
                    }
                }
            } catch (IOException e) {
                log.warn("Error reading stderr of {}: {}", command.get(0), e.getMessage());
            }
        }, "stderr-" + command.get(0));
        stderrReader.setDaemon(true);
        stderrReader.start();

        try {
            String stdout = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            int exitCode = process.waitFor();
            stderrReader.join(1000);
            String stderr;
            synchronized (stderrBuffer) {
                stderr = stderrBuffer.toString();
            }
            if (exitCode != 0) {
                throw new MediaProcessingException("Command failed (exit " + exitCode + "): "
                        + String.join(" ", command) + "\n\nSTDERR:\n" + tail(stderr));
            }
            return new Result(exitCode, stdout, stderr);
        } catch (IOException e) {
            process.destroyForcibly();
            throw new MediaProcessingException("I/O error running " + command.get(0), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new MediaProcessingException("Interrupted running " + command.get(0), e);
        }
    }

    /**
     * True when {@code tool} is an absolute executable path or resolves on the PATH.
     */
    public boolean isAvailable(String tool) {
        Path direct = Path.of(tool);
        if (direct.isAbsolute()) {
            return Files.isExecutable(direct);
        }
        String pathEnv = System.getenv("PATH");
        if (pathEnv == null) {
            return false;
        }
        for (String dir : pathEnv.split(File.pathSeparator)) {
            if (dir.isBlank()) continue;
            Path candidate = Path.of(dir, tool);
            if (Files.isExecutable(candidate) || Files.isExecutable(Path.of(dir, tool + ".exe"))) {
                return true;
            }
        }
        return false;
    }

    static String tail(String text) {
        return text.length() <= STDERR_TAIL_CHARS ? text : text.substring(text.length() - STDERR_TAIL_CHARS);
    }
}
