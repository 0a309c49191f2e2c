package com.example.clipflow.service.impl;

import com.example.clipflow.domain.ErrorClassification;
import com.example.clipflow.exceptions.BlobStoreException;
import com.example.clipflow.exceptions.MediaToolException;
import com.example.clipflow.pipeline.AudioSegment;
import com.example.clipflow.pipeline.SilenceSegmenter;
import com.example.clipflow.service.BlobStore;
import com.example.clipflow.service.MediaOperation;
import com.example.clipflow.service.MediaTool;
import com.example.clipflow.service.MediaToolResult;
import net.bramp.ffmpeg.FFmpegExecutor;
import net.bramp.ffmpeg.FFprobe;
import net.bramp.ffmpeg.builder.FFmpegBuilder;
import net.bramp.ffmpeg.builder.FFmpegOutputBuilder;
import net.bramp.ffmpeg.job.FFmpegJob;
import net.bramp.ffmpeg.probe.FFmpegProbeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link MediaTool} backed by the FFmpeg command line. Inputs are staged into a private temporary
 * directory, the FFmpeg job runs with a timeout, and outputs are moved into the blob store.
 */
@Service
public class FfmpegMediaTool implements MediaTool {

    private static final Logger log = LoggerFactory.getLogger(FfmpegMediaTool.class);

    static final int RECOGNITION_SAMPLE_RATE = 16_000;

    private final FFmpegExecutor ffmpegExecutor;
    private final FFprobe ffprobe;
    private final AsyncTaskExecutor asyncTaskExecutor;
    private final BlobStore blobStore;
    private final long timeoutSeconds;

    public FfmpegMediaTool(@Lazy FFmpegExecutor ffmpegExecutor,
                           @Lazy FFprobe ffprobe,
                           AsyncTaskExecutor asyncTaskExecutor,
                           BlobStore blobStore,
                           @Value("${clipflow.media.timeout-seconds:1800}") long timeoutSeconds) {
        this.ffmpegExecutor = ffmpegExecutor;
        this.ffprobe = ffprobe;
        this.asyncTaskExecutor = asyncTaskExecutor;
        this.blobStore = blobStore;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public MediaToolResult invoke(MediaOperation operation, String inputRef, String outputKey, Map<String, String> options)
            throws MediaToolException {
        Map<String, String> opts = options != null ? options : Map.of();
        Path workDir = null;
        try {
            workDir = Files.createTempDirectory("clipflow-media-");
            log.info("[MediaTool] {} input={} output={}", operation, inputRef, outputKey);
            return switch (operation) {
                case DOWNLOAD -> download(inputRef, outputKey, workDir);
                case MERGE -> merge(inputRef, outputKey, opts, workDir);
                case CONVERT -> convert(inputRef, outputKey, workDir);
                case EXTRACT_AUDIO -> extractAudio(inputRef, outputKey, workDir);
                case DETECT_SEGMENTS -> detectSegments(inputRef, opts, workDir);
                case CUT -> cut(inputRef, outputKey, opts, workDir);
            };
        } catch (IOException e) {
            throw new MediaToolException(ErrorClassification.TRANSIENT,
                    "I/O failure during " + operation + ": " + e.getMessage(), e);
        } catch (BlobStoreException e) {
            throw new MediaToolException(ErrorClassification.PERMANENT,
                    "Blob store failure during " + operation + ": " + e.getMessage(), e);
        } finally {
            cleanup(workDir);
        }
    }

    private MediaToolResult download(String sourceUrl, String outputKey, Path workDir) throws IOException {
        if (sourceUrl == null || !(sourceUrl.startsWith("http://") || sourceUrl.startsWith("https://"))) {
            throw new MediaToolException(ErrorClassification.PERMANENT, "Unsupported source URL: " + sourceUrl);
        }
        Path output = workDir.resolve("download.mp4");
        FFmpegBuilder builder = newBuilder().addInput(sourceUrl);
        builder.addOutput(output.toString())
                .setFormat("mp4")
                .setVideoCodec("copy")
                .setAudioCodec("copy")
                .done();
        // Network sources fail for transient reasons far more often than for bad input
        execute(builder, MediaOperation.DOWNLOAD, ErrorClassification.TRANSIENT);
        return store(output, outputKey, probeDuration(output));
    }

    private MediaToolResult merge(String videoRef, String outputKey, Map<String, String> opts, Path workDir) throws IOException {
        Path video = stage(videoRef, workDir, "video.mp4");
        Path output = workDir.resolve("merged.mp4");
        FFmpegBuilder builder = newBuilder().addInput(video.toString());
        String audioRef = opts.get(OPTION_AUDIO_REF);
        FFmpegOutputBuilder outputBuilder;
        if (audioRef != null && !audioRef.isBlank()) {
            Path audio = stage(audioRef, workDir, "audio.m4a");
            builder.addInput(audio.toString());
            outputBuilder = builder.addOutput(output.toString())
                    .addExtraArgs("-map", "0:v:0", "-map", "1:a:0");
        } else {
            outputBuilder = builder.addOutput(output.toString());
        }
        outputBuilder.setFormat("mp4")
                .setVideoCodec("copy")
                .setAudioCodec("copy")
                .done();
        execute(builder, MediaOperation.MERGE, ErrorClassification.PERMANENT);
        return store(output, outputKey, probeDuration(output));
    }

    private MediaToolResult convert(String inputRef, String outputKey, Path workDir) throws IOException {
        Path input = stage(inputRef, workDir, "input.bin");
        Path output = workDir.resolve("converted.mp4");
        FFmpegBuilder builder = newBuilder().addInput(input.toString());
        builder.addOutput(output.toString())
                .setFormat("mp4")
                .setVideoCodec("libx264")
                .setPreset("medium")
                .setConstantRateFactor(23)
                .setAudioCodec("aac")
                .addExtraArgs("-movflags", "+faststart")
                .done();
        execute(builder, MediaOperation.CONVERT, ErrorClassification.PERMANENT);
        return store(output, outputKey, probeDuration(output));
    }

    private MediaToolResult extractAudio(String inputRef, String outputKey, Path workDir) throws IOException {
        Path input = stage(inputRef, workDir, "input.mp4");
        Path output = workDir.resolve("audio.wav");
        FFmpegBuilder builder = newBuilder().addInput(input.toString());
        builder.addOutput(output.toString())
                .disableVideo()
                .setFormat("wav")
                .setAudioCodec("pcm_s16le")
                .setAudioSampleRate(RECOGNITION_SAMPLE_RATE)
                .setAudioChannels(1)
                .done();
        execute(builder, MediaOperation.EXTRACT_AUDIO, ErrorClassification.PERMANENT);
        return store(output, outputKey, probeDuration(output));
    }

    private MediaToolResult detectSegments(String inputRef, Map<String, String> opts, Path workDir) throws IOException {
        Path input = stage(inputRef, workDir, "input.wav");
        Path pcm = workDir.resolve("audio.pcm");
        FFmpegBuilder builder = newBuilder().addInput(input.toString());
        builder.addOutput(pcm.toString())
                .disableVideo()
                .setFormat("s16le")
                .setAudioCodec("pcm_s16le")
                .setAudioSampleRate(RECOGNITION_SAMPLE_RATE)
                .setAudioChannels(1)
                .done();
        execute(builder, MediaOperation.DETECT_SEGMENTS, ErrorClassification.PERMANENT);

        SilenceSegmenter segmenter = new SilenceSegmenter(RECOGNITION_SAMPLE_RATE,
                Double.parseDouble(opts.getOrDefault(OPTION_SILENCE_THRESHOLD_DB, "-35")),
                Long.parseLong(opts.getOrDefault(OPTION_MIN_SILENCE_MS, "500")),
                Long.parseLong(opts.getOrDefault(OPTION_MIN_SEGMENT_MS, "10000")),
                Long.parseLong(opts.getOrDefault(OPTION_MAX_SEGMENT_MS, "45000")));
        List<AudioSegment> segments;
        try (InputStream in = new BufferedInputStream(Files.newInputStream(pcm))) {
            segments = segmenter.segment(in);
        }
        log.info("[MediaTool] Detected {} audio segments in {}", segments.size(), inputRef);
        Map<String, Object> metrics = new HashMap<>();
        metrics.put(MediaToolResult.SEGMENTS, segments);
        return new MediaToolResult(null, metrics);
    }

    private MediaToolResult cut(String inputRef, String outputKey, Map<String, String> opts, Path workDir) throws IOException {
        long startMs = Long.parseLong(requireOption(opts, OPTION_START_MS));
        long endMs = Long.parseLong(requireOption(opts, OPTION_END_MS));
        if (endMs <= startMs) {
            throw new MediaToolException(ErrorClassification.PERMANENT,
                    "Cut end (" + endMs + "ms) must be after start (" + startMs + "ms)");
        }
        Path input = stage(inputRef, workDir, "input.mp4");
        Path output = workDir.resolve("cut.mp4");
        FFmpegBuilder builder = newBuilder()
                .setStartOffset(startMs, TimeUnit.MILLISECONDS)
                .addInput(input.toString());
        builder.addOutput(output.toString())
                .setDuration(endMs - startMs, TimeUnit.MILLISECONDS)
                .setFormat("mp4")
                .setVideoCodec("libx264")
                .setPreset("medium")
                .setConstantRateFactor(23)
                .setAudioCodec("aac")
                .done();
        execute(builder, MediaOperation.CUT, ErrorClassification.PERMANENT);
        return store(output, outputKey, (endMs - startMs) / 1000.0);
    }

    private FFmpegBuilder newBuilder() {
        return new FFmpegBuilder()
                .setVerbosity(FFmpegBuilder.Verbosity.INFO)
                .overrideOutputFiles(true);
    }

    /**
     * Runs the job on the async executor and waits at most the configured timeout.
     *
     * @param failureClassification classification applied when FFmpeg itself fails
     */
    private void execute(FFmpegBuilder builder, MediaOperation operation, ErrorClassification failureClassification) {
        if (log.isDebugEnabled()) {
            log.debug("[MediaTool] FFmpeg command (bramp): {}", String.join(" ", builder.build()));
        }
        FFmpegJob job = ffmpegExecutor.createJob(builder);
        Future<?> future = asyncTaskExecutor.submit(job);
        try {
            future.get(timeoutSeconds, TimeUnit.SECONDS);
            log.info("[MediaTool] {} completed within timeout", operation);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new MediaToolException(ErrorClassification.TRANSIENT,
                    operation + " timed out after " + timeoutSeconds + "s", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new MediaToolException(ErrorClassification.TRANSIENT, operation + " was interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            log.error("[MediaTool] Exception during FFmpeg execution for {}", operation, cause);
            throw new MediaToolException(failureClassification, describeFailure(operation, cause), cause);
        }
    }

    private static String describeFailure(MediaOperation operation, Throwable cause) {
        if (cause instanceof IOException && cause.getMessage() != null
                && cause.getMessage().contains("non-zero exit status")) {
            return "FFmpeg process failed during " + operation + ". Cause: " + cause.getMessage();
        } else if (cause != null) {
            return "Unexpected cause during " + operation + ": " + cause.getMessage();
        }
        return "Unknown error during " + operation;
    }

    private Path stage(String ref, Path workDir, String fileName) {
        Path target = workDir.resolve(fileName);
        blobStore.copyTo(ref, target);
        return target;
    }

    private MediaToolResult store(Path output, String outputKey, Double durationSeconds) throws IOException {
        if (!Files.isRegularFile(output) || Files.size(output) == 0) {
            throw new MediaToolException(ErrorClassification.PERMANENT, "FFmpeg produced no output for " + outputKey);
        }
        long size = Files.size(output);
        String ref = blobStore.put(outputKey, output);
        Map<String, Object> metrics = new HashMap<>();
        metrics.put(MediaToolResult.SIZE_BYTES, size);
        if (durationSeconds != null) {
            metrics.put(MediaToolResult.DURATION_SECONDS, durationSeconds);
        }
        return new MediaToolResult(ref, metrics);
    }

    private Double probeDuration(Path file) {
        try {
            FFmpegProbeResult result = ffprobe.probe(file.toString());
            return result.getFormat() != null ? result.getFormat().duration : null;
        } catch (IOException e) {
            log.warn("[MediaTool] Could not probe duration of {}: {}", file.getFileName(), e.getMessage());
            return null;
        }
    }

    private static String requireOption(Map<String, String> opts, String name) {
        String value = opts.get(name);
        if (value == null || value.isBlank()) {
            throw new MediaToolException(ErrorClassification.PERMANENT, "Missing media tool option: " + name);
        }
        return value;
    }

    private void cleanup(Path workDir) {
        if (workDir == null) {
            return;
        }
        try {
            FileSystemUtils.deleteRecursively(workDir);
        } catch (IOException e) {
            log.warn("[MediaTool] Failed to clean up temporary directory {}: {}", workDir, e.getMessage());
        }
    }
}
