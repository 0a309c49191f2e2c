package com.example.clipflow.config;

import com.example.clipflow.exceptions.FfmpegInitializationException;
import net.bramp.ffmpeg.FFmpeg;
import net.bramp.ffmpeg.FFmpegExecutor;
import net.bramp.ffmpeg.FFprobe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

import java.io.IOException;

/**
 * FFmpeg binaries are probed on construction, so the beans are lazy: processes that never run
 * a media stage (callback receiver, gateway-only nodes) start without FFmpeg installed.
 */
@Configuration
public class FfmpegConfig {

    private static final Logger log = LoggerFactory.getLogger(FfmpegConfig.class);

    @Value("${clipflow.media.ffmpeg-path:ffmpeg}")
    private String ffmpegPath;

    @Value("${clipflow.media.ffprobe-path:ffprobe}")
    private String ffprobePath;

    @Bean
    @Lazy
    public FFmpeg fFmpeg() {
        if (ffmpegPath == null || ffmpegPath.isBlank()) {
            log.error("clipflow.media.ffmpeg-path is not configured. FFmpeg cannot be initialized.");
            throw new FfmpegInitializationException("clipflow.media.ffmpeg-path is required but not configured.", null);
        }
        try {
            log.info("Creating FFmpeg bean with path: {}", ffmpegPath);
            return new FFmpeg(ffmpegPath);
        } catch (IOException e) {
            throw new FfmpegInitializationException("Failed to initialize FFmpeg with path: " + ffmpegPath, e);
        }
    }

    @Bean
    @Lazy
    public FFprobe fFprobe() {
        if (ffprobePath == null || ffprobePath.isBlank()) {
            log.error("clipflow.media.ffprobe-path is not configured. FFprobe cannot be initialized.");
            throw new FfmpegInitializationException("clipflow.media.ffprobe-path is required but not configured.", null);
        }
        try {
            log.info("Creating FFprobe bean with path: {}", ffprobePath);
            return new FFprobe(ffprobePath);
        } catch (IOException e) {
            throw new FfmpegInitializationException("Failed to initialize FFprobe with path: " + ffprobePath, e);
        }
    }

    @Bean
    @Lazy
    public FFmpegExecutor fFmpegExecutor(@Lazy FFmpeg ffmpeg, @Lazy FFprobe ffprobe) throws IOException {
        log.info("Creating FFmpegExecutor bean");
        return new FFmpegExecutor(ffmpeg, ffprobe);
    }
}
