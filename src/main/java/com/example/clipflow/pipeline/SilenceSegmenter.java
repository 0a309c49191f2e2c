package com.example.clipflow.pipeline;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * Splits mono signed 16-bit little-endian PCM into segments whose boundaries fall inside silences.
 * Every segment is at most {@code maxSegmentMs} long; cuts are placed no earlier than
 * {@code minSegmentMs} after the previous boundary. Without a usable silence the audio is cut hard
 * at the maximum length. Only the final segment may be shorter than {@code minSegmentMs}.
 */
public final class SilenceSegmenter {

    static final int WINDOW_MS = 10;
    private static final double FULL_SCALE = 32768.0;
    private static final double SILENCE_FLOOR_DB = -120.0;

    private final int sampleRate;
    private final double thresholdDb;
    private final long minSilenceMs;
    private final long minSegmentMs;
    private final long maxSegmentMs;

    public SilenceSegmenter(int sampleRate, double thresholdDb, long minSilenceMs, long minSegmentMs, long maxSegmentMs) {
        if (sampleRate <= 0 || sampleRate % (1000 / WINDOW_MS) != 0) {
            throw new IllegalArgumentException("Sample rate must be a positive multiple of " + (1000 / WINDOW_MS));
        }
        if (minSegmentMs <= 0 || maxSegmentMs < minSegmentMs) {
            throw new IllegalArgumentException("Segment bounds must satisfy 0 < min <= max");
        }
        this.sampleRate = sampleRate;
        this.thresholdDb = thresholdDb;
        this.minSilenceMs = minSilenceMs;
        this.minSegmentMs = minSegmentMs;
        this.maxSegmentMs = maxSegmentMs;
    }

    public List<AudioSegment> segment(InputStream pcm) throws IOException {
        WindowScanner scanner = new WindowScanner(sampleRate * WINDOW_MS / 1000);
        byte[] buffer = new byte[8192];
        int pendingLowByte = -1;
        int read;
        while ((read = pcm.read(buffer)) != -1) {
            int i = 0;
            if (pendingLowByte >= 0 && read > 0) {
                scanner.accept((short) ((buffer[0] << 8) | pendingLowByte));
                pendingLowByte = -1;
                i = 1;
            }
            for (; i + 1 < read; i += 2) {
                scanner.accept((short) ((buffer[i + 1] << 8) | (buffer[i] & 0xff)));
            }
            if (i < read) {
                pendingLowByte = buffer[i] & 0xff;
            }
        }
        scanner.finish();

        long totalMs = scanner.totalSamples * 1000L / sampleRate;
        return planSegments(silenceCutPoints(scanner.silentWindows, scanner.windowCount, totalMs), totalMs);
    }

    /**
     * Midpoints of every silence run lasting at least {@code minSilenceMs}, ascending.
     */
    List<Long> silenceCutPoints(BitSet silentWindows, int windowCount, long totalMs) {
        List<Long> cuts = new ArrayList<>();
        int runStart = silentWindows.nextSetBit(0);
        while (runStart >= 0 && runStart < windowCount) {
            int runEnd = silentWindows.nextClearBit(runStart);
            long runLengthMs = (long) (runEnd - runStart) * WINDOW_MS;
            if (runLengthMs >= minSilenceMs) {
                long midpoint = ((long) runStart * WINDOW_MS + (long) runEnd * WINDOW_MS) / 2;
                cuts.add(Math.min(midpoint, totalMs));
            }
            runStart = silentWindows.nextSetBit(runEnd);
        }
        return cuts;
    }

    List<AudioSegment> planSegments(List<Long> cuts, long totalMs) {
        List<AudioSegment> segments = new ArrayList<>();
        if (totalMs <= 0) {
            return segments;
        }
        long start = 0;
        while (totalMs - start > maxSegmentMs) {
            long best = -1;
            for (long cut : cuts) {
                if (cut > start + maxSegmentMs) {
                    break;
                }
                if (cut >= start + minSegmentMs) {
                    best = cut;
                }
            }
            long end = best > 0 ? best : start + maxSegmentMs;
            segments.add(new AudioSegment(start, end));
            start = end;
        }

        if (totalMs > start) {
            segments.add(new AudioSegment(start, totalMs));
        }
        return segments;
    }

    private final class WindowScanner {
        private final int samplesPerWindow;
        private final BitSet silentWindows = new BitSet();
        private int windowCount;
        private int samplesInWindow;
        private double sumSquares;
        private long totalSamples;

        private WindowScanner(int samplesPerWindow) {
            this.samplesPerWindow = samplesPerWindow;
        }

        void accept(short sample) {
            sumSquares += (double) sample * sample;
            samplesInWindow++;
            totalSamples++;
            if (samplesInWindow == samplesPerWindow) {
                closeWindow();
            }
        }

        void finish() {
            if (samplesInWindow > 0) {
                closeWindow();
            }
        }

        private void closeWindow() {
            double rms = Math.sqrt(sumSquares / samplesInWindow);
            double db = rms == 0.0 ? SILENCE_FLOOR_DB : 20.0 * Math.log10(rms / FULL_SCALE);
            if (db < thresholdDb) {
                silentWindows.set(windowCount);
            }
            windowCount++;
            samplesInWindow = 0;
            sumSquares = 0.0;
        }
    }
}
