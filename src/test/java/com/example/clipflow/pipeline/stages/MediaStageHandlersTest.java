package com.example.clipflow.pipeline.stages;

import com.example.clipflow.config.PipelineSettings;
import com.example.clipflow.domain.PipelineStage;
import com.example.clipflow.domain.WorkUnit;
import com.example.clipflow.domain.WorkUnitKind;
import com.example.clipflow.exceptions.MediaToolException;
import com.example.clipflow.exceptions.PermanentInputException;
import com.example.clipflow.pipeline.AudioSegment;
import com.example.clipflow.pipeline.ProgressReporter;
import com.example.clipflow.pipeline.StageArtifacts;
import com.example.clipflow.pipeline.StageContext;
import com.example.clipflow.pipeline.StageOutcome;
import com.example.clipflow.service.BlobStore;
import com.example.clipflow.service.MediaOperation;
import com.example.clipflow.service.MediaTool;
import com.example.clipflow.service.MediaToolResult;
import com.example.clipflow.service.RetryPolicy;
import com.example.clipflow.service.SegmentSuggestion;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.times;

@ExtendWith(MockitoExtension.class)
@DisplayName("Media stage handler Tests")
class MediaStageHandlersTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private MediaTool mediaTool;
    @Mock
    private BlobStore blobStore;
    @Mock
    private ProgressReporter progressReporter;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RetryPolicy retryPolicy = new RetryPolicy(3, Duration.ZERO, Duration.ZERO, delay -> {
    });

    private StageContext context(WorkUnitKind kind, PipelineStage stage, Map<String, String> params,
                                 Map<String, String> artifacts) {
        WorkUnit unit = new WorkUnit("alice", "video-1", kind, params, NOW);
        unit.setId(8L);
        unit.setAttemptCount(2);
        unit.setCurrentStage(stage);
        unit.putArtifacts(artifacts);
        return new StageContext(unit, "lease", PipelineSettings.defaults(), retryPolicy, progressReporter);
    }

    @Nested
    @DisplayName("TransferIn")
    class TransferIn {

        private TransferInStageHandler handler;

        @BeforeEach
        void createHandler() {
            handler = new TransferInStageHandler(mediaTool);
        }

        @Test
        @DisplayName("✅ Downloads video and separate audio into attempt-scoped keys")
        void download_VideoAndAudio() {
            given(mediaTool.invoke(MediaOperation.DOWNLOAD, "https://v/1.mp4",
                    "work-units/8/attempt-2/source.mp4", Map.of()))
                    .willReturn(new MediaToolResult("blob:video", Map.of(MediaToolResult.DURATION_SECONDS, 600.0)));
            given(mediaTool.invoke(MediaOperation.DOWNLOAD, "https://v/1.m4a",
                    "work-units/8/attempt-2/source-audio.mp4", Map.of()))
                    .willReturn(new MediaToolResult("blob:audio", Map.of()));

            StageOutcome outcome = handler.execute(context(WorkUnitKind.DOWNLOAD, PipelineStage.TRANSFER_IN,
                    Map.of(StageArtifacts.SOURCE_URL, "https://v/1.mp4", StageArtifacts.AUDIO_URL, "https://v/1.m4a"),
                    Map.of()));

            assertThat(outcome.isParked()).isFalse();
            assertThat(outcome.artifacts())
                    .containsEntry(StageArtifacts.VIDEO, "blob:video")
                    .containsEntry(StageArtifacts.AUDIO_TRACK, "blob:audio")
                    .containsEntry(StageArtifacts.DURATION_SECONDS, "600.0");
        }

        @Test
        @DisplayName("❌ Rejects a unit without a source url")
        void download_NoSource_Permanent() {
            assertThatThrownBy(() -> handler.execute(context(WorkUnitKind.DOWNLOAD, PipelineStage.TRANSFER_IN,
                    Map.of(), Map.of())))
                    .isInstanceOf(PermanentInputException.class)
                    .hasMessageContaining("sourceUrl");
            then(mediaTool).shouldHaveNoInteractions();
        }

        @Test
        @DisplayName("❌ Rejects a video longer than the configured limit")
        void download_TooLong_Permanent() {
            given(mediaTool.invoke(eq(MediaOperation.DOWNLOAD), anyString(), anyString(), any()))
                    .willReturn(new MediaToolResult("blob:video", Map.of(MediaToolResult.DURATION_SECONDS, 10_000.0)));

            assertThatThrownBy(() -> handler.execute(context(WorkUnitKind.DOWNLOAD, PipelineStage.TRANSFER_IN,
                    Map.of(StageArtifacts.SOURCE_URL, "https://v/1.mp4"), Map.of())))
                    .isInstanceOf(PermanentInputException.class)
                    .hasMessageContaining("the limit is 150 minutes");
        }
    }

    @Nested
    @DisplayName("Merge")
    class Merge {

        private MergeStageHandler handler;

        @BeforeEach
        void createHandler() {
            handler = new MergeStageHandler(mediaTool);
        }

        @Test
        @DisplayName("✅ Is a no-op without a separate audio track")
        void merge_NoAudioTrack_NoOp() {
            StageOutcome outcome = handler.execute(context(WorkUnitKind.DOWNLOAD, PipelineStage.MERGE, Map.of(),
                    Map.of(StageArtifacts.VIDEO, "blob:video")));

            assertThat(outcome.artifacts()).isEmpty();
            then(mediaTool).shouldHaveNoInteractions();
        }

        @Test
        @DisplayName("✅ Muxes the audio track and replaces the video artifact")
        void merge_WithAudioTrack() {
            given(mediaTool.invoke(MediaOperation.MERGE, "blob:video", "work-units/8/attempt-2/merged.mp4",
                    Map.of(MediaTool.OPTION_AUDIO_REF, "blob:audio")))
                    .willReturn(new MediaToolResult("blob:merged", Map.of()));

            StageOutcome outcome = handler.execute(context(WorkUnitKind.DOWNLOAD, PipelineStage.MERGE, Map.of(),
                    Map.of(StageArtifacts.VIDEO, "blob:video", StageArtifacts.AUDIO_TRACK, "blob:audio")));

            assertThat(outcome.artifacts()).containsExactlyEntriesOf(Map.of(StageArtifacts.VIDEO, "blob:merged"));
        }
    }

    @Nested
    @DisplayName("SegmentAudio")
    class SegmentAudio {

        private SegmentAudioStageHandler handler;

        @BeforeEach
        void createHandler() {
            handler = new SegmentAudioStageHandler(mediaTool, blobStore, objectMapper);
        }

        @Test
        @DisplayName("✅ Stores the detected segments as JSON")
        void segments_Stored() throws Exception {
            given(mediaTool.invoke(eq(MediaOperation.DETECT_SEGMENTS), eq("uploads/a.wav"), isNull(), any()))
                    .willReturn(new MediaToolResult(null, Map.of(MediaToolResult.SEGMENTS,
                            List.of(new AudioSegment(0, 12_000), new AudioSegment(12_000, 30_000)))));
            given(blobStore.put(eq("work-units/8/attempt-2/segments.json"), any(InputStream.class)))
                    .willReturn("blob:segments");

            StageOutcome outcome = handler.execute(context(WorkUnitKind.EXTRACT_AUDIO, PipelineStage.SEGMENT_AUDIO,
                    Map.of("audioRef", "uploads/a.wav"), Map.of()));

            assertThat(outcome.artifacts()).containsEntry(StageArtifacts.SEGMENTS, "blob:segments");
            ArgumentCaptor<InputStream> json = ArgumentCaptor.forClass(InputStream.class);
            then(blobStore).should().put(eq("work-units/8/attempt-2/segments.json"), json.capture());
            assertThat(new String(json.getValue().readAllBytes()))
                    .isEqualTo("[{\"startMs\":0,\"endMs\":12000},{\"startMs\":12000,\"endMs\":30000}]");
        }

        @Test
        @DisplayName("❌ Fails when the tool reports no segment list")
        void segments_Missing_Fails() {
            given(mediaTool.invoke(eq(MediaOperation.DETECT_SEGMENTS), anyString(), isNull(), any()))
                    .willReturn(new MediaToolResult(null, Map.of()));

            assertThatThrownBy(() -> handler.execute(context(WorkUnitKind.EXTRACT_AUDIO, PipelineStage.SEGMENT_AUDIO,
                    Map.of(), Map.of(StageArtifacts.AUDIO, "blob:audio"))))
                    .isInstanceOf(MediaToolException.class)
                    .hasMessageContaining("no segments");
        }
    }

    @Nested
    @DisplayName("ExtractSegments")
    class ExtractSegments {

        private ExtractSegmentsStageHandler handler;

        @BeforeEach
        void createHandler() {
            handler = new ExtractSegmentsStageHandler(mediaTool, blobStore, objectMapper);
        }

        @Test
        @DisplayName("✅ Cuts one clip per suggestion and records the clip list")
        void cut_OnePerSuggestion() throws Exception {
            byte[] suggestions = objectMapper.writeValueAsBytes(List.of(
                    new SegmentSuggestion("Intro", 0, 15_000, List.of()),
                    new SegmentSuggestion("Joke", 40_000, 55_000, List.of("funny"))));
            given(blobStore.open("blob:suggestions")).willReturn(new ByteArrayInputStream(suggestions));
            given(mediaTool.invoke(eq(MediaOperation.CUT), eq("blob:video"), anyString(), any()))
                    .willAnswer(inv -> new MediaToolResult("blob:" + inv.getArgument(2), Map.of()));
            given(blobStore.put(eq("work-units/8/attempt-2/clips.json"), any(InputStream.class)))
                    .willReturn("blob:clips");

            Map<String, String> artifacts = new HashMap<>();
            artifacts.put(StageArtifacts.VIDEO, "blob:video");
            artifacts.put(StageArtifacts.SUGGESTIONS, "blob:suggestions");
            StageOutcome outcome = handler.execute(context(WorkUnitKind.SLICE_VIDEO, PipelineStage.EXTRACT_SEGMENTS,
                    Map.of(), artifacts));

            assertThat(outcome.artifacts()).containsEntry(StageArtifacts.CLIPS, "blob:clips");
            then(mediaTool).should(times(2)).invoke(eq(MediaOperation.CUT), eq("blob:video"), anyString(), any());
            then(mediaTool).should().invoke(MediaOperation.CUT, "blob:video",
                    "work-units/8/attempt-2/clips/clip-002.mp4",
                    Map.of(MediaTool.OPTION_START_MS, "40000", MediaTool.OPTION_END_MS, "55000"));
            then(progressReporter).should().report(100.0, "Extracted clip 2 of 2");
        }

        @Test
        @DisplayName("❌ Fails permanently without a video input")
        void cut_NoVideo_Permanent() {
            assertThatThrownBy(() -> handler.execute(context(WorkUnitKind.SLICE_VIDEO, PipelineStage.EXTRACT_SEGMENTS,
                    Map.of(), Map.of(StageArtifacts.SUGGESTIONS, "blob:suggestions"))))
                    .isInstanceOf(PermanentInputException.class)
                    .hasMessageContaining("Missing input 'video'");
        }
    }
}
