package com.example.clipflow.service.impl;

import com.example.clipflow.exceptions.PermanentInputException;
import com.example.clipflow.service.BlobStore;
import com.example.clipflow.service.RecognitionRequest;
import com.example.clipflow.service.RecognitionSubmission;
import com.example.clipflow.service.RetryPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("TusRecognitionClient Tests")
class TusRecognitionClientTest {

    private static final String AUDIO_REF = "work-units/5/attempt-1/audio.wav";
    private static final byte[] AUDIO = "0123456789".getBytes(StandardCharsets.US_ASCII);

    @Mock
    private BlobStore blobStore;

    private MockRestServiceServer server;
    private TusRecognitionClient client;
    private final RetryPolicy retryPolicy = new RetryPolicy(3, Duration.ZERO, Duration.ZERO, duration -> { });

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new TusRecognitionClient(builder, blobStore, new ObjectMapper(),
                "http://asr", "http://tus/", "http://clipflow/api/recognition/callback");
    }

    private void stubAudio(byte[] content) {
        willAnswer(inv -> {
            Files.write(inv.getArgument(1, Path.class), content);
            return null;
        }).given(blobStore).copyTo(eq(AUDIO_REF), any(Path.class));
    }

    private RecognitionRequest request() {
        return new RecognitionRequest("corr-1", AUDIO_REF, "audio.wav", "en", "base", 4);
    }

    private HttpHeaders offset(long value) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(TusRecognitionClient.HEADER_UPLOAD_OFFSET, Long.toString(value));
        return headers;
    }

    @Test
    @DisplayName("✅ Creates the task, uploads in chunks and resumes from the server offset after a failed chunk")
    void submit_ResumesAfterFailedChunk() {
        stubAudio(AUDIO);
        server.expect(requestTo("http://asr/api/v1/asr-tasks"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.correlation_id").value("corr-1"))
                .andExpect(jsonPath("$.filesize").value(10))
                .andExpect(jsonPath("$.callback_url").value("http://clipflow/api/recognition/callback"))
                .andRespond(withSuccess("{\"task_id\":\"t-9\",\"upload_url\":\"http://tus/files\"}",
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo("http://tus/files"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(TusRecognitionClient.HEADER_TUS_RESUMABLE, "1.0.0"))
                .andExpect(header(TusRecognitionClient.HEADER_UPLOAD_LENGTH, "10"))
                .andRespond(withCreatedEntity(URI.create("/files/abc")));
        server.expect(requestTo("http://tus/files/abc"))
                .andExpect(method(HttpMethod.PATCH))
                .andExpect(header(TusRecognitionClient.HEADER_UPLOAD_OFFSET, "0"))
                .andExpect(content().bytes("0123".getBytes(StandardCharsets.US_ASCII)))
                .andRespond(withStatus(HttpStatus.NO_CONTENT).headers(offset(4)));
        server.expect(requestTo("http://tus/files/abc"))
                .andExpect(method(HttpMethod.PATCH))
                .andExpect(header(TusRecognitionClient.HEADER_UPLOAD_OFFSET, "4"))
                .andRespond(withServerError());
        server.expect(requestTo("http://tus/files/abc"))
                .andExpect(method(HttpMethod.HEAD))
                .andRespond(withStatus(HttpStatus.OK).headers(offset(6)));
        server.expect(requestTo("http://tus/files/abc"))
                .andExpect(method(HttpMethod.PATCH))
                .andExpect(header(TusRecognitionClient.HEADER_UPLOAD_OFFSET, "6"))
                .andExpect(content().bytes("6789".getBytes(StandardCharsets.US_ASCII)))
                .andRespond(withStatus(HttpStatus.NO_CONTENT).headers(offset(10)));

        List<Long> reported = new ArrayList<>();
        RecognitionSubmission submission = client.submit(request(), retryPolicy,
                (uploaded, total) -> reported.add(uploaded));

        server.verify();
        assertThat(submission.remoteTaskId()).isEqualTo("t-9");
        assertThat(submission.uploadUrl()).isEqualTo("http://tus/files/abc");
        assertThat(submission.uploadedBytes()).isEqualTo(10L);
        assertThat(reported).containsExactly(4L, 10L);
    }

    @Test
    @DisplayName("❌ Empty audio is a permanent failure and nothing is sent")
    void submit_EmptyAudio() {
        stubAudio(new byte[0]);

        assertThatThrownBy(() -> client.submit(request(), retryPolicy, null))
                .isInstanceOf(PermanentInputException.class)
                .hasMessageContaining("empty");
        server.verify();
    }

    @Test
    @DisplayName("❌ A rejected task is not retried")
    void submit_TaskRejected() {
        stubAudio(AUDIO);
        server.expect(requestTo("http://asr/api/v1/asr-tasks"))
                .andRespond(withBadRequest());

        assertThatThrownBy(() -> client.submit(request(), retryPolicy, null))
                .isInstanceOf(RuntimeException.class);
        server.verify();
    }

    @Test
    @DisplayName("✅ fetchResult unwraps the result envelope")
    void fetchResult_Envelope() {
        server.expect(requestTo("http://asr/results/42"))
                .andRespond(withSuccess("{\"code\":0,\"data\":\"1\\n00:00:00,000 --> 00:00:01,000\\nhi\"}",
                        MediaType.APPLICATION_JSON));

        assertThat(client.fetchResult("results/42", retryPolicy)).startsWith("1\n00:00:00,000");
    }

    @Test
    @DisplayName("✅ fetchResult returns a plain body unchanged")
    void fetchResult_Plain() {
        server.expect(requestTo("http://asr/results/43"))
                .andRespond(withSuccess("plain transcript", MediaType.TEXT_PLAIN));

        assertThat(client.fetchResult("results/43", retryPolicy)).isEqualTo("plain transcript");
    }

    @Test
    @DisplayName("❌ An error envelope is a permanent failure")
    void fetchResult_ErrorEnvelope() {
        server.expect(requestTo("http://asr/results/44"))
                .andRespond(withSuccess("{\"code\":500,\"msg\":\"decode failed\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.fetchResult("results/44", retryPolicy))
                .isInstanceOf(PermanentInputException.class);
    }

    @Test
    @DisplayName("✅ Upload metadata is sorted and Base64 encoded")
    void encodeMetadata() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("task_id", "t");
        values.put("filename", "a.wav");

        assertThat(TusRecognitionClient.encodeMetadata(values)).isEqualTo("filename YS53YXY=,task_id dA==");
    }
}
