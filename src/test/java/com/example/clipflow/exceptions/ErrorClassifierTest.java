package com.example.clipflow.exceptions;

import com.example.clipflow.domain.ErrorClassification;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ErrorClassifier Tests")
class ErrorClassifierTest {

    @Test
    @DisplayName("✅ Network and server failures are transient")
    void transientFailures() {
        assertThat(ErrorClassifier.classify(new TimeoutException())).isEqualTo(ErrorClassification.TRANSIENT);
        assertThat(ErrorClassifier.classify(new IOException("reset"))).isEqualTo(ErrorClassification.TRANSIENT);
        assertThat(ErrorClassifier.classify(new ResourceAccessException("refused")))
                .isEqualTo(ErrorClassification.TRANSIENT);
        assertThat(ErrorClassifier.classify(new HttpServerErrorException(HttpStatus.BAD_GATEWAY)))
                .isEqualTo(ErrorClassification.TRANSIENT);
        assertThat(ErrorClassifier.classify(new HttpClientErrorException(HttpStatus.TOO_MANY_REQUESTS)))
                .isEqualTo(ErrorClassification.TRANSIENT);
    }

    @Test
    @DisplayName("✅ Client errors and bad arguments are permanent")
    void permanentFailures() {
        assertThat(ErrorClassifier.classify(new HttpClientErrorException(HttpStatus.BAD_REQUEST)))
                .isEqualTo(ErrorClassification.PERMANENT);
        assertThat(ErrorClassifier.classify(new IllegalArgumentException("bad")))
                .isEqualTo(ErrorClassification.PERMANENT);
        assertThat(ErrorClassifier.classify(new IllegalStateException("unknown")))
                .isEqualTo(ErrorClassification.PERMANENT);
    }

    @Test
    @DisplayName("✅ Pipeline exceptions keep their own classification, also when wrapped")
    void pipelineExceptions_FoundInCauseChain() {
        RuntimeException wrapped = new RuntimeException("outer",
                new CallbackTimeoutException("no result within 30m"));
        assertThat(ErrorClassifier.classify(wrapped)).isEqualTo(ErrorClassification.CALLBACK_TIMEOUT);
        assertThat(ErrorClassifier.classify(new ConcurrencyConflictException("lease lost")))
                .isEqualTo(ErrorClassification.CONFLICT);
    }

    @Test
    @DisplayName("✅ describe prefixes the message by classification")
    void describe_PrefixesMessage() {
        assertThat(ErrorClassifier.describe(new TransientExternalException("503 from ASR")))
                .isEqualTo("Temporary failure: 503 from ASR");
        assertThat(ErrorClassifier.describe(new PermanentInputException("empty audio")))
                .isEqualTo("Failed: empty audio");
    }
}
