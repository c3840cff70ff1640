package com.audioflow.processing.adapter;

import com.audioflow.config.AppProperties;
import com.audioflow.processing.service.RecognitionException;
import com.audioflow.processing.service.RecognitionResult;
import com.audioflow.transcriptions.model.LanguageTag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AzureSpeechRecognitionAdapterTest {

    private final AzureSpeechRecognitionAdapter adapter = new AzureSpeechRecognitionAdapter(
            new AppProperties.Azure("key", "westeurope", 60), Duration.ofMillis(50));

    @Test
    void timeoutWithRecognizedTextReturnsItWithoutConfidence() throws Exception {
        List<String> segments = new ArrayList<>(List.of("bonjour", "tout le monde"));

        RecognitionResult result = adapter.awaitResult(segments, new CompletableFuture<>(), LanguageTag.FR_FR,
                System.currentTimeMillis());

        assertThat(result.text()).isEqualTo("bonjour tout le monde");
        assertThat(result.language()).isEqualTo(LanguageTag.FR_FR);
        assertThat(result.confidence()).isNull();
    }

    @Test
    void timeoutWithoutTextFails() {
        assertThatThrownBy(() -> adapter.awaitResult(new ArrayList<>(), new CompletableFuture<>(), LanguageTag.EN_US,
                System.currentTimeMillis()))
                .isInstanceOf(RecognitionException.class)
                .hasMessageContaining("timed out after 50ms");
    }

    @Test
    void errorCancellationFails() {
        CompletableFuture<Void> completion = new CompletableFuture<>();
        AzureSpeechRecognitionAdapter.onCanceled(true, "AuthenticationFailure invalid key", completion);

        assertThatThrownBy(() -> adapter.awaitResult(new ArrayList<>(List.of("partial")), completion, LanguageTag.EN_US,
                System.currentTimeMillis()))
                .isInstanceOf(RecognitionException.class)
                .hasMessage("Azure Speech canceled: AuthenticationFailure invalid key");
    }

    @Test
    void endOfStreamCancellationReturnsRecognizedText() throws Exception {
        CompletableFuture<Void> completion = new CompletableFuture<>();
        AzureSpeechRecognitionAdapter.onCanceled(false, "EndOfStream", completion);

        RecognitionResult result = adapter.awaitResult(new ArrayList<>(List.of("hello", "world")), completion,
                LanguageTag.EN_US, System.currentTimeMillis());

        assertThat(result.text()).isEqualTo("hello world");
        assertThat(result.confidence()).isEqualTo(0.9);
    }
}
