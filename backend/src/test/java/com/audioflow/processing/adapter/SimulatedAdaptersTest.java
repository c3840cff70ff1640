package com.audioflow.processing.adapter;

import com.audioflow.processing.service.FetchOptions;
import com.audioflow.processing.service.RecognitionResult;
import com.audioflow.processing.service.ResponseShape;
import com.audioflow.processing.service.TransportResponse;
import com.audioflow.transcriptions.model.LanguageTag;
import com.audioflow.transcriptions.model.TranscriptionOrigin;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class SimulatedAdaptersTest {

    private final SimulatedTransportAdapter transport = new SimulatedTransportAdapter(Duration.ZERO);
    private final SimulatedRecognitionAdapter recognition = new SimulatedRecognitionAdapter(Duration.ZERO);

    @Test
    void transportReturnsMockAudioNamedAfterFile() {
        TransportResponse response = transport.fetch("https://example.com/audio/meeting.mp3",
                FetchOptions.audio(Duration.ofSeconds(1), 1024));

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.contentType()).isEqualTo("audio/mpeg");
        assertThat(new String(response.payload(), StandardCharsets.UTF_8)).isEqualTo("MOCK_AUDIO_DATA_FOR_meeting.mp3");
    }

    @Test
    void transportHonoursJsonAndTextShapes() {
        TransportResponse json = transport.fetch("https://example.com/status",
                new FetchOptions(Duration.ofSeconds(1), 1024, ResponseShape.JSON, true));
        TransportResponse text = transport.fetch("https://example.com/readme.txt",
                new FetchOptions(Duration.ofSeconds(1), 1024, ResponseShape.TEXT, false));

        assertThat(json.contentType()).isEqualTo("application/json");
        assertThat(new String(json.payload(), StandardCharsets.UTF_8)).isEqualTo("{\"success\":true}");
        assertThat(text.contentType()).isEqualTo("text/plain");
        assertThat(new String(text.payload(), StandardCharsets.UTF_8)).contains("readme.txt");
    }

    @Test
    void recognitionReturnsCannedSentencePerLanguage() {
        RecognitionResult french = recognition.recognize(new byte[]{1, 2, 3}, LanguageTag.FR_FR);
        RecognitionResult fallback = recognition.recognize(new byte[0], null);

        assertThat(french.text()).startsWith("Ceci est une transcription");
        assertThat(french.language()).isEqualTo(LanguageTag.FR_FR);
        assertThat(french.confidence()).isEqualTo(0.95);
        assertThat(french.durationMs()).isEqualTo(2500L);
        assertThat(fallback.language()).isEqualTo(LanguageTag.EN_US);
        assertThat(fallback.text()).contains("English");
        assertThat(recognition.isAvailable()).isTrue();
        assertThat(recognition.origin()).isEqualTo(TranscriptionOrigin.SIMULATED);
    }
}
