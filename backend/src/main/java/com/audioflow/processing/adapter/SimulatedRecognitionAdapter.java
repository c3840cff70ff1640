package com.audioflow.processing.adapter;

import com.audioflow.processing.service.RecognitionAdapter;
import com.audioflow.processing.service.RecognitionException;
import com.audioflow.processing.service.RecognitionResult;
import com.audioflow.transcriptions.model.LanguageTag;
import com.audioflow.transcriptions.model.TranscriptionOrigin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

public class SimulatedRecognitionAdapter implements RecognitionAdapter {

    private static final Logger log = LoggerFactory.getLogger(SimulatedRecognitionAdapter.class);
    private static final double CONFIDENCE = 0.95;
    private static final long DURATION_MS = 2500;
    private static final Map<LanguageTag, String> SENTENCES = new EnumMap<>(LanguageTag.class);

    static {
        SENTENCES.put(LanguageTag.EN_US, "This is a simulated transcription in English. The audio has been processed successfully.");
        SENTENCES.put(LanguageTag.FR_FR, "Ceci est une transcription simulée en français. L'audio a été traité avec succès.");
        SENTENCES.put(LanguageTag.ES_ES, "Esta es una transcripción simulada en español. El audio se ha procesado correctamente.");
        SENTENCES.put(LanguageTag.DE_DE, "Dies ist eine simulierte Transkription auf Deutsch. Das Audio wurde erfolgreich verarbeitet.");
        SENTENCES.put(LanguageTag.IT_IT, "Questa è una trascrizione simulata in italiano. L'audio è stato elaborato con successo.");
        SENTENCES.put(LanguageTag.JA_JP, "これは日本語のシミュレーション文字起こしです。オーディオは正常に処理されました。");
        SENTENCES.put(LanguageTag.KO_KR, "이것은 한국어 시뮬레이션 전사입니다. 오디오가 성공적으로 처리되었습니다.");
    }

    private final Duration delay;

    public SimulatedRecognitionAdapter(Duration delay) {
        this.delay = delay;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public TranscriptionOrigin origin() {
        return TranscriptionOrigin.SIMULATED;
    }

    @Override
    public RecognitionResult recognize(byte[] payload, LanguageTag language) {
        LanguageTag effective = language == null ? LanguageTag.DEFAULT : language;
        log.info("Simulated recognition of {} bytes ({})", payload.length, effective.tag());

        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            throw new RecognitionException("Simulated recognition interrupted", exception);
        }

        String text = SENTENCES.getOrDefault(effective, SENTENCES.get(LanguageTag.DEFAULT));
        return new RecognitionResult(text, effective, CONFIDENCE, DURATION_MS);
    }
}
