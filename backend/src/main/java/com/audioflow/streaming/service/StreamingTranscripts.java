package com.audioflow.streaming.service;

import java.util.List;

public final class StreamingTranscripts {

    static final String WELCOME_TEXT = "Connected. Ready to receive audio chunks.";
    static final double MAX_PARTIAL_CONFIDENCE = 0.95;

    private static final List<String> VOCABULARY = List.of(
            "Hello", "this", "is", "a", "streaming", "transcription", "test", "with", "partial", "results",
            "being", "sent", "in", "real", "time", "as", "audio", "chunks", "are", "processed"
    );
    private static final int WORDS_PER_CHUNK = 2;

    private StreamingTranscripts() {
    }

    public static String partialText(int chunks) {
        int words = Math.min(Math.max(chunks, 0) * WORDS_PER_CHUNK, VOCABULARY.size());
        return String.join(" ", VOCABULARY.subList(0, words));
    }

    public static double partialConfidence(int chunks) {
        double confidence = Math.min(0.5 + Math.max(chunks, 0) * 0.05, MAX_PARTIAL_CONFIDENCE);
        return Math.round(confidence * 100.0) / 100.0;
    }

    public static String finalText(String sessionId, int chunks) {
        return "This is a simulated streaming transcription result from " + chunks + " audio chunks. "
                + "Session ID: " + sessionId + ". "
                + "The streaming service processed the audio in real time and generated partial results throughout the session.";
    }
}
