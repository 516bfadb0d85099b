package com.sahayak.core.speech;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Audio container formats accepted by the transcription service, detected from
 * the payload's leading bytes.
 */
public enum AudioFormat {
    WAV("audio/wav"),
    WEBM("audio/webm"),
    OGG("audio/ogg"),
    FLAC("audio/flac"),
    MP3("audio/mp3"),
    MP4("audio/mp4");

    /** Header length needed for a reliable match. */
    static final int HEADER_BYTES = 12;

    private static final byte[] EBML = {0x1A, 0x45, (byte) 0xDF, (byte) 0xA3};

    private final String mimeType;

    AudioFormat(String mimeType) {
        this.mimeType = mimeType;
    }

    public String mimeType() {
        return mimeType;
    }

    /**
     * Classifies the payload. Short or unrecognized payloads are assumed to be
     * WebM, which is what browser recorders produce.
     */
    public static AudioFormat detect(byte[] audio) {
        if (audio == null || audio.length < HEADER_BYTES) {
            return WEBM;
        }
        if (startsWith(audio, 0, ascii("RIFF")) && startsWith(audio, 8, ascii("WAVE"))) {
            return WAV;
        }
        if (startsWith(audio, 0, EBML)) {
            return WEBM;
        }
        if (startsWith(audio, 0, ascii("OggS"))) {
            return OGG;
        }
        if (startsWith(audio, 0, ascii("fLaC"))) {
            return FLAC;
        }
        if (startsWith(audio, 0, ascii("ID3")) || isMpegFrameSync(audio)) {
            return MP3;
        }
        if (startsWith(audio, 4, ascii("ftyp"))) {
            return MP4;
        }
        return WEBM;
    }

    /**
     * Encoding hint for payloads too short to carry a container header.
     */
    public static String encodingHint(byte[] audio) {
        return audio == null || audio.length < HEADER_BYTES ? "opus" : null;
    }

    private static boolean isMpegFrameSync(byte[] audio) {
        return (audio[0] & 0xFF) == 0xFF && (audio[1] & 0xE0) == 0xE0;
    }

    private static boolean startsWith(byte[] data, int offset, byte[] prefix) {
        if (data.length < offset + prefix.length) {
            return false;
        }
        return Arrays.equals(data, offset, offset + prefix.length, prefix, 0, prefix.length);
    }

    private static byte[] ascii(String s) {
        return s.getBytes(StandardCharsets.US_ASCII);
    }
}
