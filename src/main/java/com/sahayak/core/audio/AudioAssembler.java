package com.sahayak.core.audio;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-user append-only buffer for the utterance currently being recorded.
 * <p>
 * A buffer exists only between the first chunk of an utterance and its
 * finalize; {@link #finalizeUtterance} removes it atomically.
 */
@Component
public class AudioAssembler {

    private static final byte[] EMPTY = new byte[0];

    private final Map<String, ByteArrayOutputStream> buffers = new ConcurrentHashMap<>();
    private final int minBytes;
    private final int maxBufferBytes;

    @Autowired
    public AudioAssembler(AudioProperties properties) {
        this(properties.getMinBytes(), properties.getMaxBufferBytes());
    }

    AudioAssembler(int minBytes, int maxBufferBytes) {
        this.minBytes = minBytes;
        this.maxBufferBytes = maxBufferBytes;
    }

    /**
     * Appends a chunk to the user's buffer, creating it if absent.
     *
     * @return the buffer size after the append
     */
    public int append(String userId, byte[] chunk) {
        ByteArrayOutputStream buffer = buffers.compute(userId, (key, existing) -> {
            ByteArrayOutputStream target = existing != null ? existing : new ByteArrayOutputStream();
            target.write(chunk, 0, chunk.length);
            return target;
        });
        return buffer.size();
    }

    /**
     * Removes and returns the accumulated bytes; empty when nothing was buffered.
     */
    public byte[] finalizeUtterance(String userId) {
        ByteArrayOutputStream buffer = buffers.remove(userId);
        return buffer == null ? EMPTY : buffer.toByteArray();
    }

    public void discard(String userId) {
        buffers.remove(userId);
    }

    public boolean hasBuffer(String userId) {
        return buffers.containsKey(userId);
    }

    public boolean isUsable(byte[] audio) {
        return audio.length >= minBytes;
    }

    public boolean exceedsLimit(int bufferedBytes) {
        return bufferedBytes >= maxBufferBytes;
    }
}
