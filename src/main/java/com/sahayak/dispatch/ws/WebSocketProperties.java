package com.sahayak.dispatch.ws;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "sahayak.websocket")
public class WebSocketProperties {

    private String path = "/ws/agent/v1";
    private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:5173", "http://localhost:3000"));
    private int sendTimeLimitMs = 10_000;
    private int sendBufferSizeLimit = 512 * 1024;
    private int maxTextMessageBytes = 512 * 1024;
    private int maxBinaryMessageBytes = 1024 * 1024;

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    public int getSendTimeLimitMs() {
        return sendTimeLimitMs;
    }

    public void setSendTimeLimitMs(int sendTimeLimitMs) {
        this.sendTimeLimitMs = sendTimeLimitMs;
    }

    public int getSendBufferSizeLimit() {
        return sendBufferSizeLimit;
    }

    public void setSendBufferSizeLimit(int sendBufferSizeLimit) {
        this.sendBufferSizeLimit = sendBufferSizeLimit;
    }

    public int getMaxTextMessageBytes() {
        return maxTextMessageBytes;
    }

    public void setMaxTextMessageBytes(int maxTextMessageBytes) {
        this.maxTextMessageBytes = maxTextMessageBytes;
    }

    public int getMaxBinaryMessageBytes() {
        return maxBinaryMessageBytes;
    }

    public void setMaxBinaryMessageBytes(int maxBinaryMessageBytes) {
        this.maxBinaryMessageBytes = maxBinaryMessageBytes;
    }
}
