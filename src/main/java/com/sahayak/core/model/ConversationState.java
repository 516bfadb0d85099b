package com.sahayak.core.model;

/**
 * Per-connection protocol state.
 */
public enum ConversationState {
    /** Connected, no utterance in progress. */
    IDLE,
    /** Audio chunks are being accumulated. */
    RECORDING,
    /** Transcribe, plan, log, speak and dispatch are running for one command. */
    PROCESSING
}
