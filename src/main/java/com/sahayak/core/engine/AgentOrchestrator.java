package com.sahayak.core.engine;

import com.sahayak.core.audio.AudioAssembler;
import com.sahayak.core.audio.AudioProperties;
import com.sahayak.core.audit.AuditException;
import com.sahayak.core.audit.AuditRecorder;
import com.sahayak.core.logging.MdcContext;
import com.sahayak.core.metrics.SahayakMetrics;
import com.sahayak.core.model.ActionPlan;
import com.sahayak.core.model.AuditRecord;
import com.sahayak.core.model.ConversationState;
import com.sahayak.core.model.UserContext;
import com.sahayak.core.planner.PlanGenerator;
import com.sahayak.core.protocol.AgentSpeak;
import com.sahayak.core.protocol.InboundMessage;
import com.sahayak.core.protocol.MalformedFrameException;
import com.sahayak.core.protocol.MessageType;
import com.sahayak.core.protocol.OutboundFrame;
import com.sahayak.core.protocol.Payloads;
import com.sahayak.core.protocol.ProtocolCodec;
import com.sahayak.core.ratelimit.RateLimiter;
import com.sahayak.core.session.ClientConnection;
import com.sahayak.core.session.ConnectionRegistry;
import com.sahayak.core.session.DisconnectReason;
import com.sahayak.core.session.UserContextStore;
import com.sahayak.core.speech.SpeechSynthesizer;
import com.sahayak.core.speech.SynthesisException;
import com.sahayak.core.speech.TranscriptionClient;
import com.sahayak.core.speech.TranscriptionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs the voice-command protocol for every connected user.
 * <p>
 * Frames for one connection arrive one at a time on the transport thread and
 * are handled inline, so a command episode (transcribe, plan, log, speak,
 * dispatch) finishes before the next frame of that connection is read.
 * Different connections are handled in parallel; the only shared state is
 * in the per-user keyed maps of the collaborators.
 * <p>
 * Failures of the external AI services degrade the reply but never end the
 * session. Only transport failures and unexpected errors close it.
 */
@Service
public class AgentOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AgentOrchestrator.class);

    static final String NO_AUDIO_REPLY = "I didn't hear anything. Please try again.";
    static final String NOT_CAUGHT_REPLY = "Sorry, I didn't catch that. Could you please repeat?";
    static final String DONE_REPLY = "Done. What else can I help you with?";
    static final String FAILURE_REPLY = "Sorry, something went wrong: %s";

    private final ConnectionRegistry registry;
    private final UserContextStore contextStore;
    private final AudioAssembler audioAssembler;
    private final TranscriptionClient transcriptionClient;
    private final PlanGenerator planGenerator;
    private final SpeechSynthesizer speechSynthesizer;
    private final AuditRecorder auditRecorder;
    private final RateLimiter rateLimiter;
    private final ProtocolCodec codec;
    private final SahayakMetrics metrics;
    private final AudioProperties audioProperties;

    private final Map<String, ConversationState> states = new ConcurrentHashMap<>();

    public AgentOrchestrator(ConnectionRegistry registry,
                             UserContextStore contextStore,
                             AudioAssembler audioAssembler,
                             TranscriptionClient transcriptionClient,
                             PlanGenerator planGenerator,
                             SpeechSynthesizer speechSynthesizer,
                             AuditRecorder auditRecorder,
                             RateLimiter rateLimiter,
                             ProtocolCodec codec,
                             SahayakMetrics metrics,
                             AudioProperties audioProperties) {
        this.registry = registry;
        this.contextStore = contextStore;
        this.audioAssembler = audioAssembler;
        this.transcriptionClient = transcriptionClient;
        this.planGenerator = planGenerator;
        this.speechSynthesizer = speechSynthesizer;
        this.auditRecorder = auditRecorder;
        this.rateLimiter = rateLimiter;
        this.codec = codec;
        this.metrics = metrics;
        this.audioProperties = audioProperties;
    }

    // ── Lifecycle ─────────────────────────────────────────────────────────

    /**
     * Registers an authenticated connection, closing any connection it replaces.
     *
     * @return false when the connection carries no user and was closed
     */
    public boolean onConnect(ClientConnection connection) {
        String userId = connection.userId();
        if (userId == null || userId.isBlank()) {
            log.warn("Connection {} has no authenticated user; closing", connection.id());
            connection.close(DisconnectReason.POLICY_VIOLATION);
            return false;
        }
        if (registry.isConnected(userId)) {
            // the displaced session's utterance cannot be finished by the new one
            audioAssembler.discard(userId);
            metrics.recordConnection("replaced");
        }
        registry.register(userId, connection);
        states.put(userId, ConversationState.IDLE);
        metrics.recordConnection("opened");
        log.info("User {} connected ({} active)", userId, registry.activeCount());
        return true;
    }

    /**
     * Releases the user's per-connection state. A late close from a displaced
     * connection leaves its replacement untouched.
     */
    public void onDisconnect(ClientConnection connection) {
        String userId = connection.userId();
        if (userId == null) {
            return;
        }
        MdcContext.setUser(userId);
        try {
            if (cleanup(connection)) {
                metrics.recordConnection("closed");
                log.info("User {} disconnected", userId);
            } else {
                log.debug("Displaced connection {} for user {} closed", connection.id(), userId);
            }
        } finally {
            MdcContext.clear();
        }
    }

    public void onTransportError(ClientConnection connection, Throwable error) {
        log.warn("Transport error on connection {} for user {}: {}",
                connection.id(), connection.userId(), error.getMessage());
        metrics.recordConnection("error");
        connection.close(DisconnectReason.SERVER_ERROR);
        onDisconnect(connection);
    }

    // ── Inbound frames ────────────────────────────────────────────────────

    public void onAudioChunk(ClientConnection connection, byte[] chunk) {
        guarded(connection, () -> appendAudio(connection, chunk));
    }

    public void onTextFrame(ClientConnection connection, String text) {
        guarded(connection, () -> handleText(connection, text));
    }

    private void handleText(ClientConnection connection, String text) throws IOException {
        String userId = connection.userId();
        try {
            InboundMessage message = codec.decode(text);
            if (message.type() != MessageType.AUDIO_CHUNK_BASE64 && !rateLimiter.checkMessage(userId)) {
                metrics.recordRateLimited("message");
                log.debug("Message rate exceeded; dropping {} frame", message.type());
                return;
            }
            switch (message.type()) {
                case CONTEXT_UPDATE -> updateContext(userId, codec.readPayload(message, UserContext.class));
                case AUDIO_CHUNK_BASE64 -> appendBase64Audio(connection,
                        codec.readPayload(message, Payloads.AudioChunk.class));
                case AUDIO_END -> finishUtterance(connection,
                        codec.readPayload(message, Payloads.AudioEnd.class).language());
                case TEXT_COMMAND -> handleTextCommand(connection,
                        codec.readPayload(message, Payloads.TextCommand.class));
                case EXECUTION_RESULT -> handleExecutionResult(connection,
                        codec.readPayload(message, Payloads.ExecutionResult.class));
                default -> throw new MalformedFrameException(MalformedFrameException.UNKNOWN_TYPE,
                        "Unsupported inbound frame type: " + message.type());
            }
        } catch (MalformedFrameException e) {
            rejectFrame(connection, e);
        }
    }

    private void updateContext(String userId, UserContext context) {
        contextStore.update(userId, context);
        log.debug("Context updated: url={}, {} visible element(s)", context.url(), context.ariaIds().size());
    }

    private void appendBase64Audio(ClientConnection connection, Payloads.AudioChunk chunk) throws IOException {
        if (chunk.data() == null || chunk.data().isEmpty()) {
            log.debug("Empty base64 audio chunk ignored");
            return;
        }
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(chunk.data());
        } catch (IllegalArgumentException e) {
            log.warn("Dropping undecodable base64 audio chunk: {}", e.getMessage());
            return;
        }
        appendAudio(connection, bytes);
    }

    private void appendAudio(ClientConnection connection, byte[] chunk) throws IOException {
        if (chunk.length == 0) {
            return;
        }
        String userId = connection.userId();
        int buffered = audioAssembler.append(userId, chunk);
        states.put(userId, ConversationState.RECORDING);
        if (audioAssembler.exceedsLimit(buffered)) {
            log.warn("Audio buffer reached {} bytes; finalizing utterance early", buffered);
            finishUtterance(connection, null);
        }
    }

    private void finishUtterance(ClientConnection connection, String language) throws IOException {
        String userId = connection.userId();
        byte[] audio = audioAssembler.finalizeUtterance(userId);
        states.put(userId, ConversationState.PROCESSING);
        try {
            metrics.recordUtteranceBytes(audio.length);
            if (!audioAssembler.isUsable(audio)) {
                log.info("Utterance too short ({} bytes); not transcribing", audio.length);
                speak(connection, NO_AUDIO_REPLY);
                return;
            }
            String lang = language == null || language.isBlank() ? audioProperties.getDefaultLanguage() : language;
            Optional<String> transcript;
            try {
                transcript = transcriptionClient.transcribe(audio, lang);
            } catch (TranscriptionException e) {
                log.warn("Transcription failed: {}", e.getMessage());
                metrics.recordUpstreamFailure("stt");
                transcript = Optional.empty();
            }
            if (transcript.isEmpty() || transcript.get().isBlank()) {
                speak(connection, NOT_CAUGHT_REPLY);
                return;
            }
            metrics.recordCommand("voice");
            runCommand(connection, transcript.get());
        } finally {
            states.replace(userId, ConversationState.PROCESSING, ConversationState.IDLE);
        }
    }

    private void handleTextCommand(ClientConnection connection, Payloads.TextCommand command) throws IOException {
        if (command.text() == null || command.text().isBlank()) {
            log.warn("Ignoring blank TEXT_COMMAND");
            return;
        }
        String userId = connection.userId();
        states.put(userId, ConversationState.PROCESSING);
        try {
            metrics.recordCommand("text");
            runCommand(connection, command.text().trim());
        } finally {
            states.replace(userId, ConversationState.PROCESSING, ConversationState.IDLE);
        }
    }

    private void handleExecutionResult(ClientConnection connection, Payloads.ExecutionResult result)
            throws IOException {
        String userId = connection.userId();
        Optional<String> auditId = auditRecorder.resolve(result.planId(), userId);
        if (auditId.isEmpty()) {
            log.debug("Ignoring execution result for unknown plan {}", result.planId());
            return;
        }
        MdcContext.setPlan(userId, result.planId());
        try {
            boolean success = result.succeeded();
            auditRecorder.updateResult(auditId.get(),
                    success ? AuditRecord.SUCCESS : AuditRecord.FAILED,
                    success ? null : result.error());
            metrics.recordExecutionResult(success);
            log.info("Plan {} finished: {}", result.planId(), success ? "success" : "failed");
            speak(connection, success ? DONE_REPLY : failureReply(result.error()));
        } finally {
            MdcContext.clearPlan();
        }
    }

    // ── Command pipeline ──────────────────────────────────────────────────

    /**
     * Plans the command, records it, and sends the acknowledgement followed by
     * the plan. The acknowledgement must go first: a dispatched navigation can
     * make the client drop the socket.
     */
    private void runCommand(ClientConnection connection, String commandText) throws IOException {
        String userId = connection.userId();
        UserContext context = contextStore.get(userId);

        ActionPlan plan = plan(commandText, context);
        metrics.recordPlan(plan.source());
        MdcContext.setPlan(userId, plan.planId());
        try {
            try {
                auditRecorder.logCommand(userId, commandText, plan, auditContext(context));
            } catch (AuditException e) {
                log.warn("Audit log failed for plan {}; dispatching anyway: {}", plan.planId(), e.getMessage());
                metrics.recordUpstreamFailure("audit");
            }

            Optional<String> acknowledgement = plan.acknowledgement();
            if (acknowledgement.isPresent()) {
                speak(connection, acknowledgement.get());
            }
            send(connection, OutboundFrame.actionDispatch(plan));
            log.info("Dispatched plan {} ({} step(s), source {})", plan.planId(), plan.steps().size(), plan.source());
        } finally {
            MdcContext.clearPlan();
        }
    }

    private ActionPlan plan(String commandText, UserContext context) {
        long start = System.currentTimeMillis();
        try {
            ActionPlan plan = planGenerator.generate(commandText, context);
            metrics.recordPlanningDuration(System.currentTimeMillis() - start);
            return plan;
        } catch (RuntimeException e) {
            if (planGenerator.isConfigured()) {
                log.warn("Planner failed, using fallback plan: {}", e.getMessage());
                metrics.recordUpstreamFailure("llm");
            } else {
                log.debug("Planner not configured, using fallback plan");
            }
            return planGenerator.createFallbackPlan(commandText);
        }
    }

    private static Map<String, Object> auditContext(UserContext context) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("url", context.url());
        metadata.put("aria_ids", List.copyOf(context.ariaIds()));
        metadata.put("locale", context.locale());
        return metadata;
    }

    static String failureReply(String error) {
        return FAILURE_REPLY.formatted(error == null || error.isBlank() ? "unknown error" : error);
    }

    // ── Outbound ──────────────────────────────────────────────────────────

    private void speak(ClientConnection connection, String text) throws IOException {
        send(connection, OutboundFrame.agentSpeak(speech(text)));
    }

    private AgentSpeak speech(String text) {
        try {
            return speechSynthesizer.synthesize(text)
                    .map(audio -> AgentSpeak.withAudio(text, audio))
                    .orElseGet(() -> AgentSpeak.textOnly(text));
        } catch (SynthesisException e) {
            log.warn("Speech synthesis failed, client will speak the text: {}", e.getMessage());
            metrics.recordUpstreamFailure("tts");
            return AgentSpeak.textOnly(text);
        }
    }

    private void send(ClientConnection connection, OutboundFrame frame) throws IOException {
        if (!connection.isOpen()) {
            log.debug("Connection {} closed; dropping {} frame", connection.id(), frame.type());
            return;
        }
        connection.send(frame);
    }

    private void rejectFrame(ClientConnection connection, MalformedFrameException e) throws IOException {
        log.warn("Rejected frame: {}", e.getMessage());
        metrics.recordMalformedFrame(e.getCode());
        send(connection, OutboundFrame.error(e.getCode(), e.getMessage()));
    }

    /**
     * Speaks a text to every connected user.
     *
     * @return number of connections reached
     */
    public int announce(String text) {
        int delivered = registry.broadcast(OutboundFrame.agentSpeak(speech(text)));
        log.info("Announcement delivered to {} connection(s)", delivered);
        return delivered;
    }

    // ── State ─────────────────────────────────────────────────────────────

    public Optional<ConversationState> stateOf(String userId) {
        return Optional.ofNullable(states.get(userId));
    }

    public UserContext contextOf(String userId) {
        return contextStore.get(userId);
    }

    public int activeConnections() {
        return registry.activeCount();
    }

    private boolean cleanup(ClientConnection connection) {
        String userId = connection.userId();
        if (!registry.unregister(userId, connection)) {
            return false;
        }
        audioAssembler.discard(userId);
        contextStore.discard(userId);
        states.remove(userId);
        auditRecorder.abandonPending(userId);
        return true;
    }

    private void guarded(ClientConnection connection, FrameAction action) {
        MdcContext.setUser(connection.userId());
        try {
            action.run();
        } catch (IOException e) {
            log.warn("Send failed on connection {}; closing: {}", connection.id(), e.getMessage());
            terminate(connection);
        } catch (RuntimeException e) {
            log.error("Unexpected error on connection {}; closing", connection.id(), e);
            terminate(connection);
        } finally {
            MdcContext.clear();
        }
    }

    private void terminate(ClientConnection connection) {
        metrics.recordConnection("error");
        connection.close(DisconnectReason.SERVER_ERROR);
        cleanup(connection);
    }

    @FunctionalInterface
    private interface FrameAction {
        void run() throws IOException;
    }
}
