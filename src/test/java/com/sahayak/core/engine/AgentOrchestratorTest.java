package com.sahayak.core.engine;

import com.sahayak.core.audio.AudioAssembler;
import com.sahayak.core.audio.AudioProperties;
import com.sahayak.core.audit.AuditException;
import com.sahayak.core.audit.AuditProperties;
import com.sahayak.core.audit.AuditRecorder;
import com.sahayak.core.audit.AuditStore;
import com.sahayak.core.audit.InMemoryAuditStore;
import com.sahayak.core.audit.PendingAuditIndex;
import com.sahayak.core.llm.LlmException;
import com.sahayak.core.llm.LlmProperties;
import com.sahayak.core.llm.LlmService;
import com.sahayak.core.logging.MdcContext;
import com.sahayak.core.metrics.SahayakMetrics;
import com.sahayak.core.model.ActionPlan;
import com.sahayak.core.model.AuditRecord;
import com.sahayak.core.model.ConversationState;
import com.sahayak.core.model.Step;
import com.sahayak.core.planner.PlanGenerator;
import com.sahayak.core.protocol.AgentSpeak;
import com.sahayak.core.protocol.MessageType;
import com.sahayak.core.protocol.OutboundFrame;
import com.sahayak.core.protocol.ProtocolCodec;
import com.sahayak.core.ratelimit.CounterStore;
import com.sahayak.core.ratelimit.InMemoryCounterStore;
import com.sahayak.core.ratelimit.RateLimitProperties;
import com.sahayak.core.ratelimit.RateLimiter;
import com.sahayak.core.session.ConnectionRegistry;
import com.sahayak.core.session.DisconnectReason;
import com.sahayak.core.session.RecordingConnection;
import com.sahayak.core.session.UserContextStore;
import com.sahayak.core.speech.SpeechSynthesizer;
import com.sahayak.core.speech.SynthesisException;
import com.sahayak.core.speech.TranscriptionClient;
import com.sahayak.core.speech.TranscriptionException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Clock;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Drives the orchestrator through {@link RecordingConnection}s with real
 * session, audio, audit and planner collaborators. Only the external speech
 * services and the chat model are mocked.
 */
class AgentOrchestratorTest {

    private static final String USER = "user-1";

    private ConnectionRegistry registry;
    private UserContextStore contextStore;
    private AudioAssembler audioAssembler;
    private TranscriptionClient transcriptionClient;
    private LlmService llmService;
    private LlmProperties llmProperties;
    private SpeechSynthesizer speechSynthesizer;
    private InMemoryAuditStore auditStore;
    private PendingAuditIndex pendingIndex;
    private AuditProperties auditProperties;
    private SimpleMeterRegistry meterRegistry;
    private AudioProperties audioProperties;
    private AgentOrchestrator orchestrator;
    private RecordingConnection connection;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry();
        contextStore = new UserContextStore();
        audioProperties = new AudioProperties();
        audioAssembler = new AudioAssembler(audioProperties);
        transcriptionClient = mock(TranscriptionClient.class);
        llmService = mock(LlmService.class);
        llmProperties = new LlmProperties();
        speechSynthesizer = mock(SpeechSynthesizer.class);
        auditStore = new InMemoryAuditStore();
        pendingIndex = new PendingAuditIndex();
        auditProperties = new AuditProperties();
        meterRegistry = new SimpleMeterRegistry();
        orchestrator = orchestrator(auditStore, rateLimiter(mock(CounterStore.class), false));
        connection = new RecordingConnection(USER);
        assertTrue(orchestrator.onConnect(connection));
    }

    private AgentOrchestrator orchestrator(AuditStore store, RateLimiter rateLimiter) {
        return new AgentOrchestrator(
                registry,
                contextStore,
                audioAssembler,
                transcriptionClient,
                new PlanGenerator(llmService, llmProperties),
                speechSynthesizer,
                new AuditRecorder(store, pendingIndex, auditProperties),
                rateLimiter,
                new ProtocolCodec(),
                new SahayakMetrics(meterRegistry),
                audioProperties);
    }

    private static RateLimiter rateLimiter(CounterStore store, boolean production) {
        var properties = new RateLimitProperties();
        properties.setMessagesPerSecond(2);
        return new RateLimiter(store, properties, production ? "production" : "development");
    }

    private static String textCommand(String text) {
        return "{\"type\":\"TEXT_COMMAND\",\"payload\":{\"text\":\"" + text + "\"}}";
    }

    private static String executionResult(String planId, String status, String error) {
        return "{\"type\":\"EXECUTION_RESULT\",\"payload\":{\"plan_id\":\"" + planId + "\",\"status\":\"" + status + "\""
                + (error != null ? ",\"error\":\"" + error + "\"" : "") + "}}";
    }

    private static AgentSpeak speech(OutboundFrame frame) {
        return (AgentSpeak) frame.payload();
    }

    private ActionPlan dispatchedPlan() {
        List<OutboundFrame> dispatches = connection.sent(MessageType.ACTION_DISPATCH);
        assertEquals(1, dispatches.size());
        return (ActionPlan) dispatches.get(0).payload();
    }

    private double counter(String name, String tag, String value) {
        var c = meterRegistry.find(name).tag(tag, value).counter();
        return c == null ? 0.0 : c.count();
    }

    @Nested
    @DisplayName("commands")
    class Commands {

        @Test
        @DisplayName("text command without a planner speaks the fallback acknowledgement, then dispatches")
        void checkBalanceWithoutPlanner() {
            orchestrator.onTextFrame(connection, textCommand("check my balance"));

            assertEquals(List.of(MessageType.AGENT_SPEAK, MessageType.ACTION_DISPATCH), connection.sentTypes());
            AgentSpeak ack = speech(connection.sent().get(0));
            assertEquals("Here is your account balance.", ack.text());
            assertNull(ack.audioBase64());
            assertEquals(Boolean.TRUE, ack.useBrowserTts());

            ActionPlan plan = dispatchedPlan();
            assertEquals(Step.navigate("/dashboard"), plan.steps().get(0));
            assertEquals(PlanGenerator.SOURCE_FALLBACK, plan.source());
            assertTrue(pendingIndex.contains(plan.planId()));
            assertEquals(Optional.of(ConversationState.IDLE), orchestrator.stateOf(USER));
            verifyNoInteractions(llmService);
        }

        @Test
        @DisplayName("model plan is used when the planner is configured")
        void modelPlanUsed() {
            llmProperties.setApiKey("gsk-test");
            when(llmService.call(anyString(), anyString())).thenReturn("""
                    {"plan_id":"p-llm","steps":[{"kind":"speak","text":"Opening transfers."},
                      {"kind":"navigate","url":"/transfers"}],"meta":{"confidence":0.9}}
                    """);

            orchestrator.onTextFrame(connection, textCommand("send 500 to Ravi"));

            ActionPlan plan = dispatchedPlan();
            assertNotEquals("p-llm", plan.planId());
            assertEquals(Step.navigate("/transfers"), plan.steps().get(1));
            assertTrue(pendingIndex.contains(plan.planId()));
            assertEquals("Opening transfers.", speech(connection.sent().get(0)).text());
            assertEquals(1.0, counter("sahayak.plans.total", "source", "llm"));
        }

        @Test
        @DisplayName("planner failure falls back to keyword plan and keeps the session")
        void plannerFailureFallsBack() {
            llmProperties.setApiKey("gsk-test");
            when(llmService.call(anyString(), anyString())).thenThrow(new LlmException("timeout"));

            orchestrator.onTextFrame(connection, textCommand("pay my electricity bill"));

            assertEquals(PlanGenerator.SOURCE_FALLBACK, dispatchedPlan().source());
            assertTrue(connection.isOpen());
            assertEquals(1.0, counter("sahayak.upstream.failures", "service", "llm"));
        }

        @Test
        @DisplayName("synthesized audio is attached to the acknowledgement")
        void synthesizedAudio() {
            when(speechSynthesizer.synthesize("Here is your account balance."))
                    .thenReturn(Optional.of(new byte[]{1, 2, 3}));

            orchestrator.onTextFrame(connection, textCommand("balance"));

            AgentSpeak ack = speech(connection.sent().get(0));
            assertEquals(Base64.getEncoder().encodeToString(new byte[]{1, 2, 3}), ack.audioBase64());
            assertEquals(AgentSpeak.AUDIO_MPEG, ack.mimeType());
            assertNull(ack.useBrowserTts());
        }

        @Test
        @DisplayName("synthesis failure degrades to text-only speech")
        void synthesisFailureTextOnly() {
            when(speechSynthesizer.synthesize(anyString())).thenThrow(new SynthesisException("quota"));

            orchestrator.onTextFrame(connection, textCommand("balance"));

            AgentSpeak ack = speech(connection.sent().get(0));
            assertFalse(ack.hasAudio());
            assertEquals(Boolean.TRUE, ack.useBrowserTts());
            assertEquals(MessageType.ACTION_DISPATCH, connection.sent().get(1).type());
        }

        @Test
        @DisplayName("audit failure does not block dispatch")
        void auditFailureStillDispatches() {
            AuditStore failing = mock(AuditStore.class);
            when(failing.append(any())).thenThrow(new AuditException("db down"));
            var failingOrchestrator = orchestrator(failing, rateLimiter(mock(CounterStore.class), false));
            var other = new RecordingConnection("user-2");
            failingOrchestrator.onConnect(other);

            failingOrchestrator.onTextFrame(other, textCommand("balance"));

            assertEquals(List.of(MessageType.AGENT_SPEAK, MessageType.ACTION_DISPATCH), other.sentTypes());
            assertEquals(1.0, counter("sahayak.upstream.failures", "service", "audit"));
        }

        @Test
        @DisplayName("audit document stores the UI context at dispatch time")
        void auditStoresContext() {
            orchestrator.onTextFrame(connection, """
                    {"type":"CONTEXT_UPDATE","payload":{"url":"/bills","aria_ids":["pay-btn"],"locale":"hi"}}
                    """);
            orchestrator.onTextFrame(connection, textCommand("balance"));

            AuditRecord record = auditStore.findRecent(1).get(0);
            assertEquals("balance", record.commandText());
            assertTrue(record.actionJson().contains("\"url\":\"/bills\""));
            assertTrue(record.actionJson().contains("\"pay-btn\""));
            assertEquals("/bills", orchestrator.contextOf(USER).url());
        }

        @Test
        @DisplayName("null and blank aria ids in a context update do not break the next command")
        void nullAriaIdsTolerated() {
            orchestrator.onTextFrame(connection, """
                    {"type":"CONTEXT_UPDATE","payload":{"url":"/home","aria_ids":["btn",null,"  "]}}
                    """);
            orchestrator.onTextFrame(connection, textCommand("check my balance"));

            assertEquals(List.of(MessageType.AGENT_SPEAK, MessageType.ACTION_DISPATCH), connection.sentTypes());
            assertTrue(connection.isOpen());
            assertNull(connection.closeReason());
            assertEquals(Set.of("btn"), orchestrator.contextOf(USER).ariaIds());
            assertTrue(auditStore.findRecent(1).get(0).actionJson().contains("\"aria_ids\":[\"btn\"]"));
        }

        @Test
        @DisplayName("blank text command is ignored")
        void blankTextIgnored() {
            orchestrator.onTextFrame(connection, textCommand("   "));
            assertTrue(connection.sent().isEmpty());
        }
    }

    @Nested
    @DisplayName("audio")
    class Audio {

        @Test
        @DisplayName("short buffer is not transcribed and the user is asked to retry")
        void shortBuffer() {
            orchestrator.onAudioChunk(connection, new byte[40]);
            assertEquals(Optional.of(ConversationState.RECORDING), orchestrator.stateOf(USER));

            orchestrator.onTextFrame(connection, "{\"type\":\"AUDIO_END\",\"payload\":{}}");

            assertEquals(List.of(MessageType.AGENT_SPEAK), connection.sentTypes());
            assertEquals(AgentOrchestrator.NO_AUDIO_REPLY, speech(connection.sent().get(0)).text());
            verifyNoInteractions(transcriptionClient);
            assertEquals(Optional.of(ConversationState.IDLE), orchestrator.stateOf(USER));
        }

        @Test
        @DisplayName("transcribed utterance runs the command with the requested language")
        void transcribedUtterance() {
            when(transcriptionClient.transcribe(any(), eq("hi"))).thenReturn(Optional.of("check my balance"));

            orchestrator.onAudioChunk(connection, new byte[80]);
            orchestrator.onAudioChunk(connection, new byte[80]);
            orchestrator.onTextFrame(connection, "{\"type\":\"AUDIO_END\",\"payload\":{\"language\":\"hi\"}}");

            verify(transcriptionClient).transcribe(argThat(audio -> audio.length == 160), eq("hi"));
            assertEquals(List.of(MessageType.AGENT_SPEAK, MessageType.ACTION_DISPATCH), connection.sentTypes());
            assertFalse(audioAssembler.hasBuffer(USER));
            assertEquals(1.0, counter("sahayak.commands.total", "source", "voice"));
        }

        @Test
        @DisplayName("default language is used when AUDIO_END carries none")
        void defaultLanguage() {
            when(transcriptionClient.transcribe(any(), anyString())).thenReturn(Optional.of("balance"));

            orchestrator.onAudioChunk(connection, new byte[200]);
            orchestrator.onTextFrame(connection, "{\"type\":\"AUDIO_END\"}");

            verify(transcriptionClient).transcribe(any(), eq("en"));
        }

        @Test
        @DisplayName("base64 chunks are decoded into the same buffer")
        void base64Chunks() {
            when(transcriptionClient.transcribe(any(), anyString())).thenReturn(Optional.of("balance"));
            String data = Base64.getEncoder().encodeToString(new byte[150]);

            orchestrator.onTextFrame(connection,
                    "{\"type\":\"AUDIO_CHUNK_BASE64\",\"payload\":{\"data\":\"" + data + "\"}}");
            orchestrator.onTextFrame(connection, "{\"type\":\"AUDIO_END\",\"payload\":{}}");

            verify(transcriptionClient).transcribe(argThat(audio -> audio.length == 150), anyString());
        }

        @Test
        @DisplayName("undecodable base64 chunk is dropped without an error frame")
        void badBase64Dropped() {
            orchestrator.onTextFrame(connection,
                    "{\"type\":\"AUDIO_CHUNK_BASE64\",\"payload\":{\"data\":\"@@not-base64@@\"}}");

            assertTrue(connection.sent().isEmpty());
            assertFalse(audioAssembler.hasBuffer(USER));
            assertTrue(connection.isOpen());
        }

        @Test
        @DisplayName("transcription failure asks the user to repeat")
        void transcriptionFailure() {
            when(transcriptionClient.transcribe(any(), anyString())).thenThrow(new TranscriptionException("HTTP 500"));

            orchestrator.onAudioChunk(connection, new byte[200]);
            orchestrator.onTextFrame(connection, "{\"type\":\"AUDIO_END\",\"payload\":{}}");

            assertEquals(List.of(MessageType.AGENT_SPEAK), connection.sentTypes());
            assertEquals(AgentOrchestrator.NOT_CAUGHT_REPLY, speech(connection.sent().get(0)).text());
            assertEquals(1.0, counter("sahayak.upstream.failures", "service", "stt"));
            assertTrue(connection.isOpen());
        }

        @Test
        @DisplayName("empty transcript asks the user to repeat")
        void emptyTranscript() {
            when(transcriptionClient.transcribe(any(), anyString())).thenReturn(Optional.empty());

            orchestrator.onAudioChunk(connection, new byte[200]);
            orchestrator.onTextFrame(connection, "{\"type\":\"AUDIO_END\",\"payload\":{}}");

            assertEquals(AgentOrchestrator.NOT_CAUGHT_REPLY, speech(connection.sent().get(0)).text());
        }

        @Test
        @DisplayName("buffer reaching the size limit is finalized without AUDIO_END")
        void oversizedBufferFinalized() {
            audioProperties.setMaxBufferBytes(300);
            var small = new AudioAssembler(audioProperties);
            audioAssembler = small;
            var bounded = orchestrator(auditStore, rateLimiter(mock(CounterStore.class), false));
            var other = new RecordingConnection("user-2");
            bounded.onConnect(other);
            when(transcriptionClient.transcribe(any(), anyString())).thenReturn(Optional.of("balance"));

            bounded.onAudioChunk(other, new byte[200]);
            bounded.onAudioChunk(other, new byte[200]);

            verify(transcriptionClient).transcribe(argThat(audio -> audio.length == 400), eq("en"));
            assertEquals(List.of(MessageType.AGENT_SPEAK, MessageType.ACTION_DISPATCH), other.sentTypes());
        }
    }

    @Nested
    @DisplayName("execution results")
    class ExecutionResults {

        @Test
        @DisplayName("success result patches the audit record and confirms")
        void successResult() {
            orchestrator.onTextFrame(connection, textCommand("balance"));
            ActionPlan plan = dispatchedPlan();
            String auditId = auditStore.findRecent(1).get(0).id();

            orchestrator.onTextFrame(connection, executionResult(plan.planId(), "success", null));

            assertEquals(AuditRecord.SUCCESS, auditStore.findById(auditId).orElseThrow().result());
            OutboundFrame last = connection.sent().get(connection.sent().size() - 1);
            assertEquals(AgentOrchestrator.DONE_REPLY, speech(last).text());
            assertFalse(pendingIndex.contains(plan.planId()));
        }

        @Test
        @DisplayName("failure result records the error and speaks it")
        void failureResult() {
            orchestrator.onTextFrame(connection, textCommand("balance"));
            ActionPlan plan = dispatchedPlan();
            String auditId = auditStore.findRecent(1).get(0).id();

            orchestrator.onTextFrame(connection, executionResult(plan.planId(), "failed", "button not found"));

            AuditRecord record = auditStore.findById(auditId).orElseThrow();
            assertEquals(AuditRecord.FAILED, record.result());
            assertEquals("button not found", record.error());
            OutboundFrame last = connection.sent().get(connection.sent().size() - 1);
            assertEquals("Sorry, something went wrong: button not found", speech(last).text());
        }

        @Test
        @DisplayName("model plans sharing a plan_id are each correlated to their own audit record")
        void repeatedModelPlanIdKeepsRecordsApart() {
            llmProperties.setApiKey("gsk-test");
            when(llmService.call(anyString(), anyString())).thenReturn("""
                    {"plan_id":"uuid","steps":[{"kind":"speak","text":"Sending money."},
                      {"kind":"navigate","url":"/transfers"}]}
                    """);

            orchestrator.onTextFrame(connection, textCommand("send 100 to Asha"));
            orchestrator.onTextFrame(connection, textCommand("send 500 to Ravi"));

            List<OutboundFrame> dispatches = connection.sent(MessageType.ACTION_DISPATCH);
            assertEquals(2, dispatches.size());
            String firstPlan = ((ActionPlan) dispatches.get(0).payload()).planId();
            String secondPlan = ((ActionPlan) dispatches.get(1).payload()).planId();
            assertNotEquals(firstPlan, secondPlan);

            orchestrator.onTextFrame(connection, executionResult(firstPlan, "success", null));
            orchestrator.onTextFrame(connection, executionResult(secondPlan, "failed", "timeout"));

            Map<String, AuditRecord> byCommand = new HashMap<>();
            auditStore.findRecent(10).forEach(r -> byCommand.put(r.commandText(), r));
            assertEquals(AuditRecord.SUCCESS, byCommand.get("send 100 to Asha").result());
            assertEquals(AuditRecord.FAILED, byCommand.get("send 500 to Ravi").result());
            assertEquals(0, pendingIndex.size());
        }

        @Test
        @DisplayName("unknown plan id is ignored silently")
        void unknownPlanIgnored() {
            orchestrator.onTextFrame(connection, executionResult("nope", "success", null));

            assertTrue(connection.sent().isEmpty());
            assertTrue(connection.isOpen());
        }

        @Test
        @DisplayName("a result for another user's plan is ignored")
        void foreignPlanIgnored() {
            orchestrator.onTextFrame(connection, textCommand("balance"));
            ActionPlan plan = dispatchedPlan();
            var intruder = new RecordingConnection("user-2");
            orchestrator.onConnect(intruder);

            orchestrator.onTextFrame(intruder, executionResult(plan.planId(), "success", null));

            assertTrue(intruder.sent().isEmpty());
            assertTrue(pendingIndex.contains(plan.planId()));
        }

        @Test
        @DisplayName("failure reply substitutes a default for a missing error")
        void failureReplyDefault() {
            assertEquals("Sorry, something went wrong: unknown error", AgentOrchestrator.failureReply(null));
            assertEquals("Sorry, something went wrong: unknown error", AgentOrchestrator.failureReply(" "));
        }
    }

    @Nested
    @DisplayName("protocol errors")
    class ProtocolErrors {

        @Test
        @DisplayName("malformed JSON gets an ERROR frame and the session continues")
        void malformedJson() {
            orchestrator.onTextFrame(connection, "{not json");

            assertEquals(List.of(MessageType.ERROR), connection.sentTypes());
            @SuppressWarnings("unchecked")
            Map<String, String> payload = (Map<String, String>) connection.sent().get(0).payload();
            assertEquals("MALFORMED_FRAME", payload.get("code"));
            assertTrue(connection.isOpen());

            orchestrator.onTextFrame(connection, textCommand("balance"));
            assertEquals(MessageType.ACTION_DISPATCH, connection.sent().get(2).type());
        }

        @Test
        @DisplayName("unknown frame type gets UNKNOWN_TYPE")
        void unknownType() {
            orchestrator.onTextFrame(connection, "{\"type\":\"AGENT_SPEAK\",\"payload\":{}}");

            @SuppressWarnings("unchecked")
            Map<String, String> payload = (Map<String, String>) connection.sent().get(0).payload();
            assertEquals("UNKNOWN_TYPE", payload.get("code"));
            assertEquals(1.0, counter("sahayak.frames.malformed", "code", "UNKNOWN_TYPE"));
        }

        @Test
        @DisplayName("messages over the rate limit are dropped in production")
        void messageRateLimit() {
            var limited = orchestrator(auditStore,
                    rateLimiter(new InMemoryCounterStore(Clock.systemUTC()), true));
            var other = new RecordingConnection("user-2");
            limited.onConnect(other);

            limited.onTextFrame(other, textCommand("balance"));
            limited.onTextFrame(other, textCommand("balance"));
            limited.onTextFrame(other, textCommand("balance"));

            assertEquals(2, other.sent(MessageType.ACTION_DISPATCH).size());
            assertEquals(1.0, counter("sahayak.ratelimit.denied", "scope", "message"));
            assertTrue(other.isOpen());
        }

        @Test
        @DisplayName("send failure closes the connection with a server error")
        void sendFailureCloses() {
            connection.failSends();

            orchestrator.onTextFrame(connection, textCommand("balance"));

            assertFalse(connection.isOpen());
            assertEquals(DisconnectReason.SERVER_ERROR, connection.closeReason());
            assertFalse(registry.isConnected(USER));
            assertTrue(orchestrator.stateOf(USER).isEmpty());
            assertNull(MDC.get(MdcContext.PLAN_ID));
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("connection without a user is closed with a policy violation")
        void anonymousRejected() {
            var anonymous = new RecordingConnection(null);

            assertFalse(orchestrator.onConnect(anonymous));
            assertEquals(DisconnectReason.POLICY_VIOLATION, anonymous.closeReason());
        }

        @Test
        @DisplayName("second connection replaces the first; the late close keeps the new one")
        void displacement() {
            orchestrator.onAudioChunk(connection, new byte[50]);
            var replacement = new RecordingConnection(USER);

            orchestrator.onConnect(replacement);

            assertEquals(DisconnectReason.REPLACED, connection.closeReason());
            assertFalse(audioAssembler.hasBuffer(USER));
            assertSame(replacement, registry.connectionFor(USER).orElseThrow());

            orchestrator.onDisconnect(connection);

            assertTrue(registry.isConnected(USER));
            assertEquals(Optional.of(ConversationState.IDLE), orchestrator.stateOf(USER));
        }

        @Test
        @DisplayName("disconnect releases state and abandons pending audits past the grace period")
        void disconnectSweepsPending() {
            auditProperties.setPendingGraceSeconds(0);
            orchestrator.onTextFrame(connection, textCommand("balance"));
            String auditId = auditStore.findRecent(1).get(0).id();
            contextStore.update(USER, com.sahayak.core.model.UserContext.at("/x"));

            orchestrator.onDisconnect(connection);

            assertFalse(registry.isConnected(USER));
            assertFalse(contextStore.has(USER));
            assertTrue(orchestrator.stateOf(USER).isEmpty());
            assertEquals(AuditRecord.ABANDONED, auditStore.findById(auditId).orElseThrow().result());
            assertEquals(0, pendingIndex.size());
        }

        @Test
        @DisplayName("transport error closes with server error and cleans up")
        void transportError() {
            orchestrator.onTransportError(connection, new java.io.IOException("reset"));

            assertEquals(DisconnectReason.SERVER_ERROR, connection.closeReason());
            assertFalse(registry.isConnected(USER));
        }

        @Test
        @DisplayName("announce reaches every open connection")
        void announce() {
            var second = new RecordingConnection("user-2");
            orchestrator.onConnect(second);

            assertEquals(2, orchestrator.announce("Maintenance at 10pm"));
            assertEquals("Maintenance at 10pm", speech(connection.sent().get(0)).text());
            assertEquals("Maintenance at 10pm", speech(second.sent().get(0)).text());
            assertEquals(2, orchestrator.activeConnections());
        }
    }
}
