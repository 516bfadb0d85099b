package com.sahayak.core.planner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sahayak.core.llm.LlmException;
import com.sahayak.core.llm.LlmProperties;
import com.sahayak.core.llm.LlmService;
import com.sahayak.core.model.ActionPlan;
import com.sahayak.core.model.UserContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Produces an {@link ActionPlan} for a user command by asking the chat model,
 * with {@link #createFallbackPlan} as the always-succeeding alternative.
 */
@Service
public class PlanGenerator {

    private static final Logger log = LoggerFactory.getLogger(PlanGenerator.class);

    public static final String SOURCE_LLM = "llm";
    public static final String SOURCE_FALLBACK = "fallback";

    static final String SYSTEM_PROMPT = """
            You are Sahayak, a voice-first banking assistant. You help users with:
            - Checking balance
            - Viewing recent transactions
            - Transferring money to beneficiaries
            - Paying utility bills
            - Managing profile settings

            You receive the user's voice command and the current UI context (URL, visible elements).
            Respond with a JSON action plan containing steps to execute.

            Step kinds:
            - navigate: Go to a URL (url field)
            - fill: Fill a form field (target.aria or target.element_id, value)
            - click: Click an element (target.aria or target.element_id)
            - speak: Say something to user (text field)

            Always validate amounts against limits (max 50000 INR per transfer).
            Include a speak step to acknowledge the action.

            Respond ONLY with valid JSON matching this schema:
            {
              "steps": [{"kind": "...", ...}],
              "meta": {"confidence": 0.0-1.0, "language": "hi-en"}
            }
            """;

    private final LlmService llmService;
    private final LlmProperties llmProperties;
    private final ActionPlanParser parser;

    public PlanGenerator(LlmService llmService, LlmProperties llmProperties) {
        this.llmService = llmService;
        this.llmProperties = llmProperties;
        this.parser = new ActionPlanParser(new ObjectMapper());
    }

    public boolean isConfigured() {
        return llmProperties.hasApiKey();
    }

    public String modelName() {
        return llmProperties.getModel();
    }

    /**
     * @throws LlmException when the planner is not configured, the call fails,
     *                      or the response is not a valid plan
     */
    public ActionPlan generate(String transcript, UserContext context) {
        if (!isConfigured()) {
            throw new LlmException("planner not configured");
        }
        String raw = llmService.call(SYSTEM_PROMPT, userPrompt(transcript, context));
        ActionPlan plan = parser.parse(raw);
        log.info("Generated plan {} with {} step(s)", plan.planId(), plan.steps().size());
        return plan;
    }

    public ActionPlan createFallbackPlan(String transcript) {
        return KeywordFallback.planFor(transcript);
    }

    static String userPrompt(String transcript, UserContext context) {
        UserContext ctx = context != null ? context : UserContext.empty();
        return """
                User command: "%s"

                Current context:
                - URL: %s
                - Visible elements: %s
                - Locale: %s

                Generate the action plan.""".formatted(transcript, ctx.url(), ctx.ariaIds(), ctx.locale());
    }
}
