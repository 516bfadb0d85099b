package com.sahayak.core.planner;

import com.sahayak.core.model.ActionPlan;
import com.sahayak.core.model.Step;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Deterministic keyword planner used whenever the chat model cannot produce a plan.
 * <p>
 * Rules are checked in order and the first one with a matching keyword wins.
 * Matching is a case-insensitive substring test. Every input yields a plan
 * with exactly one {@code speak} step.
 */
public final class KeywordFallback {

    static final String CAPABILITIES = "I can help you check your balance, transfer money, pay bills,"
            + " or update your profile. What would you like to do?";
    static final double NO_MATCH_CONFIDENCE = 0.5;

    private record Rule(
        List<String> keywords,
        String destination,
        String acknowledgement,
        double confidence
    ) {}

    private static final List<Rule> RULES = List.of(
            new Rule(List.of("balance", "account", "money"),
                    "/dashboard", "Here is your account balance.", 0.9),
            new Rule(List.of("transfer", "send", "payment"),
                    "/transfers", "Opening transfers. Who would you like to send money to?", 0.85),
            new Rule(List.of("bill", "electricity", "water", "gas", "broadband"),
                    "/bills", "Opening bill payments. Which bill would you like to pay?", 0.85),
            new Rule(List.of("profile", "settings", "beneficiary"),
                    "/profile", "Opening your profile settings.", 0.8)
    );

    private KeywordFallback() {}

    public static ActionPlan planFor(String transcript) {
        String lower = transcript == null ? "" : transcript.toLowerCase(Locale.ROOT);
        String planId = UUID.randomUUID().toString();
        for (Rule rule : RULES) {
            if (rule.keywords().stream().anyMatch(lower::contains)) {
                return new ActionPlan(planId,
                        List.of(Step.navigate(rule.destination()), Step.speak(rule.acknowledgement())),
                        meta(rule.confidence()));
            }
        }
        return new ActionPlan(planId, List.of(Step.speak(CAPABILITIES)), meta(NO_MATCH_CONFIDENCE));
    }

    private static Map<String, Object> meta(double confidence) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(ActionPlan.META_CONFIDENCE, confidence);
        meta.put(ActionPlan.META_SOURCE, PlanGenerator.SOURCE_FALLBACK);
        meta.put(ActionPlan.META_LANGUAGE, "en");
        return meta;
    }
}
