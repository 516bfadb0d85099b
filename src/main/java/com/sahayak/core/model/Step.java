package com.sahayak.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.io.Serializable;
import java.util.Objects;

/**
 * One unit of UI automation inside an {@link ActionPlan}.
 * <p>
 * The set of kinds is closed: the client knows how to navigate, fill a field,
 * click an element and speak. Each kind carries only its own fields, and the
 * {@code kind} discriminator is written on the wire by Jackson.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Step.Navigate.class, name = Step.NAVIGATE),
        @JsonSubTypes.Type(value = Step.Fill.class, name = Step.FILL),
        @JsonSubTypes.Type(value = Step.Click.class, name = Step.CLICK),
        @JsonSubTypes.Type(value = Step.Speak.class, name = Step.SPEAK)
})
public sealed interface Step extends Serializable permits Step.Navigate, Step.Fill, Step.Click, Step.Speak {

    String NAVIGATE = "navigate";
    String FILL = "fill";
    String CLICK = "click";
    String SPEAK = "speak";

    @JsonIgnore
    String kind();

    static Navigate navigate(String url) {
        return new Navigate(url);
    }

    static Fill fill(StepTarget target, String value) {
        return new Fill(target, value);
    }

    static Click click(StepTarget target) {
        return new Click(target);
    }

    static Speak speak(String text) {
        return new Speak(text);
    }

    /**
     * @param url in-app route, e.g. {@code /transfers}
     */
    record Navigate(String url) implements Step {
        public Navigate {
            Objects.requireNonNull(url, "url must not be null");
        }

        @Override
        public String kind() {
            return NAVIGATE;
        }
    }

    record Fill(StepTarget target, String value) implements Step {
        public Fill {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public String kind() {
            return FILL;
        }
    }

    record Click(StepTarget target) implements Step {
        public Click {
            Objects.requireNonNull(target, "target must not be null");
        }

        @Override
        public String kind() {
            return CLICK;
        }
    }

    record Speak(String text) implements Step {
        public Speak {
            if (text == null || text.isBlank()) {
                throw new IllegalArgumentException("speak text must not be blank");
            }
        }

        @Override
        public String kind() {
            return SPEAK;
        }
    }
}
