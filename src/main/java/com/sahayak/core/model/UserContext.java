package com.sahayak.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Last UI state the client reported through {@code CONTEXT_UPDATE}.
 * Held in memory only; the planner reads it to ground its steps in what is on screen.
 *
 * @param url       current route
 * @param ariaIds   ids of the interactive elements currently visible; null and blank ids are dropped
 * @param locale    UI locale, {@code en} when not reported
 * @param screen    optional free-form screen metadata
 * @param timestamp client timestamp in epoch millis, may be null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserContext(
    String url,
    @JsonProperty("aria_ids") Set<String> ariaIds,
    String locale,
    Map<String, Object> screen,
    @JsonProperty("ts") Long timestamp
) {

    public UserContext {
        url = url == null || url.isBlank() ? "/" : url;
        ariaIds = ariaIds == null ? Set.of() : Collections.unmodifiableSet(ariaIds.stream()
                .filter(id -> id != null && !id.isBlank())
                .collect(Collectors.<String, Set<String>>toCollection(LinkedHashSet::new)));
        locale = locale == null || locale.isBlank() ? "en" : locale;
        screen = screen == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(screen));
    }

    public static UserContext empty() {
        return new UserContext(null, null, null, null, null);
    }

    public static UserContext at(String url) {
        return new UserContext(url, null, null, null, null);
    }
}
