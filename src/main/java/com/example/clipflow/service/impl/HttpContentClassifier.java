package com.example.clipflow.service.impl;

import com.example.clipflow.exceptions.PermanentInputException;
import com.example.clipflow.service.ContentClassifier;
import com.example.clipflow.service.SegmentSuggestion;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link ContentClassifier} backed by an OpenAI-compatible chat completions endpoint. The model is
 * asked for a JSON array of {@code {title, start, end, tags}} where start and end are seconds or
 * SRT timestamps.
 */
@Service
public class HttpContentClassifier implements ContentClassifier {

    private static final Logger log = LoggerFactory.getLogger(HttpContentClassifier.class);

    private static final Pattern SRT_TIMESTAMP = Pattern.compile("(\\d{1,2}):(\\d{2}):(\\d{2})(?:[,.](\\d{1,3}))?");
    static final String SYSTEM_PROMPT = """
            You split videos into self-contained clips. Using the SRT transcript you are given, reply with
            a JSON array only. Each element has "title" (string), "start" and "end" (SRT timestamps,
            HH:MM:SS,mmm) and "tags" (array of strings). Clips must not overlap.""";
    static final String DEFAULT_INSTRUCTIONS = "Find the most interesting self-contained clips.";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;
    private final String model;

    public HttpContentClassifier(RestClient.Builder restClientBuilder,
                                 ObjectMapper objectMapper,
                                 @Value("${clipflow.classifier.url:http://localhost:8082/v1}") String baseUrl,
                                 @Value("${clipflow.classifier.api-key:}") String apiKey,
                                 @Value("${clipflow.classifier.model:default}") String model) {
        this.restClient = restClientBuilder.build();
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.model = model;
    }

    @Override
    public List<SegmentSuggestion> classify(String transcript, Map<String, String> options) {
        if (transcript == null || transcript.isBlank()) {
            throw new PermanentInputException("Transcript is empty; nothing to analyze");
        }
        String instructions = options != null
                ? options.getOrDefault(OPTION_INSTRUCTIONS, DEFAULT_INSTRUCTIONS)
                : DEFAULT_INSTRUCTIONS;
        Map<String, Object> payload = Map.of(
                "model", model,
                "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_PROMPT),
                        Map.of("role", "user", "content", "Transcript:\n" + transcript + "\n\nTask:\n" + instructions)));

        RestClient.RequestBodySpec request = restClient.post()
                .uri(baseUrl + "/chat/completions")
                .contentType(MediaType.APPLICATION_JSON);
        if (apiKey != null && !apiKey.isBlank()) {
            request = request.header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
        JsonNode response = request.body(payload).retrieve().body(JsonNode.class);
        String content = response != null
                ? response.path("choices").path(0).path("message").path("content").asText(null)
                : null;
        if (content == null) {
            throw new PermanentInputException("Classifier returned no content");
        }
        List<SegmentSuggestion> suggestions = parseSuggestions(content);
        log.info("[Classifier] {} suggestions from model {}", suggestions.size(), model);
        return suggestions;
    }

    List<SegmentSuggestion> parseSuggestions(String content) {
        String json = stripCodeFence(content);
        JsonNode array;
        try {
            array = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new PermanentInputException("Classifier reply is not JSON: " + e.getOriginalMessage(), e);
        }
        if (!array.isArray()) {
            throw new PermanentInputException("Classifier reply is not a JSON array");
        }
        List<SegmentSuggestion> suggestions = new ArrayList<>();
        for (JsonNode item : array) {
            long start = toMillis(item.path("start"));
            long end = toMillis(item.path("end"));
            if (end <= start) {
                log.warn("[Classifier] Skipping suggestion with empty range: {}", item);
                continue;
            }
            List<String> tags = new ArrayList<>();
            item.path("tags").forEach(tag -> tags.add(tag.asText()));
            suggestions.add(new SegmentSuggestion(item.path("title").asText("Clip " + (suggestions.size() + 1)),
                    start, end, tags));
        }
        return suggestions;
    }

    static long toMillis(JsonNode value) {
        if (value.isNumber()) {
            return Math.round(value.asDouble() * 1000.0);
        }
        String text = value.asText("").trim();
        Matcher matcher = SRT_TIMESTAMP.matcher(text);
        if (matcher.matches()) {
            long hours = Long.parseLong(matcher.group(1));
            long minutes = Long.parseLong(matcher.group(2));
            long seconds = Long.parseLong(matcher.group(3));
            String fraction = matcher.group(4);
            long millis = fraction == null ? 0 : Long.parseLong((fraction + "00").substring(0, 3));
            return ((hours * 60 + minutes) * 60 + seconds) * 1000 + millis;
        }
        try {
            return Math.round(Double.parseDouble(text) * 1000.0);
        } catch (NumberFormatException e) {
            throw new PermanentInputException("Unrecognised timestamp in classifier reply: " + text, e);
        }
    }

    private static String stripCodeFence(String content) {
        String trimmed = content.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int lastFence = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                return trimmed.substring(firstNewline + 1, lastFence).trim();
            }
        }
        return trimmed;
    }
}
