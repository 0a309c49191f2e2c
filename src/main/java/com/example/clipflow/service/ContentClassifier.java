package com.example.clipflow.service;

import java.util.List;
import java.util.Map;

public interface ContentClassifier {

    String OPTION_INSTRUCTIONS = "instructions";

    /**
     * Proposes clips for a transcript in SRT form.
     */
    List<SegmentSuggestion> classify(String transcript, Map<String, String> options);
}
