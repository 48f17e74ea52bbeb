package com.example.brd.model;

import java.util.List;

/**
 * Open questions declared by one source document.
 */
public record DocumentOpenQuestions(String originDocumentKey, String documentTitle, List<String> questions) {}
