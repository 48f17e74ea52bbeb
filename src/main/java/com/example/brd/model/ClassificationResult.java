package com.example.brd.model;

/**
 * Output of the classification pipeline.
 */
public record ClassificationResult(
        ClassificationIndex index,
        Bibliography bibliography,
        ClassificationReport report
) {}
