package com.gridfolio.engine.model;

/**
 * Summary of one calendar bucket (hour of day or month).
 */
public record ProfileStatistics(int bucket, int count, double mean, double std, double min, double max) {
}
