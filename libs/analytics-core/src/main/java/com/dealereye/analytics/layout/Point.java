package com.dealereye.analytics.layout;

/** A vertex in image coordinates. */
public record Point(double x, double y) {}
