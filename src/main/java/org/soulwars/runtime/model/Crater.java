package org.soulwars.runtime.model;

/**
 * Permanent mark left by a meteorite impact.
 */
public record Crater(double x, double y, double size, long createdAt) {}
