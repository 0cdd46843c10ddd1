package com.syncline.core.model;

import java.io.Serializable;

/**
 * Sequence and timestamp of the envelope that last wrote a canonical entity.
 * Ordering metadata only: never part of content comparison.
 */
public record EventOrigin(long sequence, long timestamp) implements Serializable {}
