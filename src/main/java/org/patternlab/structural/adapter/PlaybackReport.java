package org.patternlab.structural.adapter;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable description of one completed playback call.
 */
@Value
@Builder
public class PlaybackReport {

    /**
     * Engine that played the file (for example MP3 or VLC).
     */
    String engine;

    String fileName;

    /**
     * Playback speed multiplier, {@code 1.0} for normal speed.
     */
    double speed;

    /**
     * True when the engine normalized audio levels.
     */
    boolean normalized;
}
