package org.patternlab.structural.adapter;

import lombok.extern.slf4j.Slf4j;

/**
 * Third-party style player with its own, incompatible playback signature.
 */
@Slf4j
public class VlcPlayer {
    public static final String ENGINE = "VLC";

    /**
     * Plays a file with explicit speed and loudness normalization.
     */
    public PlaybackReport heavyPlay(String fileName, double speed, boolean normalize) {
        log.info("[VlcPlayer] Playing {} at {}x (normalize={})", fileName, speed, normalize);
        return PlaybackReport.builder()
                .engine(ENGINE)
                .fileName(fileName)
                .speed(speed)
                .normalized(normalize)
                .build();
    }
}
