package org.patternlab.structural.adapter;

import lombok.extern.slf4j.Slf4j;

/**
 * Native player that already speaks {@link MediaPlayer}.
 */
@Slf4j
public final class Mp3Player implements MediaPlayer {
    public static final String ENGINE = "MP3";

    @Override
    public PlaybackReport play(String fileName) {
        log.info("[Mp3Player] Playing {}", fileName);
        return PlaybackReport.builder()
                .engine(ENGINE)
                .fileName(fileName)
                .speed(1.0d)
                .normalized(false)
                .build();
    }
}
