package org.patternlab.structural.adapter;

import lombok.extern.slf4j.Slf4j;
import org.patternlab.core.PatternContractException;

/**
 * Adapts {@link MediaPlayer#play(String)} onto {@link VlcPlayer#heavyPlay(String, double, boolean)}.
 *
 * <p>Normalization is always requested; speed is fixed per adapter instance.</p>
 */
@Slf4j
public final class VlcAdapter implements MediaPlayer {
    public static final String REASON_MEDIA_PLAYER_REQUIRED = "MEDIA_PLAYER_REQUIRED";
    public static final String REASON_INVALID_PLAYBACK_SPEED = "INVALID_PLAYBACK_SPEED";
    public static final double DEFAULT_SPEED = 1.0d;

    private final VlcPlayer vlcPlayer;
    private final double speed;

    public VlcAdapter(VlcPlayer vlcPlayer) {
        this(vlcPlayer, DEFAULT_SPEED);
    }

    public VlcAdapter(VlcPlayer vlcPlayer, double speed) {
        if (vlcPlayer == null) {
            throw PatternContractException.invalidArgument(REASON_MEDIA_PLAYER_REQUIRED, "vlcPlayer must be provided");
        }
        if (!Double.isFinite(speed) || speed <= 0.0d) {
            throw PatternContractException.invalidArgument(
                    REASON_INVALID_PLAYBACK_SPEED,
                    "speed must be finite and > 0, got " + speed
            );
        }
        this.vlcPlayer = vlcPlayer;
        this.speed = speed;
    }

    @Override
    public PlaybackReport play(String fileName) {
        log.info("[VlcAdapter] Adapting [play()] to [heavyPlay()]");
        return vlcPlayer.heavyPlay(fileName, speed, true);
    }

    public double speed() {
        return speed;
    }
}
