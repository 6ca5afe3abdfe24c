package org.patternlab.structural.adapter;

import lombok.experimental.UtilityClass;

/**
 * Chooses the player implementation handed to the music app.
 */
@UtilityClass
public final class MediaPlayerFactory {

    /**
     * Returns the default player, which is the VLC engine behind an adapter.
     */
    public static MediaPlayer create() {
        return create(true);
    }

    public static MediaPlayer create(boolean useVlc) {
        if (useVlc) {
            return new VlcAdapter(new VlcPlayer(), VlcAdapter.DEFAULT_SPEED);
        }
        return new Mp3Player();
    }
}
