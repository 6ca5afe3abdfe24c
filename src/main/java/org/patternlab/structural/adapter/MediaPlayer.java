package org.patternlab.structural.adapter;

/**
 * Playback contract used by the music app.
 */
public interface MediaPlayer {

    /**
     * Plays one file and reports what was played.
     */
    PlaybackReport play(String fileName);
}
