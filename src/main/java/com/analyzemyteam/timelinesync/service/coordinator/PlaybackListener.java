package com.analyzemyteam.timelinesync.service.coordinator;

/**
 * Callbacks from the video source. Positions are video timeline milliseconds.
 */
public interface PlaybackListener {

    void onPlaybackStarted();

    void onPlaybackStopped();

    void onPositionChanged(long positionMs);

    /** Discontinuous jump; lookups and fetches run immediately. */
    void onSeek(long positionMs);

    /**
     * @param rate playback speed, 1.0 is normal; non-positive values are treated as 1.0
     */
    void onRateChanged(double rate);
}
