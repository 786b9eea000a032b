package de.mirkosertic.imagebatch.progress;

/**
 * A single line of status text shown while a run is active.
 */
public interface StatusIndicator {

    void setText(String text);

    /**
     * Remove the indicator. Further calls to {@link #setText(String)} are ignored.
     */
    void remove();
}
