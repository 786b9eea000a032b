package de.mirkosertic.imagebatch.progress;

/**
 * Place where status indicators are displayed, e.g. a status bar or the log.
 */
public interface StatusSurface {

    StatusIndicator createIndicator();
}
