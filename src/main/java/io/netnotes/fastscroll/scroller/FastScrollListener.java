package io.netnotes.fastscroll.scroller;

/**
 * Receives the start and end of a handle drag.
 */
public interface FastScrollListener {
    void onFastScrollStart(FastScroller fastScroller);
    void onFastScrollStop(FastScroller fastScroller);
}
