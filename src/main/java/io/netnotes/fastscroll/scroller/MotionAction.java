package io.netnotes.fastscroll.scroller;

/**
 * Pointer actions delivered to {@link FastScroller#onTouchEvent(MotionAction, float)}.
 */
public enum MotionAction {
    DOWN,
    MOVE,
    UP,
    CANCEL
}
