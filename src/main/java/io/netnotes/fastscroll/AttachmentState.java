package io.netnotes.fastscroll;

/**
 * Whether a {@link FastScrollView} is part of the visible tree. Changed only
 * by the platform's attach and detach dispatch.
 */
public enum AttachmentState {
    DETACHED,
    ATTACHED
}
