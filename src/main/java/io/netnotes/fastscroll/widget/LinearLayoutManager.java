package io.netnotes.fastscroll.widget;

import io.netnotes.fastscroll.utils.MathHelpers;

/**
 * Vertical layout manager for items of one fixed height.
 */
public class LinearLayoutManager extends RecyclerList.LayoutManager {
    private final int fixedItemHeight;
    private int scrollOffset = 0;

    /**
     * Uses the item height of the list it is assigned to.
     */
    public LinearLayoutManager() {
        this(0);
    }

    public LinearLayoutManager(int itemHeight) {
        if (itemHeight < 0) {
            throw new IllegalArgumentException("Invalid item height: " + itemHeight);
        }
        this.fixedItemHeight = itemHeight;
    }

    public int getItemHeight() {
        if (fixedItemHeight > 0) {
            return fixedItemHeight;
        }
        RecyclerList list = getRecyclerList();
        return list != null ? Math.max(list.getDefaultItemHeight(), 1) : 1;
    }

    private int getMaxScrollOffset() {
        return Math.max(computeVerticalScrollRange() - computeVerticalScrollExtent(), 0);
    }

    @Override
    public int computeVerticalScrollOffset() {
        return scrollOffset;
    }

    @Override
    public int computeVerticalScrollRange() {
        return getItemCount() * getItemHeight();
    }

    @Override
    public int scrollVerticallyBy(int dy) {
        int before = scrollOffset;
        scrollOffset = MathHelpers.clamp(scrollOffset + dy, 0, getMaxScrollOffset());
        return scrollOffset - before;
    }

    @Override
    public void scrollToPosition(int position) {
        scrollToPositionWithOffset(position, 0);
    }

    /**
     * Scrolls so the item at {@code position} sits {@code offset} pixels
     * below the top edge, as far as the content allows.
     */
    public void scrollToPositionWithOffset(int position, int offset) {
        int count = getItemCount();
        if (count == 0) {
            scrollOffset = 0;
            return;
        }
        int target = MathHelpers.clamp(position, 0, count - 1);
        scrollOffset = MathHelpers.clamp(target * getItemHeight() - offset, 0, getMaxScrollOffset());
    }

    public int findFirstVisibleItemPosition() {
        int count = getItemCount();
        if (count == 0) {
            return RecyclerList.NO_POSITION;
        }
        return MathHelpers.clamp(scrollOffset / getItemHeight(), 0, count - 1);
    }

    public int findLastVisibleItemPosition() {
        int count = getItemCount();
        if (count == 0) {
            return RecyclerList.NO_POSITION;
        }
        int bottom = scrollOffset + Math.max(computeVerticalScrollExtent(), 1) - 1;
        return MathHelpers.clamp(bottom / getItemHeight(), 0, count - 1);
    }

    @Override
    protected void onItemsChanged() {
        scrollOffset = MathHelpers.clamp(scrollOffset, 0, getMaxScrollOffset());
    }
}
