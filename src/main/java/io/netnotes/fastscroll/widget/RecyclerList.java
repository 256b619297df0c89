package io.netnotes.fastscroll.widget;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import io.netnotes.fastscroll.utils.LoggingHelpers.Log;
import io.netnotes.fastscroll.view.ResolvedStyle;
import io.netnotes.fastscroll.view.StyleAttr;
import io.netnotes.fastscroll.view.StyleAttributes;
import io.netnotes.fastscroll.view.ViewContext;
import io.netnotes.fastscroll.view.ViewGroup;
import javafx.beans.property.ReadOnlyObjectProperty;
import javafx.beans.property.ReadOnlyObjectWrapper;

/**
 * RecyclerList - a virtualized vertical list
 *
 * The list owns two slots: an {@link Adapter} that supplies the items and a
 * {@link LayoutManager} that positions them and tracks the scroll offset.
 * Both are observable as read-only JavaFX properties.
 */
public class RecyclerList extends ViewGroup {

    public static final int NO_POSITION = -1;

    public static final int SCROLL_STATE_IDLE     = 0;
    public static final int SCROLL_STATE_DRAGGING = 1;
    public static final int SCROLL_STATE_SETTLING = 2;

    public static final int DEFAULT_ITEM_HEIGHT_DP = 48;

    /**
     * Supplies the items shown by a list.
     */
    public abstract static class Adapter {
        private final List<Runnable> observers = new CopyOnWriteArrayList<>();

        public abstract int getItemCount();

        public long getItemId(int position) {
            return position;
        }

        public final void notifyDataSetChanged() {
            for (Runnable observer : observers) {
                observer.run();
            }
        }

        void registerObserver(Runnable observer) {
            observers.add(observer);
        }

        void unregisterObserver(Runnable observer) {
            observers.remove(observer);
        }
    }

    /**
     * Positions items and owns the scroll offset. A layout manager can serve
     * one list at a time.
     */
    public abstract static class LayoutManager {
        private RecyclerList recyclerList = null;

        public RecyclerList getRecyclerList() {
            return recyclerList;
        }

        void setRecyclerList(RecyclerList recyclerList) {
            this.recyclerList = recyclerList;
        }

        protected int getItemCount() {
            return recyclerList != null ? recyclerList.getItemCount() : 0;
        }

        protected int getExtent() {
            return recyclerList != null ? recyclerList.getHeight() : 0;
        }

        public abstract int computeVerticalScrollOffset();
        public abstract int computeVerticalScrollRange();

        public int computeVerticalScrollExtent() {
            return getExtent();
        }

        /**
         * @return the distance actually scrolled
         */
        public abstract int scrollVerticallyBy(int dy);

        public abstract void scrollToPosition(int position);

        /**
         * Keeps the scroll offset valid after the item count or extent changed.
         */
        protected void onItemsChanged() {}
    }

    /**
     * Receives scroll events from a list.
     */
    public interface OnScrollListener {
        default void onScrollStateChanged(RecyclerList recyclerList, int newState) {}
        default void onScrolled(RecyclerList recyclerList, int dx, int dy) {}
    }

    private final ReadOnlyObjectWrapper<Adapter> adapter = new ReadOnlyObjectWrapper<>(this, "adapter", null);
    private final ReadOnlyObjectWrapper<LayoutManager> layoutManager = new ReadOnlyObjectWrapper<>(this, "layoutManager", null);
    private final List<OnScrollListener> scrollListeners = new CopyOnWriteArrayList<>();
    private final Runnable dataObserver = this::onDataSetChanged;
    private final int defaultItemHeight;
    private int scrollState = SCROLL_STATE_IDLE;

    public RecyclerList(ViewContext context) {
        this(context, null, null);
    }

    public RecyclerList(ViewContext context, StyleAttributes attrs) {
        this(context, attrs, null);
    }

    public RecyclerList(ViewContext context, StyleAttributes attrs, String defStyle) {
        super(context);
        ResolvedStyle style = context.obtainStyledAttributes(attrs, defStyle);
        this.defaultItemHeight = style.getDimensionPx(StyleAttr.ITEM_HEIGHT,
            Math.round(DEFAULT_ITEM_HEIGHT_DP * context.getDensity()));
    }

    /**
     * Item height used by layout managers created without an explicit one.
     */
    public int getDefaultItemHeight() {
        return defaultItemHeight;
    }

    // ===== ADAPTER =====

    public Adapter getAdapter() {
        return adapter.get();
    }

    public ReadOnlyObjectProperty<Adapter> adapterProperty() {
        return adapter.getReadOnlyProperty();
    }

    public void setAdapter(Adapter newAdapter) {
        Adapter old = adapter.get();
        if (old == newAdapter) {
            return;
        }
        if (old != null) {
            old.unregisterObserver(dataObserver);
        }
        if (newAdapter != null) {
            newAdapter.registerObserver(dataObserver);
        }
        adapter.set(newAdapter);
        onDataSetChanged();
    }

    public int getItemCount() {
        Adapter current = adapter.get();
        return current != null ? current.getItemCount() : 0;
    }

    private void onDataSetChanged() {
        LayoutManager manager = layoutManager.get();
        if (manager != null) {
            manager.onItemsChanged();
        }
        dispatchOnScrolled(0, 0);
    }

    // ===== LAYOUT MANAGER =====

    public LayoutManager getLayoutManager() {
        return layoutManager.get();
    }

    public ReadOnlyObjectProperty<LayoutManager> layoutManagerProperty() {
        return layoutManager.getReadOnlyProperty();
    }

    /**
     * @throws IllegalArgumentException if the manager already serves another list
     */
    public void setLayoutManager(LayoutManager manager) {
        LayoutManager old = layoutManager.get();
        if (old == manager) {
            return;
        }
        if (manager != null && manager.getRecyclerList() != null) {
            throw new IllegalArgumentException("LayoutManager " + manager
                + " is already attached to a RecyclerList: " + manager.getRecyclerList());
        }
        if (old != null) {
            old.setRecyclerList(null);
        }
        if (manager != null) {
            manager.setRecyclerList(this);
            manager.onItemsChanged();
        }
        layoutManager.set(manager);
    }

    // ===== SCROLLING =====

    public int computeVerticalScrollOffset() {
        LayoutManager manager = layoutManager.get();
        return manager != null ? manager.computeVerticalScrollOffset() : 0;
    }

    public int computeVerticalScrollRange() {
        LayoutManager manager = layoutManager.get();
        return manager != null ? manager.computeVerticalScrollRange() : 0;
    }

    public int computeVerticalScrollExtent() {
        LayoutManager manager = layoutManager.get();
        return manager != null ? manager.computeVerticalScrollExtent() : 0;
    }

    public void scrollBy(int dy) {
        LayoutManager manager = layoutManager.get();
        if (manager == null) {
            Log.logError("[RecyclerList] Cannot scroll without a LayoutManager set");
            return;
        }
        int scrolled = manager.scrollVerticallyBy(dy);
        if (scrolled != 0) {
            dispatchOnScrolled(0, scrolled);
        }
    }

    public void scrollToPosition(int position) {
        LayoutManager manager = layoutManager.get();
        if (manager == null) {
            Log.logError("[RecyclerList] Cannot scroll to position without a LayoutManager set");
            return;
        }
        int before = manager.computeVerticalScrollOffset();
        manager.scrollToPosition(position);
        dispatchOnScrolled(0, manager.computeVerticalScrollOffset() - before);
    }

    /**
     * Scrolls the item at {@code position} to {@code offset} pixels below the
     * top edge when the layout manager supports offsets, otherwise to the top.
     */
    public void scrollToPositionWithOffset(int position, int offset) {
        LayoutManager manager = layoutManager.get();
        if (!(manager instanceof LinearLayoutManager)) {
            scrollToPosition(position);
            return;
        }
        int before = manager.computeVerticalScrollOffset();
        ((LinearLayoutManager) manager).scrollToPositionWithOffset(position, offset);
        dispatchOnScrolled(0, manager.computeVerticalScrollOffset() - before);
    }

    public int getScrollState() {
        return scrollState;
    }

    /**
     * Reports the host's gesture state for this list.
     */
    public void setScrollState(int state) {
        if (state == scrollState) {
            return;
        }
        scrollState = state;
        for (OnScrollListener listener : scrollListeners) {
            listener.onScrollStateChanged(this, state);
        }
    }

    public void addOnScrollListener(OnScrollListener listener) {
        scrollListeners.add(listener);
    }

    public void removeOnScrollListener(OnScrollListener listener) {
        scrollListeners.remove(listener);
    }

    public int getOnScrollListenerCount() {
        return scrollListeners.size();
    }

    private void dispatchOnScrolled(int dx, int dy) {
        for (OnScrollListener listener : scrollListeners) {
            listener.onScrolled(this, dx, dy);
        }
    }

    @Override
    protected void onSizeChanged(int w, int h, int oldw, int oldh) {
        LayoutManager manager = layoutManager.get();
        if (manager != null) {
            manager.onItemsChanged();
        }
        dispatchOnScrolled(0, 0);
    }
}
