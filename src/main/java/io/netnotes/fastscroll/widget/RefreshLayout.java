package io.netnotes.fastscroll.widget;

import io.netnotes.fastscroll.utils.LoggingHelpers.Log;
import io.netnotes.fastscroll.view.ViewContext;
import io.netnotes.fastscroll.view.ViewGroup;

/**
 * A pull-to-refresh container. A refresh gesture only triggers while the
 * layout is enabled, which lets a child suspend it during its own drags.
 */
public class RefreshLayout extends ViewGroup {

    public interface OnRefreshListener {
        void onRefresh();
    }

    private OnRefreshListener refreshListener = null;
    private boolean refreshing = false;

    public RefreshLayout(ViewContext context) {
        super(context);
    }

    public void setOnRefreshListener(OnRefreshListener listener) {
        this.refreshListener = listener;
    }

    public boolean isRefreshing() {
        return refreshing;
    }

    public void setRefreshing(boolean refreshing) {
        this.refreshing = refreshing;
    }

    /**
     * Delivers a completed pull gesture.
     *
     * @return true if a refresh was started
     */
    public boolean refresh() {
        if (!isEnabled() || refreshing) {
            Log.logMsg("[RefreshLayout] refresh ignored, enabled=" + isEnabled() + " refreshing=" + refreshing);
            return false;
        }
        refreshing = true;
        if (refreshListener != null) {
            refreshListener.onRefresh();
        }
        return true;
    }
}
