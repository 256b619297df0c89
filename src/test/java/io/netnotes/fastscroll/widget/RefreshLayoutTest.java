package io.netnotes.fastscroll.widget;

import org.junit.Test;

import io.netnotes.fastscroll.view.ViewContext;

import static org.junit.Assert.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

public class RefreshLayoutTest {

    private final RefreshLayout layout = new RefreshLayout(new ViewContext());

    @Test
    public void testRefreshWhenEnabled() {
        RefreshLayout.OnRefreshListener listener = mock(RefreshLayout.OnRefreshListener.class);
        layout.setOnRefreshListener(listener);

        assertTrue(layout.refresh());
        assertTrue(layout.isRefreshing());
        verify(listener).onRefresh();

        assertFalse(layout.refresh());
        layout.setRefreshing(false);
        assertTrue(layout.refresh());
    }

    @Test
    public void testDisabledIgnoresRefresh() {
        RefreshLayout.OnRefreshListener listener = mock(RefreshLayout.OnRefreshListener.class);
        layout.setOnRefreshListener(listener);
        layout.setEnabled(false);

        assertFalse(layout.refresh());
        assertFalse(layout.isRefreshing());
        verify(listener, never()).onRefresh();
    }
}
