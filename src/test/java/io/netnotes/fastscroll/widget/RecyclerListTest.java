package io.netnotes.fastscroll.widget;

import org.junit.Before;
import org.junit.Test;

import io.netnotes.fastscroll.view.StyleAttributes;
import io.netnotes.fastscroll.view.ViewContext;

import static org.junit.Assert.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

public class RecyclerListTest {

    private ViewContext context;
    private RecyclerList list;
    private LinearLayoutManager manager;

    @Before
    public void setUp() {
        context = new ViewContext();
        list = new RecyclerList(context);
        manager = new LinearLayoutManager();
        list.setLayoutManager(manager);
        list.setAdapter(new TestAdapters.PlainAdapter(130));
        list.layout(100, 480);
    }

    @Test
    public void testScrollMath() {
        assertEquals(48, manager.getItemHeight());
        assertEquals(6240, list.computeVerticalScrollRange());
        assertEquals(480, list.computeVerticalScrollExtent());
        assertEquals(0, list.computeVerticalScrollOffset());

        list.scrollBy(100);
        assertEquals(100, list.computeVerticalScrollOffset());
        assertEquals(2, manager.findFirstVisibleItemPosition());
        assertEquals(12, manager.findLastVisibleItemPosition());

        list.scrollBy(-500);
        assertEquals(0, list.computeVerticalScrollOffset());

        list.scrollBy(10000);
        assertEquals(5760, list.computeVerticalScrollOffset());
    }

    @Test
    public void testScrollToPosition() {
        list.scrollToPosition(10);
        assertEquals(480, list.computeVerticalScrollOffset());

        list.scrollToPositionWithOffset(10, 24);
        assertEquals(456, list.computeVerticalScrollOffset());

        list.scrollToPosition(500);
        assertEquals(5760, list.computeVerticalScrollOffset());

        list.scrollToPosition(-3);
        assertEquals(0, list.computeVerticalScrollOffset());
    }

    @Test
    public void testItemHeightFromAttributes() {
        RecyclerList tall = new RecyclerList(context, StyleAttributes.builder().set("itemHeight", "64px").build());
        LinearLayoutManager tallManager = new LinearLayoutManager();
        tall.setLayoutManager(tallManager);
        assertEquals(64, tall.getDefaultItemHeight());
        assertEquals(64, tallManager.getItemHeight());

        LinearLayoutManager fixed = new LinearLayoutManager(10);
        new RecyclerList(context).setLayoutManager(fixed);
        assertEquals(10, fixed.getItemHeight());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeItemHeightRejected() {
        new LinearLayoutManager(-1);
    }

    @Test
    public void testScrollListeners() {
        RecyclerList.OnScrollListener listener = mock(RecyclerList.OnScrollListener.class);
        list.addOnScrollListener(listener);

        list.scrollBy(50);
        verify(listener).onScrolled(list, 0, 50);

        list.setScrollState(RecyclerList.SCROLL_STATE_SETTLING);
        list.setScrollState(RecyclerList.SCROLL_STATE_SETTLING);
        verify(listener).onScrollStateChanged(list, RecyclerList.SCROLL_STATE_SETTLING);
        assertEquals(RecyclerList.SCROLL_STATE_SETTLING, list.getScrollState());

        list.removeOnScrollListener(listener);
        list.scrollBy(50);
        verify(listener).onScrolled(list, 0, 50);
        assertEquals(0, list.getOnScrollListenerCount());
    }

    @Test
    public void testShrinkingDataClampsOffset() {
        TestAdapters.PlainAdapter adapter = new TestAdapters.PlainAdapter(130);
        list.setAdapter(adapter);
        list.scrollBy(5000);

        adapter.items.subList(20, adapter.items.size()).clear();
        adapter.notifyDataSetChanged();

        assertEquals(960, list.computeVerticalScrollRange());
        assertEquals(480, list.computeVerticalScrollOffset());
    }

    @Test
    public void testReplacedAdapterNoLongerObserved() {
        TestAdapters.PlainAdapter old = new TestAdapters.PlainAdapter(10);
        list.setAdapter(old);
        list.setAdapter(new TestAdapters.PlainAdapter(130));

        RecyclerList.OnScrollListener listener = mock(RecyclerList.OnScrollListener.class);
        list.addOnScrollListener(listener);
        old.notifyDataSetChanged();
        verify(listener, never()).onScrolled(list, 0, 0);
    }

    @Test
    public void testLayoutManagerOwnership() {
        RecyclerList other = new RecyclerList(context);
        try {
            other.setLayoutManager(manager);
            fail("shared layout manager accepted");
        } catch (IllegalArgumentException e) {
            assertSame(list, manager.getRecyclerList());
        }

        list.setLayoutManager(null);
        assertNull(manager.getRecyclerList());
        other.setLayoutManager(manager);
        assertSame(other, manager.getRecyclerList());
    }

    @Test
    public void testScrollWithoutLayoutManagerIgnored() {
        RecyclerList bare = new RecyclerList(context);
        bare.setAdapter(new TestAdapters.PlainAdapter(5));
        bare.scrollBy(100);
        bare.scrollToPosition(3);
        assertEquals(0, bare.computeVerticalScrollOffset());
        assertEquals(0, bare.computeVerticalScrollRange());
        assertEquals(5, bare.getItemCount());
    }

    @Test
    public void testEmptyListPositions() {
        list.setAdapter(null);
        assertEquals(0, list.getItemCount());
        assertEquals(RecyclerList.NO_POSITION, manager.findFirstVisibleItemPosition());
        assertEquals(RecyclerList.NO_POSITION, manager.findLastVisibleItemPosition());
    }
}
