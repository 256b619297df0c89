package io.netnotes.fastscroll.utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import org.junit.Test;

import static org.junit.Assert.*;

public class SerializedExecutorTest {

    private final SerializedExecutor executor = new SerializedExecutor("test-executor");

    @Test
    public void testTasksRunInOrder() throws Exception {
        List<Integer> order = Collections.synchronizedList(new ArrayList<>());
        CompletableFuture<Void> last = null;
        for (int i = 0; i < 5; i++) {
            int n = i;
            last = executor.execute(() -> order.add(n));
        }
        last.get(2, TimeUnit.SECONDS);
        assertEquals(Arrays.asList(0, 1, 2, 3, 4), order);
    }

    @Test
    public void testFailureDoesNotStopLaterTasks() throws Exception {
        CompletableFuture<Void> failed = executor.execute(() -> {
            throw new IllegalStateException("boom");
        });
        CompletableFuture<Void> next = executor.execute(() -> {});

        next.get(2, TimeUnit.SECONDS);
        try {
            failed.get(2, TimeUnit.SECONDS);
            fail("expected failure");
        } catch (ExecutionException e) {
            assertTrue(e.getCause() instanceof IllegalStateException);
        }
    }
}
