package io.netnotes.fastscroll.utils;

import org.junit.After;
import org.junit.Test;

import io.netnotes.fastscroll.utils.LoggingHelpers.Log;
import io.netnotes.fastscroll.utils.LoggingHelpers.LogLevel;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class LoggingHelpersTest {

    @After
    public void tearDown() {
        Log.setLogLevel(LogLevel.ALL);
    }

    @Test
    public void testLevelFromName() {
        assertEquals(LogLevel.ERROR, LogLevel.fromName("error", LogLevel.ALL));
        assertEquals(LogLevel.GENERAL, LogLevel.fromName("GENERAL", LogLevel.ALL));
        assertEquals(LogLevel.ALL, LogLevel.fromName("verbose", LogLevel.ALL));
        assertEquals(LogLevel.NONE, LogLevel.fromName(null, LogLevel.NONE));
    }

    @Test
    public void testFilteredMessagesCompleteImmediately() {
        Log.setLogLevel(LogLevel.NONE);
        assertEquals(LogLevel.NONE.getValue(), Log.getLogLevel());
        assertTrue(Log.logMsg("dropped").isDone());
        assertTrue(Log.logError("dropped").isDone());
    }

    @Test
    public void testThrowableMessage() {
        assertEquals("bad", LoggingHelpers.getThrowableMsg(new IllegalStateException("bad")));
        assertEquals("IllegalStateException", LoggingHelpers.getThrowableMsg(new IllegalStateException()));
        assertEquals("unknown", LoggingHelpers.getThrowableMsg(null));
    }
}
