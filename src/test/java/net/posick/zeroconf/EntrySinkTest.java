package net.posick.zeroconf;

import static net.posick.zeroconf.RecordMatcherTest.a;
import static org.junit.Assert.*;

import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.Test;

/**
 * Test Cases for the EntrySink
 */
public class EntrySinkTest
{
    @Test
    public void testDrainReturnsDeliveredEntries()
    throws Exception
    {
        EntrySink sink = new EntrySink();
        Entry first = Entry.published(a("one.local.", "10.0.0.1", 3600));
        Entry second = Entry.published(a("two.local.", "10.0.0.2", 3600));
        sink.deliver(first);
        sink.deliver(second);
        assertFalse(sink.isDrained());
        assertTrue(sink.close());
        
        List<Entry> entries = sink.drain();
        assertEquals(2, entries.size());
        assertSame(first, entries.get(0));
        assertSame(second, entries.get(1));
        assertTrue(sink.isDrained());
        assertNull(sink.take());
        assertNull(sink.poll(10, TimeUnit.MILLISECONDS));
    }
    
    
    @Test
    public void testClosedOnlyOnce()
    throws Exception
    {
        EntrySink sink = new EntrySink();
        assertTrue(sink.close());
        assertFalse(sink.close());
        
        sink.deliver(Entry.published(a("late.local.", "10.0.0.1", 3600)));
        assertTrue(sink.drain().isEmpty());
    }
    
    
    @Test
    public void testPollTimesOutWhileOpen()
    throws Exception
    {
        EntrySink sink = new EntrySink();
        assertNull(sink.poll(50, TimeUnit.MILLISECONDS));
        assertFalse(sink.isClosed());
    }
    
    
    @Test
    public void testAbortMarksResultsUndelivered()
    throws Exception
    {
        EntrySink sink = new EntrySink();
        assertTrue(sink.abort());
        assertTrue(sink.isAborted());
        assertTrue(sink.isClosed());
        assertTrue(sink.drain().isEmpty());
        
        EntrySink delivered = new EntrySink();
        delivered.close();
        assertFalse(delivered.abort());
        assertFalse(delivered.isAborted());
    }
}
