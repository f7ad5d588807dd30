package net.posick.zeroconf;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The channel through which a {@link Zone} delivers entries to a query or subscription. Entries are
 * delivered by the zone's worker and consumed by the caller. The sink is unbounded so that delivery
 * never blocks the worker, and it is closed at most once, after which it yields the remaining
 * entries and then end-of-results.
 */
public class EntrySink
{
    private static final Object END = new Object();
    
    private final LinkedBlockingQueue<Object> queue = new LinkedBlockingQueue<Object>();
    
    private final AtomicBoolean closed = new AtomicBoolean(false);
    
    private volatile boolean aborted = false;
    
    
    /**
     * Delivers an entry. Entries delivered after the sink has been closed are discarded.
     * 
     * @param entry The entry
     */
    public void deliver(final Entry entry)
    {
        if (!closed.get())
        {
            queue.add(entry);
        }
    }
    
    
    /**
     * Closes the sink, signaling end-of-results. Only the first call has any effect.
     * 
     * @return true if this call closed the sink
     */
    public boolean close()
    {
        if (closed.compareAndSet(false, true))
        {
            queue.add(END);
            return true;
        }
        return false;
    }
    
    
    /**
     * Closes the sink because its results will never be delivered, such as when the zone stops
     * before processing the query.
     * 
     * @return true if this call closed the sink
     */
    public boolean abort()
    {
        if (!closed.get())
        {
            aborted = true;
        }
        return close();
    }
    
    
    /**
     * Returns true if the sink was closed by {@link #abort()} rather than after delivering its
     * results.
     * 
     * @return true if the results were never delivered
     */
    public boolean isAborted()
    {
        return aborted;
    }
    
    
    public boolean isClosed()
    {
        return closed.get();
    }
    
    
    /**
     * Returns true if the sink has been closed and all entries have been consumed.
     * 
     * @return true if no more entries will be returned
     */
    public boolean isDrained()
    {
        return closed.get() && (queue.peek() == END);
    }
    
    
    /**
     * Waits for the next entry.
     * 
     * @return The next entry, or null once the sink is closed and drained
     * @throws InterruptedException if interrupted while waiting
     */
    public Entry take()
    throws InterruptedException
    {
        Object o = queue.take();
        if (o == END)
        {
            // keep the marker so later calls also see end-of-results
            queue.add(END);
            return null;
        }
        return (Entry) o;
    }
    
    
    /**
     * Waits up to the timeout for the next entry.
     * 
     * @param timeout The maximum time to wait
     * @param unit The unit of the timeout
     * @return The next entry, or null on timeout or once the sink is closed and drained
     * @throws InterruptedException if interrupted while waiting
     */
    public Entry poll(final long timeout, final TimeUnit unit)
    throws InterruptedException
    {
        Object o = queue.poll(timeout, unit);
        if (o == END)
        {
            queue.add(END);
            return null;
        }
        return (Entry) o;
    }
    
    
    /**
     * Waits for the sink to be closed, returning every entry delivered to it.
     * 
     * @return The entries, in delivery order
     * @throws InterruptedException if interrupted while waiting
     */
    public List<Entry> drain()
    throws InterruptedException
    {
        List<Entry> entries = new ArrayList<Entry>();
        Entry entry;
        while ((entry = take()) != null)
        {
            entries.add(entry);
        }
        return entries;
    }
}
