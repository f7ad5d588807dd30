package net.posick.zeroconf;

import java.io.Closeable;
import java.util.concurrent.TimeUnit;

/**
 * A standing registration with a {@link Zone} receiving every entry of its type added after it was
 * registered. Closing the subscription unregisters it from the zone.
 */
public class Subscription implements Closeable
{
    private final Zone zone;
    
    private final Query query;
    
    
    public Subscription(final Zone zone, final Query query)
    {
        if (!query.isWildcard())
        {
            throw new IllegalArgumentException("A subscription query must not name a target.");
        }
        this.zone = zone;
        this.query = query;
    }
    
    
    /**
     * Unsubscribes from the zone. Once the zone has processed the request no more entries are
     * delivered and the sink is closed.
     */
    public void close()
    {
        if (!query.getSink().isClosed())
        {
            zone.unsubscribe(this);
        }
    }
    
    
    public Query getQuery()
    {
        return query;
    }
    
    
    public EntrySink getSink()
    {
        return query.getSink();
    }
    
    
    public int getType()
    {
        return query.getType();
    }
    
    
    public boolean isClosed()
    {
        return query.getSink().isClosed();
    }
    
    
    /**
     * Waits up to the timeout for the next entry.
     * 
     * @see EntrySink#poll(long, TimeUnit)
     */
    public Entry poll(final long timeout, final TimeUnit unit)
    throws InterruptedException
    {
        return query.getSink().poll(timeout, unit);
    }
    
    
    /**
     * Waits for the next entry.
     * 
     * @see EntrySink#take()
     */
    public Entry take()
    throws InterruptedException
    {
        return query.getSink().take();
    }
}
