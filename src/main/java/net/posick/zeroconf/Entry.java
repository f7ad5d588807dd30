package net.posick.zeroconf;

import java.net.InetSocketAddress;

import org.xbill.DNS.Name;
import org.xbill.DNS.Record;

/**
 * A record stored in a {@link Zone}, together with its expiry time, whether it may be published in
 * responses, and for records learned from the network, the address of the node that announced it.
 */
public class Entry
{
    private final long expires;
    
    private final boolean publish;
    
    private final Record record;
    
    private final InetSocketAddress source;
    
    
    /**
     * @param record The resource record
     * @param publish true if the entry is locally authoritative and may be broadcast
     * @param expires The time the entry expires, in milliseconds since the epoch
     * @param source The address the record was learned from, null for local records
     */
    public Entry(final Record record, final boolean publish, final long expires, final InetSocketAddress source)
    {
        if (record == null)
        {
            throw new IllegalArgumentException("An entry requires a record.");
        }
        this.record = record;
        this.publish = publish;
        this.expires = expires;
        this.source = source;
    }
    
    
    /**
     * Creates a publishable entry expiring after the record's TTL.
     * 
     * @param record The record
     * @return The entry
     */
    public static Entry published(final Record record)
    {
        return new Entry(record, true, System.currentTimeMillis() + (record.getTTL() * 1000), null);
    }
    
    
    /**
     * Creates a cache only entry for a record received from the network.
     * 
     * @param record The record
     * @param receivedAt The time the record was received, in milliseconds since the epoch
     * @param source The address of the sender
     * @return The entry
     */
    public static Entry learned(final Record record, final long receivedAt, final InetSocketAddress source)
    {
        return new Entry(record, false, receivedAt + (record.getTTL() * 1000), source);
    }
    
    
    public long getExpires()
    {
        return expires;
    }
    
    
    public Name getName()
    {
        return record.getName();
    }
    
    
    public Record getRecord()
    {
        return record;
    }
    
    
    public InetSocketAddress getSource()
    {
        return source;
    }
    
    
    public int getType()
    {
        return record.getType();
    }
    
    
    public boolean isExpired(final long now)
    {
        return expires <= now;
    }
    
    
    public boolean isPublish()
    {
        return publish;
    }
    
    
    @Override
    public String toString()
    {
        return record + (publish ? " [published" : " [learned") + ", expires: " + expires + (source != null ? ", source: " + source : "") + "]";
    }
}
