package net.posick.zeroconf;

import java.io.Closeable;
import java.util.List;

import org.xbill.DNS.Record;

/**
 * A store of resource records for the local domain. Locally published records and records learned
 * from the network are both held in the zone; every mutation and lookup is linearized by the
 * implementation.
 */
public interface Zone extends Closeable
{
    /**
     * Adds an entry unless the same record is already stored under its name, delivering it to every
     * matching subscription. Returns once the request has been handed to the zone.
     * 
     * @param entry The entry
     * @throws ZoneException if the zone is closed
     */
    public void add(Entry entry);
    
    
    /**
     * Returns the entries currently stored under the question's name that match its type, in the
     * order they were added.
     * 
     * @param question The question
     * @return The matching entries
     * @throws ZoneException if the zone is closed or the caller is interrupted
     */
    public List<Entry> query(Record question);
    
    
    /**
     * Returns the entries answering the question together with the additional entries a response
     * should include, such as the address records of a service's target host.
     * 
     * @param question The question
     * @return The answers and additionals
     * @throws ZoneException if the zone is closed or the caller is interrupted
     */
    public QueryResult queryAdditional(Record question);
    
    
    /**
     * Subscribes to entries added from now on whose type matches.
     * 
     * @param type The record type or Type.ANY
     * @return The subscription
     * @throws ZoneException if the zone is closed
     */
    public Subscription subscribe(int type);
    
    
    /**
     * Cancels a subscription. Once processed the subscription receives no further entries and its
     * sink is closed.
     * 
     * @param subscription The subscription
     */
    public void unsubscribe(Subscription subscription);
    
    
    /**
     * Stops the zone, closing the sinks of all subscriptions.
     */
    public void close();
}
