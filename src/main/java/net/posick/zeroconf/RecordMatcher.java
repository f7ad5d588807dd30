package net.posick.zeroconf;

import java.util.Arrays;

import org.xbill.DNS.Record;
import org.xbill.DNS.Type;

/**
 * Matching rules shared by query resolution, subscription fan-out and record deduplication.
 */
public final class RecordMatcher
{
    private RecordMatcher()
    {
    }
    
    
    /**
     * Tests if a query matches an entry. The query's type must be ANY or equal the entry's type,
     * and for one-shot queries the entry's name must equal the query's name. Subscriptions match
     * on type only.
     * 
     * @param query The query
     * @param entry The entry
     * @return true if the entry answers the query
     */
    public static boolean matches(final Query query, final Entry entry)
    {
        if ((query.getType() != Type.ANY) && (query.getType() != entry.getType()))
        {
            return false;
        }
        return query.isWildcard() || query.getName().equals(entry.getName());
    }
    
    
    public static boolean isSameRecord(final Entry entry, final Entry other)
    {
        return isSameRecord(entry.getRecord(), other.getRecord());
    }
    
    
    /**
     * Tests if two records are the same stored record: same name, same type and same data. The
     * TTL and class are not compared. A record of type ANY is the same as any record of its name.
     * 
     * @param record The record
     * @param other The other record
     * @return true if both are the same record
     */
    public static boolean isSameRecord(final Record record, final Record other)
    {
        if (!record.getName().equals(other.getName()))
        {
            return false;
        }
        if ((record.getType() == Type.ANY) || (other.getType() == Type.ANY))
        {
            return true;
        }
        return (record.getType() == other.getType()) && Arrays.equals(record.rdataToWireCanonical(), other.rdataToWireCanonical());
    }
}
