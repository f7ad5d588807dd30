package net.posick.zeroconf;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.xbill.DNS.AAAARecord;
import org.xbill.DNS.ARecord;
import org.xbill.DNS.DClass;
import org.xbill.DNS.PTRRecord;
import org.xbill.DNS.Record;
import org.xbill.DNS.SRVRecord;
import org.xbill.DNS.TXTRecord;

/**
 * Publishes services into a {@link Zone}. Publishing a service adds, as publishable entries:
 * <ul>
 * <li>an address record (A or AAAA) for each of the host's addresses, ex. foo.local. IN A 1.2.3.4</li>
 * <li>a PTR record from the service type to the instance, ex. _ssh._tcp.local. IN PTR foo._ssh._tcp.local.</li>
 * <li>a SRV record locating the instance, ex. foo._ssh._tcp.local. IN SRV 0 0 22 foo.local.</li>
 * <li>a TXT record carrying the service's attributes</li>
 * </ul>
 * Publishing performs no network I/O. The responders answer questions from the zone.
 */
public final class Publisher
{
    /** The TTL of published records, in seconds */
    public static final long DEFAULT_TTL = 3600;
    
    public static final int MAX_PORT = 0xFFFF;
    
    
    private Publisher()
    {
    }
    
    
    /**
     * Builds the records of a service and adds them to the zone.
     * 
     * @param zone The zone
     * @param service The service
     * @return The entries added, in the order they were added
     * @throws ServiceRegistrationException if the service's records cannot be built
     */
    public static List<Entry> publish(final Zone zone, final Service service)
    throws ServiceRegistrationException
    {
        List<Record> records = buildRecords(service);
        List<Entry> entries = new ArrayList<Entry>(records.size());
        for (Record record : records)
        {
            entries.add(publishRecord(zone, record));
        }
        return entries;
    }
    
    
    /**
     * Adds a record to the zone as a publishable entry.
     * 
     * @param zone The zone
     * @param record The record
     * @return The entry added
     */
    public static Entry publishRecord(final Zone zone, final Record record)
    {
        Entry entry = Entry.published(record);
        zone.add(entry);
        return entry;
    }
    
    
    /**
     * Builds the address, PTR, SRV and TXT records of a service.
     * 
     * @param service The service
     * @return The records
     * @throws ServiceRegistrationException if the port is out of range or a record cannot be built
     */
    public static List<Record> buildRecords(final Service service)
    throws ServiceRegistrationException
    {
        if ((service.getPort() < 0) || (service.getPort() > MAX_PORT))
        {
            throw new ServiceRegistrationException(ServiceRegistrationException.REASON.INVALID_PORT, "Port " + service.getPort() + " of service \"" + service.getServiceInstanceName() + "\" is out of range.");
        }
        
        List<Record> records = new ArrayList<Record>();
        try
        {
            for (InetAddress address : service.getHost().getAddresses())
            {
                if (address instanceof Inet4Address)
                {
                    records.add(new ARecord(service.getFullyQualifiedName(), DClass.IN, DEFAULT_TTL, address));
                } else
                {
                    records.add(new AAAARecord(service.getFullyQualifiedName(), DClass.IN, DEFAULT_TTL, address));
                }
            }
            
            records.add(new PTRRecord(service.getServiceTypeName(), DClass.IN, DEFAULT_TTL, service.getServiceInstanceName()));
            records.add(new SRVRecord(service.getServiceInstanceName(), DClass.IN, DEFAULT_TTL, 0, 0, service.getPort(), service.getFullyQualifiedName()));
            records.add(new TXTRecord(service.getServiceInstanceName(), DClass.IN, DEFAULT_TTL, toText(service.getAttributes())));
        } catch (IllegalArgumentException e)
        {
            throw new ServiceRegistrationException(ServiceRegistrationException.REASON.INVALID_RECORD, "Could not build the records of service \"" + service.getServiceInstanceName() + "\" - " + e.getMessage(), e);
        }
        return records;
    }
    
    
    /*
     * Attributes become "key=value" strings, or "key" for a null value. An empty attribute set is a
     * single empty string [RFC 6763 Section 6.1].
     */
    private static List<String> toText(final Map<String, String> attributes)
    {
        if (attributes.isEmpty())
        {
            return Collections.singletonList("");
        }
        
        List<String> strings = new ArrayList<String>(attributes.size());
        for (Map.Entry<String, String> attribute : attributes.entrySet())
        {
            strings.add(attribute.getValue() == null ? attribute.getKey() : attribute.getKey() + "=" + attribute.getValue());
        }
        return strings;
    }
}
