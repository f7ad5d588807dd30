package net.posick.zeroconf;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import net.posick.zeroconf.utils.Misc;

/**
 * Runs multicast service discovery for the local domain: a {@link Zone} holding published and
 * learned records, and one {@link Connector} for each of the IPv4 and IPv6 mDNS groups answering
 * questions from it.
 */
public class ZeroconfService implements Closeable
{
    private static final Logger logger = Misc.getLogger(ZeroconfService.class.getName(), Misc.isVerbose("zeroconf_verbose"));
    
    /** The default port to send queries to */
    public static final int DEFAULT_PORT = 5353;
    
    /** The default address to send IPv4 queries to */
    public static final String DEFAULT_IPv4_ADDRESS = "224.0.0.251";
    
    /** The default address to send IPv6 queries to */
    public static final String DEFAULT_IPv6_ADDRESS = "FF02::FB";
    
    private final Zone zone;
    
    private final boolean ownsZone;
    
    private final List<Connector> connectors = new ArrayList<Connector>();
    
    
    public ZeroconfService()
    {
        this(new LocalZone(), true);
    }
    
    
    /**
     * @param zone The zone to answer from, left open when the service is closed
     */
    public ZeroconfService(final Zone zone)
    {
        this(zone, false);
    }
    
    
    protected ZeroconfService(final Zone zone, final boolean ownsZone)
    {
        if (zone == null)
        {
            throw new IllegalArgumentException("A zeroconf service requires a zone.");
        }
        this.zone = zone;
        this.ownsZone = ownsZone;
    }
    
    
    public static InetSocketAddress getIPv4Group()
    throws IOException
    {
        return new InetSocketAddress(InetAddress.getByName(DEFAULT_IPv4_ADDRESS), DEFAULT_PORT);
    }
    
    
    public static InetSocketAddress getIPv6Group()
    throws IOException
    {
        return new InetSocketAddress(InetAddress.getByName(DEFAULT_IPv6_ADDRESS), DEFAULT_PORT);
    }
    
    
    public synchronized void close()
    {
        closeConnectors();
        if (ownsZone)
        {
            zone.close();
        }
    }
    
    
    public synchronized List<Connector> getConnectors()
    {
        return Collections.unmodifiableList(new ArrayList<Connector>(connectors));
    }
    
    
    public Zone getZone()
    {
        return zone;
    }
    
    
    /**
     * Publishes a service in the zone.
     * 
     * @param service The service
     * @return The entries added to the zone
     * @throws ServiceRegistrationException if the service's records cannot be built
     */
    public List<Entry> publish(final Service service)
    throws ServiceRegistrationException
    {
        List<Entry> entries = Publisher.publish(zone, service);
        logger.logp(Level.INFO, getClass().getName(), "publish", "Published " + service);
        return entries;
    }
    
    
    /**
     * Joins the IPv4 and IPv6 mDNS groups, unless disabled with the "zeroconf_disable_ipv4" or
     * "zeroconf_disable_ipv6" options.
     * 
     * @throws IOException if a group cannot be joined. No connector is left running.
     */
    public void start()
    throws IOException
    {
        start(!Misc.booleanOption("zeroconf_disable_ipv4", false), !Misc.booleanOption("zeroconf_disable_ipv6", false));
    }
    
    
    public synchronized void start(final boolean ipv4, final boolean ipv6)
    throws IOException
    {
        if (!connectors.isEmpty())
        {
            throw new IllegalStateException("The zeroconf service is already started.");
        }
        
        try
        {
            if (ipv4)
            {
                connectors.add(Connector.open(zone, getIPv4Group()));
            }
            if (ipv6)
            {
                connectors.add(Connector.open(zone, getIPv6Group()));
            }
        } catch (IOException e)
        {
            logger.log(Level.SEVERE, "Could not join the mDNS multicast groups - " + e.getMessage(), e);
            closeConnectors();
            throw e;
        }
    }
    
    
    private void closeConnectors()
    {
        for (Connector connector : connectors)
        {
            Misc.close(connector);
        }
        connectors.clear();
    }
}
