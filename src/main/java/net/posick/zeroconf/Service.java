package net.posick.zeroconf;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.xbill.DNS.Name;
import org.xbill.DNS.TextParseException;

/**
 * A service offered by a host: the host, the service type and the port, plus optional text
 * attributes published in the service's TXT record.
 * <p>
 * A service derives three names:
 * <ul>
 * <li>the host's fully qualified name, ex. "foo.local."</li>
 * <li>the service type name, ex. "_ssh._tcp.local."</li>
 * <li>the service instance name, ex. "foo._ssh._tcp.local."</li>
 * </ul>
 */
public class Service
{
    private final Host host;
    
    private final ServiceType type;
    
    private final int port;
    
    private final Map<String, String> attributes;
    
    private final Name fullyQualifiedName;
    
    private final Name serviceTypeName;
    
    private final Name serviceInstanceName;
    
    
    public Service(final Host host, final ServiceType type, final int port)
    throws TextParseException
    {
        this(host, type, port, null);
    }
    
    
    /**
     * @param host The host offering the service
     * @param type The service type
     * @param port The port the service listens on
     * @param attributes The text attributes, may be null
     * @throws TextParseException if the names derived from the host and type are invalid
     */
    public Service(final Host host, final ServiceType type, final int port, final Map<String, String> attributes)
    throws TextParseException
    {
        if (host == null)
        {
            throw new IllegalArgumentException("A service requires a host.");
        }
        if (type == null)
        {
            throw new IllegalArgumentException("A service requires a type.");
        }
        this.host = host;
        this.type = type;
        this.port = port;
        this.attributes = attributes == null ? Collections.<String, String>emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<String, String>(attributes));
        
        fullyQualifiedName = Name.fromString(host.getName() + "." + host.getDomain());
        serviceTypeName = Name.fromString(type.getName() + "." + type.getProtocol().getLabel() + "." + host.getDomain());
        serviceInstanceName = Name.fromString(host.getName() + "." + serviceTypeName);
    }
    
    
    public Map<String, String> getAttributes()
    {
        return attributes;
    }
    
    
    /**
     * Returns the host's fully qualified name, host name + "." + domain.
     * 
     * @return The host's fully qualified name
     */
    public Name getFullyQualifiedName()
    {
        return fullyQualifiedName;
    }
    
    
    public Host getHost()
    {
        return host;
    }
    
    
    public int getPort()
    {
        return port;
    }
    
    
    /**
     * Returns the service instance name, host name + "." + service type name.
     * 
     * @return The service instance name
     */
    public Name getServiceInstanceName()
    {
        return serviceInstanceName;
    }
    
    
    /**
     * Returns the service type name, type name + "." + protocol label + "." + domain.
     * 
     * @return The service type name
     */
    public Name getServiceTypeName()
    {
        return serviceTypeName;
    }
    
    
    public ServiceType getType()
    {
        return type;
    }
    
    
    @Override
    public String toString()
    {
        return serviceInstanceName + " [host: " + fullyQualifiedName + ", port: " + port + ", addresses: " + host.getAddresses() + (attributes.isEmpty() ? "" : ", attributes: " + attributes) + "]";
    }
}
