package net.posick.zeroconf;

/**
 * A service type, the symbolic service name plus its transport protocol, ex. "_ssh" over TCP.
 * Well-known types are available from the {@link ServiceTypeRegistry}.
 */
public class ServiceType
{
    private final String name;
    
    private final Protocol protocol;
    
    
    /**
     * @param name The symbolic service name, with or without the leading underscore
     * @param protocol The transport protocol
     */
    public ServiceType(final String name, final Protocol protocol)
    {
        if ((name == null) || (name.trim().length() == 0) || "_".equals(name.trim()))
        {
            throw new IllegalArgumentException("A service type requires a name.");
        }
        if (protocol == null)
        {
            throw new IllegalArgumentException("A service type requires a protocol.");
        }
        String temp = name.trim();
        this.name = temp.startsWith("_") ? temp : "_" + temp;
        this.protocol = protocol;
    }
    
    
    public String getName()
    {
        return name;
    }
    
    
    public Protocol getProtocol()
    {
        return protocol;
    }
    
    
    @Override
    public boolean equals(final Object obj)
    {
        if (this == obj)
        {
            return true;
        }
        if (!(obj instanceof ServiceType))
        {
            return false;
        }
        ServiceType other = (ServiceType) obj;
        return name.equalsIgnoreCase(other.name) && (protocol == other.protocol);
    }
    
    
    @Override
    public int hashCode()
    {
        return (31 * name.toLowerCase().hashCode()) + protocol.hashCode();
    }
    
    
    /**
     * Returns the type in DNS label form, ex. "_ssh._tcp".
     */
    @Override
    public String toString()
    {
        return name + "." + protocol.getLabel();
    }
}
