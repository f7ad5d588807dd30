package net.posick.zeroconf;

/**
 * The transport protocol of a service type, as it appears in the service type name.
 */
public enum Protocol
{
    TCP("_tcp"),
    UDP("_udp");
    
    private final String label;
    
    
    private Protocol(final String label)
    {
        this.label = label;
    }
    
    
    /**
     * Returns the DNS label of the protocol, "_tcp" or "_udp".
     * 
     * @return The DNS label of the protocol
     */
    public String getLabel()
    {
        return label;
    }
    
    
    /**
     * Parses a protocol from its label or name, ex. "_tcp", "tcp" or "TCP".
     * 
     * @param value The protocol label or name
     * @return The Protocol
     * @throws IllegalArgumentException if the value is not a known protocol
     */
    public static Protocol fromLabel(final String value)
    {
        if (value != null)
        {
            String temp = value.startsWith("_") ? value.substring(1) : value;
            for (Protocol protocol : values())
            {
                if (protocol.name().equalsIgnoreCase(temp))
                {
                    return protocol;
                }
            }
        }
        throw new IllegalArgumentException("Unknown protocol \"" + value + "\"");
    }
    
    
    @Override
    public String toString()
    {
        return label;
    }
}
