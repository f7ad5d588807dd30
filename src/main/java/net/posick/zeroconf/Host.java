package net.posick.zeroconf;

import java.net.InetAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * The machine offering a service: its name, its domain and its IP addresses.
 */
public class Host
{
    private final String name;
    
    private final String domain;
    
    private final List<InetAddress> addresses;
    
    
    /**
     * @param name The host name, ex. "foo"
     * @param domain The domain, ex. "local.". A trailing dot is added if missing.
     * @param addresses The IP addresses of the host
     */
    public Host(final String name, final String domain, final InetAddress... addresses)
    {
        if ((name == null) || (name.trim().length() == 0))
        {
            throw new IllegalArgumentException("A host requires a name.");
        }
        if ((domain == null) || (domain.trim().length() == 0))
        {
            throw new IllegalArgumentException("A host requires a domain.");
        }
        this.name = name.trim();
        String temp = domain.trim();
        this.domain = temp.endsWith(".") ? temp : temp + ".";
        
        LinkedHashSet<InetAddress> set = new LinkedHashSet<InetAddress>();
        if (addresses != null)
        {
            for (InetAddress address : addresses)
            {
                if (address != null)
                {
                    set.add(address);
                }
            }
        }
        this.addresses = Collections.unmodifiableList(new ArrayList<InetAddress>(set));
    }
    
    
    public List<InetAddress> getAddresses()
    {
        return addresses;
    }
    
    
    public String getDomain()
    {
        return domain;
    }
    
    
    public String getName()
    {
        return name;
    }
    
    
    @Override
    public String toString()
    {
        return name + "." + domain + " " + addresses;
    }
}
