package net.posick.zeroconf;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A registry of service types keyed by their symbolic name, ex. "ssh". A registry is seeded
 * with well-known types and new types can be registered at runtime. The registry is thread safe.
 */
public class ServiceTypeRegistry
{
    private static final ServiceTypeRegistry DEFAULT_REGISTRY = new ServiceTypeRegistry();
    
    private final Map<String, ServiceType> types = new LinkedHashMap<String, ServiceType>();
    
    
    /**
     * Creates a registry seeded with the well-known service types.
     */
    public ServiceTypeRegistry()
    {
        this(true);
    }
    
    
    /**
     * Creates a registry.
     * 
     * @param seed true to seed the registry with the well-known service types
     */
    public ServiceTypeRegistry(final boolean seed)
    {
        if (seed)
        {
            register("ssh", new ServiceType("_ssh", Protocol.TCP));
            register("sftp-ssh", new ServiceType("_sftp-ssh", Protocol.TCP));
            register("telnet", new ServiceType("_telnet", Protocol.TCP));
            register("http", new ServiceType("_http", Protocol.TCP));
            register("https", new ServiceType("_https", Protocol.TCP));
            register("ftp", new ServiceType("_ftp", Protocol.TCP));
            register("printer", new ServiceType("_printer", Protocol.TCP));
            register("ipp", new ServiceType("_ipp", Protocol.TCP));
            register("smb", new ServiceType("_smb", Protocol.TCP));
            register("afpovertcp", new ServiceType("_afpovertcp", Protocol.TCP));
            register("workstation", new ServiceType("_workstation", Protocol.TCP));
            register("nfs", new ServiceType("_nfs", Protocol.UDP));
        }
    }
    
    
    /**
     * Returns the shared registry.
     * 
     * @return The shared registry
     */
    public static ServiceTypeRegistry getDefault()
    {
        return DEFAULT_REGISTRY;
    }
    
    
    public synchronized boolean contains(final String key)
    {
        return types.containsKey(normalize(key));
    }
    
    
    /**
     * Returns a copy of the registered types, in registration order.
     * 
     * @return The registered types
     */
    public synchronized Map<String, ServiceType> getTypes()
    {
        return Collections.unmodifiableMap(new LinkedHashMap<String, ServiceType>(types));
    }
    
    
    /**
     * Looks up a service type by key. The key is case insensitive and the leading underscore is
     * optional.
     * 
     * @param key The key, ex. "ssh" or "_ssh"
     * @return The service type or null if no type is registered for the key
     */
    public synchronized ServiceType lookup(final String key)
    {
        return types.get(normalize(key));
    }
    
    
    /**
     * Registers a service type, replacing any type previously registered under the same key.
     * 
     * @param key The key
     * @param type The service type
     * @return The type previously registered under the key, or null
     */
    public synchronized ServiceType register(final String key, final ServiceType type)
    {
        if (type == null)
        {
            throw new IllegalArgumentException("Cannot register a null service type.");
        }
        return types.put(normalize(key), type);
    }
    
    
    public synchronized ServiceType unregister(final String key)
    {
        return types.remove(normalize(key));
    }
    
    
    private static String normalize(final String key)
    {
        if ((key == null) || (key.trim().length() == 0))
        {
            throw new IllegalArgumentException("A service type key is required.");
        }
        String temp = key.trim().toLowerCase();
        return temp.startsWith("_") ? temp.substring(1) : temp;
    }
}
