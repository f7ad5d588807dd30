package net.posick.zeroconf;

import java.io.IOException;

/**
 * The Service Registration Exception is raised whenever a service cannot be published, such as
 * when its port is out of range or one of its records cannot be built.
 */
public class ServiceRegistrationException extends IOException
{
    private static final long serialVersionUID = 202610181512L;
    
    
    public static enum REASON {INVALID_PORT, INVALID_RECORD}
    
    
    private final REASON reason;
    
    
    public ServiceRegistrationException(final REASON reason, final String message)
    {
        super(message);
        this.reason = reason;
    }
    
    
    public ServiceRegistrationException(final REASON reason, final String message, final Throwable cause)
    {
        super(message, cause);
        this.reason = reason;
    }
    
    
    /**
     * Returns the reason for the service registration failure.
     * 
     * @return The reason for the service registration failure
     */
    public REASON getReason()
    {
        return reason;
    }
    
    
    @Override
    public String toString()
    {
        String s = getClass().getName();
        String message = getLocalizedMessage();
        return (message != null) ? (s + ": [Reason: " + reason + "] " + message) : s + ": [Reason: " + reason + "]";
    }
}
