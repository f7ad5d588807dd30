package net.posick.zeroconf;

/**
 * Raised when a request cannot be handed to a zone, because the zone is closed or the caller was
 * interrupted while waiting for it.
 */
public class ZoneException extends IllegalStateException
{
    private static final long serialVersionUID = 202610181530L;
    
    
    public ZoneException(final String message)
    {
        super(message);
    }
    
    
    public ZoneException(final String message, final Throwable cause)
    {
        super(message, cause);
    }
}
