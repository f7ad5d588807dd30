package net.posick.zeroconf.utils;

/**
 * Exponential backoff used when a listener has to be restarted. Each call to
 * {@link #nextDelay()} doubles the delay up to the maximum, and the backoff is exhausted once
 * the configured number of attempts has been handed out.
 */
public class Backoff
{
    public static final long DEFAULT_INITIAL_DELAY = 1000;
    
    public static final long DEFAULT_MAX_DELAY = 30000;
    
    public static final int DEFAULT_MAX_ATTEMPTS = 10;
    
    private final long initialDelay;
    
    private final long maxDelay;
    
    private final int maxAttempts;
    
    private int attempts = 0;
    
    
    public Backoff()
    {
        this(Misc.longOption("zeroconf_restart_backoff", DEFAULT_INITIAL_DELAY),
             Misc.longOption("zeroconf_restart_backoff_max", DEFAULT_MAX_DELAY),
             Misc.intOption("zeroconf_restart_attempts", DEFAULT_MAX_ATTEMPTS));
    }
    
    
    public Backoff(final long initialDelay, final long maxDelay, final int maxAttempts)
    {
        if ((initialDelay <= 0) || (maxDelay < initialDelay) || (maxAttempts <= 0))
        {
            throw new IllegalArgumentException("Invalid backoff [initial: " + initialDelay + ", max: " + maxDelay + ", attempts: " + maxAttempts + "]");
        }
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.maxAttempts = maxAttempts;
    }
    
    
    public synchronized int getAttempts()
    {
        return attempts;
    }
    
    
    public synchronized boolean isExhausted()
    {
        return attempts >= maxAttempts;
    }
    
    
    /**
     * Returns the delay in milliseconds to wait before the next attempt.
     * 
     * @return The delay in milliseconds
     * @throws IllegalStateException if all attempts have been used
     */
    public synchronized long nextDelay()
    {
        if (attempts >= maxAttempts)
        {
            throw new IllegalStateException("Backoff exhausted after " + attempts + " attempts");
        }
        long delay = initialDelay;
        for (int index = 0; (index < attempts) && (delay < maxDelay); index++ )
        {
            delay *= 2;
        }
        attempts++ ;
        return Math.min(delay, maxDelay);
    }
    
    
    public synchronized void reset()
    {
        attempts = 0;
    }
}
