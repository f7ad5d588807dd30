package net.posick.zeroconf.utils;

import java.io.Closeable;
import java.util.concurrent.ThreadFactory;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.xbill.DNS.Options;

/**
 * This class contains miscellaneous utility methods
 */
public class Misc
{
    private static final Logger logger = Logger.getLogger(Misc.class.getName());
    
    
    /**
     * Returns the named Logger. If verbose is true the Logger level is lowered to FINE and a
     * console handler is attached so that the detailed output is visible.
     * 
     * @param name The Logger name
     * @param verbose true to enable FINE logging
     * @return The Logger
     */
    public static final Logger getLogger(final String name, final boolean verbose)
    {
        Logger logger = Logger.getLogger(name);
        if (verbose)
        {
            logger.setLevel(Level.FINE);
            boolean found = false;
            for (Handler handler : logger.getHandlers())
            {
                if (handler instanceof ConsoleHandler)
                {
                    handler.setLevel(Level.FINE);
                    found = true;
                }
            }
            if (!found)
            {
                ConsoleHandler handler = new ConsoleHandler();
                handler.setLevel(Level.FINE);
                logger.addHandler(handler);
            }
        }
        return logger;
    }
    
    
    public static final Logger getLogger(final Class<?> clazz, final boolean verbose)
    {
        return getLogger(clazz.getName(), verbose);
    }
    
    
    /**
     * Returns true if any of the named dnsjava Options is set.
     * 
     * @param names The option names
     * @return true if any of the options is set
     */
    public static final boolean isVerbose(final String... names)
    {
        for (String name : names)
        {
            if (Options.check(name))
            {
                return true;
            }
        }
        return Options.check("verbose");
    }
    
    
    /**
     * Reads an integer dnsjava Option, returning the default value if the option is not set
     * or is not a positive number.
     * 
     * @param name The option name
     * @param defaultValue The default value
     * @return The option value
     */
    public static final int intOption(final String name, final int defaultValue)
    {
        int value = Options.intValue(name);
        return value > 0 ? value : defaultValue;
    }
    
    
    public static final long longOption(final String name, final long defaultValue)
    {
        String value = Options.value(name);
        if ((value != null) && (value.length() > 0))
        {
            try
            {
                long result = Long.parseLong(value.trim());
                if (result > 0)
                {
                    return result;
                }
            } catch (NumberFormatException e)
            {
                logger.log(Level.WARNING, "Invalid value \"" + value + "\" for option \"" + name + "\", using " + defaultValue + ".");
            }
        }
        return defaultValue;
    }
    
    
    public static final boolean booleanOption(final String name, final boolean defaultValue)
    {
        String temp = Options.value(name);
        if ((temp != null) && (temp.length() > 0))
        {
            return "true".equalsIgnoreCase(temp) || "t".equalsIgnoreCase(temp) || "yes".equalsIgnoreCase(temp) || "y".equalsIgnoreCase(temp);
        }
        return Options.check(name) || defaultValue;
    }
    
    
    /**
     * Returns a ThreadFactory producing daemon threads with the provided name.
     * 
     * @param name The thread name
     * @return The ThreadFactory
     */
    public static final ThreadFactory daemonThreadFactory(final String name)
    {
        return new ThreadFactory()
        {
            public Thread newThread(final Runnable r)
            {
                Thread t = new Thread(r, name);
                t.setDaemon(true);
                t.setContextClassLoader(Misc.class.getClassLoader());
                return t;
            }
        };
    }
    
    
    public static final void close(final Closeable closable)
    {
        if (closable != null)
        {
            try
            {
                closable.close();
            } catch (Exception e)
            {
                logger.log(Level.FINE, "Error closing \"" + closable + "\" - " + e.getMessage(), e);
            }
        }
    }
}
