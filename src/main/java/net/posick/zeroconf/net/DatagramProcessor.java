package net.posick.zeroconf.net;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.MulticastSocket;
import java.net.SocketAddress;
import java.util.logging.Level;

import net.posick.zeroconf.utils.Backoff;
import net.posick.zeroconf.utils.Misc;

/**
 * Listens to a multicast group. The socket is bound to the wildcard address of the group's address
 * family on the group's port and joined to the group.
 * <p>
 * A read failure does not stop the process: the socket is closed and reopened with exponential
 * backoff, and the processor stops itself only when the backoff is exhausted. Other processors are
 * not affected.
 */
public class DatagramProcessor extends NetworkProcessor
{
    public static final int DEFAULT_TTL = 255;
    
    protected boolean loopbackModeDisabled = false;
    
    protected int ttl = DEFAULT_TTL;
    
    protected volatile MulticastSocket socket;
    
    protected final Backoff backoff;
    
    protected volatile boolean restarting = false;
    
    
    /**
     * Opens the socket and joins the group.
     * 
     * @param address The multicast group address
     * @param port The port
     * @throws IOException if the socket cannot be bound or the group cannot be joined
     */
    public DatagramProcessor(final InetAddress address, final int port)
    throws IOException
    {
        this(address, port, new Backoff());
    }
    
    
    public DatagramProcessor(final InetAddress address, final int port, final Backoff backoff)
    throws IOException
    {
        super(address, port);
        
        if (!address.isMulticastAddress())
        {
            throw new IOException("\"" + address.getHostAddress() + "\" is not a multicast address.");
        }
        
        loopbackModeDisabled = Misc.booleanOption("zeroconf_multicast_loopback", false);
        ttl = Misc.intOption("zeroconf_multicast_ttl", DEFAULT_TTL);
        this.backoff = backoff;
        
        socket = openSocket();
    }
    
    
    @Override
    public void close()
    throws IOException
    {
        super.close();
        closeSocket(socket);
    }
    
    
    public int getTTL()
    {
        return ttl;
    }
    
    
    @Override
    public boolean isOperational()
    {
        MulticastSocket socket = this.socket;
        return super.isOperational() && (restarting || ((socket != null) && socket.isBound() && !socket.isClosed()));
    }
    
    
    public void run()
    {
        while (!exit)
        {
            try
            {
                byte[] buffer = new byte[bufferSize];
                DatagramPacket datagram = new DatagramPacket(buffer, buffer.length);
                socket.receive(datagram);
                backoff.reset();
                if (!accepts(datagram.getAddress()))
                {
                    if (logger.isLoggable(Level.FINE))
                    {
                        logger.logp(Level.FINE, getClass().getName(), "run", "Ignoring datagram from \"" + datagram.getSocketAddress() + "\" received by the " + (ipv6 ? "IPv6" : "IPv4") + " socket.");
                    }
                } else if (datagram.getLength() > 0)
                {
                    Packet packet = new Packet(datagram);
                    if (logger.isLoggable(Level.FINE))
                    {
                        logger.logp(Level.FINE, getClass().getName(), "run", "-----> Received " + packet + " <-----");
                    }
                    dispatch(packet);
                }
            } catch (IOException e)
            {
                if (!exit)
                {
                    logger.log(Level.WARNING, "Error receiving data from \"" + address.getHostAddress() + "\" - " + e.getMessage(), e);
                    restart();
                }
            } catch (RuntimeException e)
            {
                logger.log(Level.WARNING, "Error dispatching data received from \"" + address.getHostAddress() + "\" - " + e.getMessage(), e);
            }
        }
        logger.logp(Level.INFO, getClass().getName(), "run", "Stopped listening to \"" + address.getHostAddress() + ":" + port + "\".");
    }
    
    
    /**
     * Returns true if the sender belongs to the processor's address family. A socket bound to the
     * IPv6 wildcard address can also receive IPv4 traffic for the port, which the IPv4 processor
     * already handles.
     * 
     * @param sender The address of the sender
     * @return true if the datagram should be dispatched
     */
    protected boolean accepts(final InetAddress sender)
    {
        return ipv6 == (sender instanceof Inet6Address);
    }
    
    
    @Override
    public void send(final byte[] data, final SocketAddress target)
    throws IOException
    {
        if (exit)
        {
            return;
        }
        
        DatagramPacket packet = new DatagramPacket(data, data.length, target);
        try
        {
            socket.send(packet);
        } catch (IOException e)
        {
            throw new IOException("Exception \"" + e.getMessage() + "\" occured while sending datagram to \"" + target + "\".", e);
        }
    }
    
    
    @SuppressWarnings("deprecation")
    protected MulticastSocket openSocket()
    throws IOException
    {
        InetAddress wildcard = InetAddress.getByName(ipv6 ? "::" : "0.0.0.0");
        MulticastSocket socket = new MulticastSocket(null);
        try
        {
            socket.setReuseAddress(true);
            socket.bind(new InetSocketAddress(wildcard, port));
            socket.setLoopbackMode(loopbackModeDisabled);
            // Set the IP TTL to 255, per the mDNS specification [RFC 6762].
            socket.setTimeToLive(ttl);
            socket.joinGroup(address);
        } catch (IOException e)
        {
            socket.close();
            throw e;
        }
        logger.logp(Level.INFO, getClass().getName(), "openSocket", "Listening to \"" + address.getHostAddress() + ":" + port + "\".");
        return socket;
    }
    
    
    @SuppressWarnings("deprecation")
    protected void closeSocket(final MulticastSocket socket)
    {
        if (socket == null)
        {
            return;
        }
        try
        {
            socket.leaveGroup(address);
        } catch (SecurityException e)
        {
            logger.log(Level.WARNING, "A Security error occurred while leaving Multicast Group \"" + address.getHostAddress() + "\" - " + e.getMessage(), e);
        } catch (Exception e)
        {
            logger.log(Level.FINE, "Error leaving Multicast Group \"" + address.getHostAddress() + "\" - " + e.getMessage(), e);
        }
        socket.close();
    }
    
    
    /*
     * Replaces the failed socket, waiting longer after each consecutive failure. Gives up and stops
     * the read loop once the backoff is exhausted.
     */
    protected void restart()
    {
        restarting = true;
        try
        {
            reopen();
        } finally
        {
            restarting = false;
        }
    }
    
    
    private void reopen()
    {
        closeSocket(socket);
        while (!exit)
        {
            if (backoff.isExhausted())
            {
                logger.logp(Level.SEVERE, getClass().getName(), "restart", "Giving up on \"" + address.getHostAddress() + ":" + port + "\" after " + backoff.getAttempts() + " restart attempts.");
                exit = true;
                return;
            }
            
            long delay = backoff.nextDelay();
            logger.logp(Level.INFO, getClass().getName(), "restart", "Reopening \"" + address.getHostAddress() + ":" + port + "\" in " + delay + " milliseconds.");
            try
            {
                Thread.sleep(delay);
            } catch (InterruptedException e)
            {
                Thread.currentThread().interrupt();
                exit = true;
                return;
            }
            
            try
            {
                socket = openSocket();
                return;
            } catch (IOException e)
            {
                logger.log(Level.WARNING, "Error reopening \"" + address.getHostAddress() + ":" + port + "\" - " + e.getMessage(), e);
            }
        }
    }
}
