package net.posick.zeroconf.net;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetAddress;
import java.net.SocketAddress;
import java.util.logging.Logger;

import net.posick.zeroconf.utils.Misc;

/**
 * Base class of the network endpoints feeding a {@link PacketListener}. The processor's read loop,
 * {@link #run()}, runs on a dedicated daemon thread started by {@link #start()}.
 */
public abstract class NetworkProcessor implements Runnable, Closeable
{
    protected static final Logger logger = Misc.getLogger(NetworkProcessor.class.getName(), Misc.isVerbose("zeroconf_network_verbose", "zeroconf_verbose"));
    
    // Normally MTU size is 1500, but can be up to 9000 for jumbo frames.
    public static final int DEFAULT_BUFFER_SIZE = 1500;
    
    protected final InetAddress address;
    
    protected final boolean ipv6;
    
    protected final int port;
    
    protected int bufferSize;
    
    protected transient volatile boolean exit = false;
    
    protected volatile PacketListener listener;
    
    protected Thread networkReadThread = null;
    
    
    /**
     * @param address The address of the group or peer the processor communicates with
     * @param port The port
     */
    protected NetworkProcessor(final InetAddress address, final int port)
    {
        if (address == null)
        {
            throw new IllegalArgumentException("A network processor requires an address.");
        }
        this.address = address;
        this.port = port;
        ipv6 = address.getAddress().length > 4;
        bufferSize = Math.max(DEFAULT_BUFFER_SIZE, Misc.intOption("zeroconf_buffer_size", DEFAULT_BUFFER_SIZE));
    }
    
    
    public void close()
    throws IOException
    {
        exit = true;
    }
    
    
    public InetAddress getAddress()
    {
        return address;
    }
    
    
    public int getPort()
    {
        return port;
    }
    
    
    public boolean isOperational()
    {
        return !exit;
    }
    
    
    /**
     * Sends a datagram.
     * 
     * @param data The datagram payload
     * @param target The destination
     * @throws IOException if the datagram cannot be sent
     */
    public abstract void send(byte[] data, SocketAddress target)
    throws IOException;
    
    
    public void setListener(final PacketListener listener)
    {
        this.listener = listener;
    }
    
    
    public void start()
    {
        exit = false;
        
        Thread t = new Thread(this);
        t.setName(address.getHostAddress() + " Read Thread");
        t.setDaemon(true);
        t.start();
        networkReadThread = t;
    }
    
    
    /**
     * Hands a packet to the listener.
     * 
     * @param packet The packet
     */
    protected void dispatch(final Packet packet)
    {
        PacketListener listener = this.listener;
        if (listener != null)
        {
            listener.packetReceived(packet);
        }
    }
    
    
    @Override
    public String toString()
    {
        return getClass().getSimpleName() + " [" + address.getHostAddress() + ":" + port + "]";
    }
}
