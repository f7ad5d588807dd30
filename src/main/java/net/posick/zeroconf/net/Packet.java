package net.posick.zeroconf.net;

import java.net.DatagramPacket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A datagram received from the network, with the sender's address and the time it was received.
 */
public class Packet
{
    private static final AtomicInteger sequence = new AtomicInteger();
    
    private final InetAddress address;
    
    private final int port;
    
    private final byte[] data;
    
    private final int id;
    
    private final long receivedAt;
    
    
    protected Packet(final DatagramPacket datagram)
    {
        this(datagram.getAddress(), datagram.getPort(), datagram.getData(), datagram.getOffset(), datagram.getLength());
    }
    
    
    /**
     * @param address The sender's address
     * @param port The sender's port
     * @param data The buffer holding the datagram; the payload is copied
     * @param offset The offset of the payload in the buffer
     * @param length The length of the payload
     */
    public Packet(final InetAddress address, final int port, final byte[] data, final int offset, final int length)
    {
        id = sequence.getAndIncrement();
        this.address = address;
        this.port = port;
        this.data = Arrays.copyOfRange(data, offset, offset + length);
        receivedAt = System.currentTimeMillis();
    }
    
    
    public InetAddress getAddress()
    {
        return address;
    }
    
    
    public byte[] getData()
    {
        return data;
    }
    
    
    public int getId()
    {
        return id;
    }
    
    
    public int getPort()
    {
        return port;
    }
    
    
    public long getReceivedAt()
    {
        return receivedAt;
    }
    
    
    public InetSocketAddress getSocketAddress()
    {
        return new InetSocketAddress(address, port);
    }
    
    
    @Override
    public String toString()
    {
        return "Packet " + id + " [" + data.length + " bytes from " + getSocketAddress() + "]";
    }
}
