package net.posick.zeroconf.net;

import static org.junit.Assert.*;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.DatagramPacket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.MulticastSocket;
import java.net.SocketAddress;
import java.net.SocketException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import org.junit.Test;

import net.posick.zeroconf.utils.Backoff;

/**
 * Test Cases for the DatagramProcessor read loop, run against scripted sockets.
 */
public class DatagramProcessorTest
{
    private static final String IPv4_GROUP = "224.0.0.251";
    
    private static final String IPv6_GROUP = "FF02::FB";
    
    
    /**
     * An unbound socket whose reads replay a script of datagrams and read errors.
     */
    static class ScriptedSocket extends MulticastSocket
    {
        private final BlockingQueue<Object> script;
        
        
        ScriptedSocket(final BlockingQueue<Object> script)
        throws IOException
        {
            super((SocketAddress) null);
            this.script = script;
        }
        
        
        @Override
        public boolean isBound()
        {
            return !isClosed();
        }
        
        
        @Override
        public void receive(final DatagramPacket datagram)
        throws IOException
        {
            while (true)
            {
                Object next;
                try
                {
                    next = script.poll(10, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e)
                {
                    throw new InterruptedIOException(e.getMessage());
                }
                
                if (next instanceof IOException)
                {
                    throw (IOException) next;
                } else if (next instanceof DatagramPacket)
                {
                    DatagramPacket scripted = (DatagramPacket) next;
                    System.arraycopy(scripted.getData(), scripted.getOffset(), datagram.getData(), datagram.getOffset(), scripted.getLength());
                    datagram.setLength(scripted.getLength());
                    datagram.setSocketAddress(scripted.getSocketAddress());
                    return;
                } else if (isClosed())
                {
                    throw new SocketException("Socket closed");
                }
            }
        }
    }
    
    
    static class ScriptedProcessor extends DatagramProcessor
    {
        // No initializers, the superclass constructor opens the first socket before they would run
        BlockingQueue<Object> script;
        
        volatile int opens;
        
        volatile boolean reopenFails;
        
        
        ScriptedProcessor(final String group, final Backoff backoff)
        throws IOException
        {
            super(InetAddress.getByName(group), 5353, backoff);
        }
        
        
        @Override
        protected MulticastSocket openSocket()
        throws IOException
        {
            if (script == null)
            {
                script = new LinkedBlockingQueue<Object>();
            }
            opens++ ;
            if ((opens > 1) && reopenFails)
            {
                throw new IOException("Network unavailable");
            }
            return new ScriptedSocket(script);
        }
    }
    
    
    static class RecordingListener implements PacketListener
    {
        final BlockingQueue<Packet> packets = new LinkedBlockingQueue<Packet>();
        
        
        public void packetReceived(final Packet packet)
        {
            packets.add(packet);
        }
    }
    
    
    @Test
    public void testReadFailureReopensSocket()
    throws Exception
    {
        ScriptedProcessor processor = new ScriptedProcessor(IPv4_GROUP, new Backoff(1, 10, 5));
        RecordingListener listener = new RecordingListener();
        processor.setListener(listener);
        processor.script.add(new IOException("Read failed"));
        processor.script.add(datagram(new byte[] {1, 2, 3}, "192.168.1.20"));
        try
        {
            processor.start();
            
            Packet packet = listener.packets.poll(5, TimeUnit.SECONDS);
            assertNotNull(packet);
            assertArrayEquals(new byte[] {1, 2, 3}, packet.getData());
            assertEquals(new InetSocketAddress("192.168.1.20", 5353), packet.getSocketAddress());
            assertEquals(2, processor.opens);
            assertEquals(0, processor.backoff.getAttempts());
            assertTrue(processor.isOperational());
        } finally
        {
            processor.close();
        }
        assertFalse(processor.isOperational());
    }
    
    
    @Test
    public void testProcessorStopsWhenBackoffIsExhausted()
    throws Exception
    {
        ScriptedProcessor failing = new ScriptedProcessor(IPv4_GROUP, new Backoff(1, 2, 3));
        failing.reopenFails = true;
        failing.script.add(new IOException("Read failed"));
        ScriptedProcessor healthy = new ScriptedProcessor(IPv4_GROUP, new Backoff(1, 2, 3));
        try
        {
            healthy.start();
            failing.start();
            
            long deadline = System.currentTimeMillis() + 5000;
            while (failing.isOperational() && (System.currentTimeMillis() < deadline))
            {
                Thread.sleep(1);
            }
            assertFalse(failing.isOperational());
            assertTrue(failing.backoff.isExhausted());
            // the initial socket and one attempt per backoff delay
            assertEquals(4, failing.opens);
            
            assertTrue(healthy.isOperational());
            assertEquals(1, healthy.opens);
        } finally
        {
            failing.close();
            healthy.close();
        }
    }
    
    
    @Test
    public void testIPv6ProcessorIgnoresIPv4Senders()
    throws Exception
    {
        ScriptedProcessor processor = new ScriptedProcessor(IPv6_GROUP, new Backoff(1, 10, 5));
        RecordingListener listener = new RecordingListener();
        processor.setListener(listener);
        processor.script.add(datagram(new byte[] {4}, "192.168.1.20"));
        processor.script.add(datagram(new byte[] {6}, "fe80::1"));
        try
        {
            processor.start();
            
            Packet packet = listener.packets.poll(5, TimeUnit.SECONDS);
            assertNotNull(packet);
            assertArrayEquals(new byte[] {6}, packet.getData());
            assertNull(listener.packets.poll(100, TimeUnit.MILLISECONDS));
        } finally
        {
            processor.close();
        }
    }
    
    
    @Test
    public void testAcceptsOwnAddressFamily()
    throws Exception
    {
        ScriptedProcessor ipv4 = new ScriptedProcessor(IPv4_GROUP, new Backoff(1, 10, 5));
        ScriptedProcessor ipv6 = new ScriptedProcessor(IPv6_GROUP, new Backoff(1, 10, 5));
        try
        {
            InetAddress v4 = InetAddress.getByName("192.168.1.20");
            InetAddress v6 = InetAddress.getByName("fe80::1");
            assertTrue(ipv4.accepts(v4));
            assertFalse(ipv4.accepts(v6));
            assertTrue(ipv6.accepts(v6));
            assertFalse(ipv6.accepts(v4));
            assertEquals(DatagramProcessor.DEFAULT_TTL, ipv4.getTTL());
        } finally
        {
            ipv4.close();
            ipv6.close();
        }
    }
    
    
    private static DatagramPacket datagram(final byte[] data, final String sender)
    throws Exception
    {
        return new DatagramPacket(data, data.length, new InetSocketAddress(InetAddress.getByName(sender), 5353));
    }
}
