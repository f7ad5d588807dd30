package net.posick.zeroconf;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.xbill.DNS.Header;
import org.xbill.DNS.Message;

import net.posick.zeroconf.net.DatagramProcessor;
import net.posick.zeroconf.net.NetworkProcessor;
import net.posick.zeroconf.net.Packet;
import net.posick.zeroconf.net.PacketListener;
import net.posick.zeroconf.utils.Misc;

/**
 * The responder engine for one multicast group. The processor's read thread decodes each datagram
 * and hands it through a bounded queue to the connector's dispatch thread, which answers questions
 * from the zone and stores the answers of responses in the zone. Sending a response therefore never
 * delays the next read.
 * <p>
 * Malformed datagrams and responses that cannot be encoded are logged, counted and dropped.
 */
public class Connector implements PacketListener, Closeable
{
    protected static final Logger logger = Misc.getLogger(Connector.class.getName(), Misc.isVerbose("zeroconf_network_verbose", "zeroconf_verbose"));

    public static final int DEFAULT_QUEUE_SIZE = 32;


    /**
     * A decoded message waiting to be dispatched.
     */
    protected static class Incoming
    {
        protected final Message message;

        protected final InetSocketAddress source;

        protected final long receivedAt;


        protected Incoming(final Message message, final InetSocketAddress source, final long receivedAt)
        {
            this.message = message;
            this.source = source;
            this.receivedAt = receivedAt;
        }
    }

    private static final Incoming STOP = new Incoming(null, null, 0);

    private final Responder responder;

    private final NetworkProcessor processor;

    private final BlockingQueue<Incoming> queue;

    private Thread dispatchThread;

    private volatile boolean exit = false;

    private final AtomicLong received = new AtomicLong();

    private final AtomicLong decodeFailures = new AtomicLong();

    private final AtomicLong dropped = new AtomicLong();

    private final AtomicLong questionsAnswered = new AtomicLong();

    private final AtomicLong recordsIngested = new AtomicLong();

    private final AtomicLong encodeFailures = new AtomicLong();

    private final AtomicLong sendFailures = new AtomicLong();


    public Connector(final Zone zone, final NetworkProcessor processor)
    {
        this(zone, processor, Misc.intOption("zeroconf_connector_queue_size", DEFAULT_QUEUE_SIZE));
    }


    /**
     * @param zone The zone questions are answered from and answers are stored in
     * @param processor The network endpoint of the group
     * @param queueSize The capacity of the queue between the read and dispatch threads
     */
    public Connector(final Zone zone, final NetworkProcessor processor, final int queueSize)
    {
        if (processor == null)
        {
            throw new IllegalArgumentException("A connector requires a network processor.");
        }
        responder = new Responder(zone);
        this.processor = processor;
        queue = new ArrayBlockingQueue<Incoming>(queueSize);
        processor.setListener(this);
    }


    /**
     * Joins the multicast group and starts answering questions from the zone.
     *
     * @param zone The zone
     * @param group The multicast group address and port
     * @return The started connector
     * @throws IOException if the socket cannot be bound or the group cannot be joined
     */
    public static Connector open(final Zone zone, final InetSocketAddress group)
    throws IOException
    {
        Connector connector = new Connector(zone, new DatagramProcessor(group.getAddress(), group.getPort()));
        connector.start();
        return connector;
    }


    public void close()
    throws IOException
    {
        if (!exit)
        {
            exit = true;
            queue.clear();
            if (!queue.offer(STOP) && (dispatchThread != null))
            {
                dispatchThread.interrupt();
            }
            processor.close();
            logger.logp(Level.INFO, getClass().getName(), "close", "Closed connector for \"" + processor.getAddress().getHostAddress() + "\" [received: " + received.get() + ", decode failures: " + decodeFailures.get() + ", dropped: " + dropped.get() + ", questions answered: " + questionsAnswered.get() + ", records ingested: " + recordsIngested.get() + ", encode failures: " + encodeFailures.get() + ", send failures: " + sendFailures.get() + "]");
        }
    }


    public long getDecodeFailures()
    {
        return decodeFailures.get();
    }


    public long getDropped()
    {
        return dropped.get();
    }


    public long getEncodeFailures()
    {
        return encodeFailures.get();
    }


    public long getQuestionsAnswered()
    {
        return questionsAnswered.get();
    }


    public long getReceived()
    {
        return received.get();
    }


    public long getRecordsIngested()
    {
        return recordsIngested.get();
    }


    public long getSendFailures()
    {
        return sendFailures.get();
    }


    public boolean isOperational()
    {
        return !exit && processor.isOperational() && (dispatchThread != null) && dispatchThread.isAlive();
    }


    /**
     * Decodes a datagram on the read thread and queues it for dispatch.
     */
    public void packetReceived(final Packet packet)
    {
        received.incrementAndGet();

        Message message;
        try
        {
            message = new Message(packet.getData());
        } catch (IOException e)
        {
            decodeFailures.incrementAndGet();
            logger.log(Level.WARNING, "Error parsing mDNS " + packet + " - " + e.getMessage());
            return;
        }

        if (!queue.offer(new Incoming(message, packet.getSocketAddress(), packet.getReceivedAt())))
        {
            dropped.incrementAndGet();
            logger.log(Level.WARNING, "Dispatch queue for \"" + processor.getAddress().getHostAddress() + "\" is full [size: " + queue.size() + "], dropped " + packet);
        }
    }


    public void start()
    {
        exit = false;

        Thread t = Misc.daemonThreadFactory(processor.getAddress().getHostAddress() + " Dispatch Thread").newThread(new Runnable()
        {
            public void run()
            {
                dispatchMessages();
            }
        });
        t.start();
        dispatchThread = t;

        processor.start();
    }


    /**
     * Handles one decoded message: answers it if it is a question, otherwise stores its answers.
     *
     * @param message The message
     * @param source The sender
     * @param receivedAt The time the message was received
     */
    protected void dispatch(final Message message, final InetSocketAddress source, final long receivedAt)
    {
        if (Responder.isQuestion(message))
        {
            Message response = responder.respond(message);
            if (response != null)
            {
                if (send(response, source))
                {
                    questionsAnswered.incrementAndGet();
                }
            }
        } else
        {
            recordsIngested.addAndGet(responder.ingest(message, source, receivedAt));
        }
    }


    /**
     * Encodes and sends a response over the group's socket.
     *
     * @param response The response
     * @param target The destination
     * @return true if the response was sent
     */
    protected boolean send(final Message response, final InetSocketAddress target)
    {
        byte[] data;
        try
        {
            data = response.toWire();
        } catch (RuntimeException e)
        {
            encodeFailures.incrementAndGet();
            logger.log(Level.WARNING, "Error encoding response to \"" + target + "\" - " + e.getMessage(), e);
            return false;
        }

        try
        {
            processor.send(data, target);
            if (logger.isLoggable(Level.FINE))
            {
                logger.logp(Level.FINE, getClass().getName(), "send", "Sent response to \"" + target + "\"\n" + response);
            }
            return true;
        } catch (IOException e)
        {
            sendFailures.incrementAndGet();
            logger.log(Level.WARNING, e.getMessage(), e);
            return false;
        }
    }


    private void dispatchMessages()
    {
        while (!exit)
        {
            Incoming incoming;
            try
            {
                incoming = queue.take();
            } catch (InterruptedException e)
            {
                logger.logp(Level.FINE, getClass().getName(), "dispatchMessages", "Dispatch thread interrupted.");
                break;
            }

            if (incoming == STOP)
            {
                break;
            }

            try
            {
                if (logger.isLoggable(Level.FINE))
                {
                    Header header = incoming.message.getHeader();
                    logger.logp(Level.FINE, getClass().getName(), "dispatchMessages", "-----> Dispatching message " + header.getID() + " from \"" + incoming.source + "\" <-----");
                }
                dispatch(incoming.message, incoming.source, incoming.receivedAt);
            } catch (ZoneException e)
            {
                logger.log(Level.WARNING, "Zone unavailable, stopping connector for \"" + processor.getAddress().getHostAddress() + "\" - " + e.getMessage(), e);
                Misc.close(this);
            } catch (RuntimeException e)
            {
                logger.log(Level.WARNING, "Error dispatching message from \"" + incoming.source + "\" - " + e.getMessage(), e);
            }
        }
    }
}
