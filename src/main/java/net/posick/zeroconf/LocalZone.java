package net.posick.zeroconf;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.xbill.DNS.Name;
import org.xbill.DNS.PTRRecord;
import org.xbill.DNS.Record;
import org.xbill.DNS.SRVRecord;
import org.xbill.DNS.Type;

import net.posick.zeroconf.utils.Misc;

/**
 * The zone for the local domain. All requests are handed to a single worker thread through a
 * bounded mailbox and processed one at a time, so the worker is the only thread that ever reads or
 * modifies the stored entries and the subscription list.
 * <p>
 * Records learned from the network expire; a sweeper periodically asks the worker to remove the
 * learned entries whose expiry time has passed. Published entries remain until the zone is closed.
 */
public class LocalZone implements Zone
{
    protected static final Logger logger = Misc.getLogger(LocalZone.class.getName(), Misc.isVerbose("zeroconf_zone_verbose", "zeroconf_verbose"));

    public static final String DEFAULT_DOMAIN = "local.";

    public static final int DEFAULT_QUEUE_SIZE = 16;

    /** Seconds between sweeps of expired entries */
    public static final long DEFAULT_SWEEP_INTERVAL = 10;


    /**
     * A request processed by the zone worker.
     */
    protected abstract class Request
    {
        protected abstract void process();


        /**
         * Called instead of {@link #process()} if the zone stops before the request is processed,
         * or if processing failed. Must release anyone waiting on the request.
         */
        protected void abort()
        {
        }
    }


    /**
     * A count computed by the worker and handed to the caller waiting for it.
     */
    protected static class Reply
    {
        private boolean done = false;

        private int value;

        private ZoneException failure;


        protected synchronized void set(final int value)
        {
            this.value = value;
            done = true;
            notifyAll();
        }


        protected synchronized void fail(final ZoneException failure)
        {
            this.failure = failure;
            done = true;
            notifyAll();
        }


        /**
         * Waits for the worker to answer.
         *
         * @return The count
         * @throws ZoneException if the request was aborted or the caller is interrupted
         */
        protected synchronized int get()
        {
            while (!done)
            {
                try
                {
                    wait();
                } catch (InterruptedException e)
                {
                    Thread.currentThread().interrupt();
                    throw new ZoneException("Interrupted while waiting for the zone.", e);
                }
            }
            if (failure != null)
            {
                throw new ZoneException(failure.getMessage(), failure);
            }
            return value;
        }
    }


    protected class AddRequest extends Request
    {
        private final Entry entry;


        protected AddRequest(final Entry entry)
        {
            this.entry = entry;
        }


        @Override
        protected void process()
        {
            doAdd(entry);
        }


        @Override
        protected void abort()
        {
            logger.logp(Level.FINE, getClass().getName(), "abort", "Zone closed, entry not added - " + entry);
        }


        @Override
        public String toString()
        {
            return "Add " + entry;
        }
    }


    protected class QueryRequest extends Request
    {
        private final Query query;


        protected QueryRequest(final Query query)
        {
            this.query = query;
        }


        @Override
        protected void process()
        {
            for (Entry entry : doQuery(query))
            {
                query.getSink().deliver(entry);
            }
            query.getSink().close();
        }


        @Override
        protected void abort()
        {
            query.getSink().abort();
        }


        @Override
        public String toString()
        {
            return "Query " + query;
        }
    }


    protected class QueryAdditionalRequest extends Request
    {
        private final Query query;

        private final EntrySink additionalSink;


        protected QueryAdditionalRequest(final Query query, final EntrySink additionalSink)
        {
            this.query = query;
            this.additionalSink = additionalSink;
        }


        @Override
        protected void process()
        {
            List<Entry> answers = doQuery(query);
            List<Entry> additionals = doFindAdditionals(answers);
            for (Entry entry : answers)
            {
                query.getSink().deliver(entry);
            }
            for (Entry entry : additionals)
            {
                additionalSink.deliver(entry);
            }
            query.getSink().close();
            additionalSink.close();
        }


        @Override
        protected void abort()
        {
            query.getSink().abort();
            additionalSink.abort();
        }


        @Override
        public String toString()
        {
            return "Query Additional " + query;
        }
    }


    protected class SubscribeRequest extends Request
    {
        private final Query query;


        protected SubscribeRequest(final Query query)
        {
            this.query = query;
        }


        @Override
        protected void process()
        {
            if (!query.getSink().isClosed())
            {
                subscriptions.add(query);
            }
        }


        @Override
        protected void abort()
        {
            query.getSink().close();
        }


        @Override
        public String toString()
        {
            return "Subscribe " + query;
        }
    }


    protected class UnsubscribeRequest extends Request
    {
        private final Query query;


        protected UnsubscribeRequest(final Query query)
        {
            this.query = query;
        }


        @Override
        protected void process()
        {
            subscriptions.remove(query);
            query.getSink().close();
        }


        @Override
        protected void abort()
        {
            query.getSink().close();
        }


        @Override
        public String toString()
        {
            return "Unsubscribe " + query;
        }
    }


    protected class ExpireRequest extends Request
    {
        private final long now;

        private final Reply result;


        protected ExpireRequest(final long now, final Reply result)
        {
            this.now = now;
            this.result = result;
        }


        @Override
        protected void process()
        {
            int removed = doExpire(now);
            if (result != null)
            {
                result.set(removed);
            }
        }


        @Override
        protected void abort()
        {
            if (result != null)
            {
                result.fail(new ZoneException("Zone is closed."));
            }
        }


        @Override
        public String toString()
        {
            return "Expire " + now;
        }
    }


    protected class SizeRequest extends Request
    {
        private final Reply result;


        protected SizeRequest(final Reply result)
        {
            this.result = result;
        }


        @Override
        protected void process()
        {
            int size = 0;
            for (List<Entry> list : entries.values())
            {
                size += list.size();
            }
            result.set(size);
        }


        @Override
        protected void abort()
        {
            result.fail(new ZoneException("Zone is closed."));
        }


        @Override
        public String toString()
        {
            return "Size";
        }
    }


    protected class CloseRequest extends Request
    {
        @Override
        protected void process()
        {
            exit = true;
        }


        @Override
        public String toString()
        {
            return "Close";
        }
    }

    // Owned by the worker thread
    private final Map<Name, List<Entry>> entries = new LinkedHashMap<Name, List<Entry>>();

    // Owned by the worker thread
    private final List<Query> subscriptions = new ArrayList<Query>();

    private final BlockingQueue<Request> mailbox;

    private final Thread worker;

    private final ScheduledExecutorService sweeper;

    private final AtomicBoolean closed = new AtomicBoolean(false);

    private final Object terminationLock = new Object();

    private boolean terminated = false;

    private volatile boolean exit = false;


    public LocalZone()
    {
        this(Misc.intOption("zeroconf_zone_queue_size", DEFAULT_QUEUE_SIZE), Misc.longOption("zeroconf_sweep_interval", DEFAULT_SWEEP_INTERVAL));
    }


    /**
     * @param queueSize The capacity of the request mailbox
     * @param sweepInterval Seconds between sweeps of expired entries, 0 to disable sweeping
     */
    public LocalZone(final int queueSize, final long sweepInterval)
    {
        mailbox = new ArrayBlockingQueue<Request>(queueSize);

        worker = Misc.daemonThreadFactory("Zone Worker").newThread(new Runnable()
        {
            public void run()
            {
                processRequests();
            }
        });
        worker.start();

        if (sweepInterval > 0)
        {
            sweeper = Executors.newSingleThreadScheduledExecutor(Misc.daemonThreadFactory("Zone Sweeper"));
            sweeper.scheduleWithFixedDelay(new Runnable()
            {
                public void run()
                {
                    if (!closed.get())
                    {
                        try
                        {
                            post(new ExpireRequest(System.currentTimeMillis(), null));
                        } catch (ZoneException e)
                        {
                            logger.log(Level.FINE, "Sweep skipped - " + e.getMessage(), e);
                        }
                    }
                }
            }, sweepInterval, sweepInterval, TimeUnit.SECONDS);
        } else
        {
            sweeper = null;
        }
    }


    public void add(final Entry entry)
    {
        if (entry == null)
        {
            throw new IllegalArgumentException("Cannot add a null entry.");
        }
        post(new AddRequest(entry));
    }


    public void close()
    {
        if (closed.compareAndSet(false, true))
        {
            if (sweeper != null)
            {
                sweeper.shutdownNow();
            }

            if (!mailbox.offer(new CloseRequest()))
            {
                exit = true;
                worker.interrupt();
            }

            if (Thread.currentThread() != worker)
            {
                try
                {
                    worker.join(TimeUnit.SECONDS.toMillis(5));
                } catch (InterruptedException e)
                {
                    Thread.currentThread().interrupt();
                }
            }
            logger.logp(Level.FINE, getClass().getName(), "close", "Zone closed.");
        }
    }


    /**
     * Removes the learned entries that expired at or before the time. Published entries are never
     * removed.
     *
     * @param now The time, in milliseconds since the epoch
     * @return The number of entries removed
     * @throws ZoneException if the zone is closed or the caller is interrupted
     */
    public int expire(final long now)
    {
        Reply result = new Reply();
        post(new ExpireRequest(now, result));
        return result.get();
    }


    public boolean isClosed()
    {
        return closed.get();
    }


    public List<Entry> query(final Record question)
    {
        EntrySink sink = new EntrySink();
        post(new QueryRequest(new Query(question, sink)));
        return drain(sink);
    }


    public QueryResult queryAdditional(final Record question)
    {
        EntrySink sink = new EntrySink();
        EntrySink additionalSink = new EntrySink();
        post(new QueryAdditionalRequest(new Query(question, sink), additionalSink));
        List<Entry> answers = drain(sink);
        return new QueryResult(answers, drain(additionalSink));
    }


    /**
     * Returns the number of stored entries.
     *
     * @return The number of stored entries
     */
    public int size()
    {
        Reply result = new Reply();
        post(new SizeRequest(result));
        return result.get();
    }


    public Subscription subscribe(final int type)
    {
        Subscription subscription = new Subscription(this, new Query(type, new EntrySink()));
        post(new SubscribeRequest(subscription.getQuery()));
        return subscription;
    }


    public void unsubscribe(final Subscription subscription)
    {
        if (closed.get())
        {
            // the worker closes every subscription when it stops
            return;
        }
        try
        {
            post(new UnsubscribeRequest(subscription.getQuery()));
        } catch (ZoneException e)
        {
            logger.log(Level.FINE, "Unsubscribe of " + subscription.getQuery() + " not delivered - " + e.getMessage(), e);
        }
    }


    /**
     * Hands a request to the worker, blocking while the mailbox is full.
     *
     * @param request The request
     * @throws ZoneException if the zone is closed or the caller is interrupted
     */
    protected void post(final Request request)
    {
        if (closed.get())
        {
            throw new ZoneException("Zone is closed.");
        }

        try
        {
            mailbox.put(request);
        } catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            throw new ZoneException("Interrupted while handing \"" + request + "\" to the zone.", e);
        }

        synchronized (terminationLock)
        {
            // The worker stopped after this request was queued, so nobody will process it
            if (terminated && mailbox.remove(request))
            {
                request.abort();
            }
        }
    }


    private void processRequests()
    {
        logger.logp(Level.FINE, getClass().getName(), "processRequests", "Zone worker started.");
        try
        {
            while (!exit)
            {
                Request request = mailbox.take();
                try
                {
                    request.process();
                } catch (RuntimeException e)
                {
                    logger.log(Level.WARNING, "Error processing zone request \"" + request + "\" - " + e.getMessage(), e);
                    request.abort();
                }
            }
        } catch (InterruptedException e)
        {
            logger.logp(Level.FINE, getClass().getName(), "processRequests", "Zone worker interrupted.");
        } finally
        {
            for (Query subscription : subscriptions)
            {
                subscription.getSink().close();
            }
            subscriptions.clear();

            synchronized (terminationLock)
            {
                terminated = true;
                Request request;
                while ((request = mailbox.poll()) != null)
                {
                    request.abort();
                }
            }
            logger.logp(Level.FINE, getClass().getName(), "processRequests", "Zone worker stopped.");
        }
    }


    // ----- Worker thread only -----

    private void doAdd(final Entry entry)
    {
        Name name = entry.getName();
        List<Entry> list = entries.get(name);
        if (list == null)
        {
            list = new ArrayList<Entry>();
            entries.put(name, list);
        }

        for (int index = 0; index < list.size(); index++ )
        {
            Entry existing = list.get(index);
            if (RecordMatcher.isSameRecord(existing, entry))
            {
                if (entry.isPublish() && !existing.isPublish())
                {
                    // a local publication takes over a record previously learned from the network
                    list.set(index, entry);
                } else if (!entry.isPublish() && !existing.isPublish() && (entry.getExpires() > existing.getExpires()))
                {
                    // re-announced, extend the lifetime
                    list.set(index, entry);
                }
                if (logger.isLoggable(Level.FINE))
                {
                    logger.logp(Level.FINE, getClass().getName(), "doAdd", "Duplicate record " + entry.getRecord());
                }
                return;
            }
        }

        list.add(entry);
        if (logger.isLoggable(Level.FINE))
        {
            logger.logp(Level.FINE, getClass().getName(), "doAdd", "Added " + entry);
        }

        for (Query subscription : subscriptions)
        {
            if (RecordMatcher.matches(subscription, entry))
            {
                subscription.getSink().deliver(entry);
            }
        }
    }


    private int doExpire(final long now)
    {
        int removed = 0;
        for (Iterator<List<Entry>> lists = entries.values().iterator(); lists.hasNext();)
        {
            List<Entry> list = lists.next();
            for (Iterator<Entry> i = list.iterator(); i.hasNext();)
            {
                Entry entry = i.next();
                if (!entry.isPublish() && entry.isExpired(now))
                {
                    i.remove();
                    removed++ ;
                }
            }
            if (list.isEmpty())
            {
                lists.remove();
            }
        }
        if ((removed > 0) && logger.isLoggable(Level.FINE))
        {
            logger.logp(Level.FINE, getClass().getName(), "doExpire", "Removed " + removed + " expired entries.");
        }
        return removed;
    }


    /*
     * PTR answers pull in the SRV and TXT records of the instance they point to, and every SRV
     * record pulls in the address records of its target.
     */
    private List<Entry> doFindAdditionals(final List<Entry> answers)
    {
        List<Entry> additionals = new ArrayList<Entry>();
        for (Entry answer : answers)
        {
            if (answer.getRecord() instanceof PTRRecord)
            {
                Name instance = ((PTRRecord) answer.getRecord()).getTarget();
                for (Entry entry : lookup(instance))
                {
                    if ((entry.getType() == Type.SRV) || (entry.getType() == Type.TXT))
                    {
                        addAdditional(answers, additionals, entry);
                    }
                }
            }
        }

        List<Entry> services = new ArrayList<Entry>(answers);
        services.addAll(additionals);
        for (Entry service : services)
        {
            if (service.getRecord() instanceof SRVRecord)
            {
                Name target = ((SRVRecord) service.getRecord()).getTarget();
                for (Entry entry : lookup(target))
                {
                    if ((entry.getType() == Type.A) || (entry.getType() == Type.AAAA))
                    {
                        addAdditional(answers, additionals, entry);
                    }
                }
            }
        }
        return additionals;
    }


    private List<Entry> doQuery(final Query query)
    {
        List<Entry> results = new ArrayList<Entry>();
        for (Entry entry : lookup(query.getName()))
        {
            if (RecordMatcher.matches(query, entry))
            {
                results.add(entry);
            }
        }
        return results;
    }


    private List<Entry> lookup(final Name name)
    {
        List<Entry> list = name == null ? null : entries.get(name);
        return list == null ? new ArrayList<Entry>() : list;
    }


    private static void addAdditional(final List<Entry> answers, final List<Entry> additionals, final Entry entry)
    {
        for (Entry answer : answers)
        {
            if (answer == entry)
            {
                return;
            }
        }
        for (Entry additional : additionals)
        {
            if (additional == entry)
            {
                return;
            }
        }
        additionals.add(entry);
    }


    // ----- Caller side -----

    private static List<Entry> drain(final EntrySink sink)
    {
        List<Entry> results;
        try
        {
            results = sink.drain();
        } catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            throw new ZoneException("Interrupted while waiting for query results.", e);
        }
        if (sink.isAborted())
        {
            throw new ZoneException("Zone is closed.");
        }
        return results;
    }
}
