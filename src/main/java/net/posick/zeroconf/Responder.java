package net.posick.zeroconf;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.xbill.DNS.Flags;
import org.xbill.DNS.Message;
import org.xbill.DNS.Record;
import org.xbill.DNS.Section;

import net.posick.zeroconf.utils.Misc;

/**
 * Decides how a multicast DNS message is handled against a {@link Zone}. Questions are answered
 * from the zone's publishable entries, and the answers of responses are stored in the zone as
 * learned entries.
 */
public class Responder
{
    private static final Logger logger = Misc.getLogger(Responder.class.getName(), Misc.isVerbose("zeroconf_verbose"));
    
    private final Zone zone;
    
    
    public Responder(final Zone zone)
    {
        if (zone == null)
        {
            throw new IllegalArgumentException("A responder requires a zone.");
        }
        this.zone = zone;
    }
    
    
    public Zone getZone()
    {
        return zone;
    }
    
    
    /**
     * Returns true if the message is a question, a message without the QR flag.
     * 
     * @param message The message
     * @return true if the message is a question
     */
    public static boolean isQuestion(final Message message)
    {
        return !message.getHeader().getFlag(Flags.QR);
    }
    
    
    /**
     * Builds the response to a query. Every question is resolved through
     * {@link Zone#queryAdditional(Record)} and only publishable entries are kept. No response is
     * built if nothing answers the questions.
     * 
     * @param query The query
     * @return The response, or null if there is nothing to answer
     */
    public Message respond(final Message query)
    {
        List<Record> answers = new ArrayList<Record>();
        List<Record> additionals = new ArrayList<Record>();
        
        for (Record question : query.getSectionArray(Section.QUESTION))
        {
            QueryResult result = zone.queryAdditional(question);
            for (Entry entry : result.getAnswers())
            {
                if (entry.isPublish() && !answers.contains(entry.getRecord()))
                {
                    answers.add(entry.getRecord());
                }
            }
            for (Entry entry : result.getAdditionals())
            {
                if (entry.isPublish() && !additionals.contains(entry.getRecord()))
                {
                    additionals.add(entry.getRecord());
                }
            }
        }
        
        if (answers.isEmpty())
        {
            if (logger.isLoggable(Level.FINE))
            {
                logger.logp(Level.FINE, getClass().getName(), "respond", "No answers for query " + query.getHeader().getID());
            }
            return null;
        }
        
        // Records already in the answer section are not repeated as additionals
        additionals.removeAll(answers);
        
        Message response = new Message(0);
        response.getHeader().setFlag(Flags.QR);
        response.getHeader().setFlag(Flags.AA);
        for (Record record : answers)
        {
            response.addRecord(record, Section.ANSWER);
        }
        for (Record record : additionals)
        {
            response.addRecord(record, Section.ADDITIONAL);
        }
        return response;
    }
    
    
    /**
     * Stores the answer records of a response as learned entries.
     * 
     * @param response The response
     * @param source The address of the sender
     * @param receivedAt The time the response was received, in milliseconds since the epoch
     * @return The number of records handed to the zone
     */
    public int ingest(final Message response, final InetSocketAddress source, final long receivedAt)
    {
        Record[] records = response.getSectionArray(Section.ANSWER);
        for (Record record : records)
        {
            zone.add(Entry.learned(record, receivedAt, source));
        }
        if (logger.isLoggable(Level.FINE))
        {
            logger.logp(Level.FINE, getClass().getName(), "ingest", "Learned " + records.length + " records from " + source);
        }
        return records.length;
    }
}
