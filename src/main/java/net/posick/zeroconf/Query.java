package net.posick.zeroconf;

import org.xbill.DNS.DClass;
import org.xbill.DNS.Name;
import org.xbill.DNS.Record;
import org.xbill.DNS.Type;

/**
 * A question paired with the sink its results are delivered to. A query with a name is a one-shot
 * lookup of that name; a query without a name is a subscription matching entries of any name.
 */
public class Query
{
    private final Name name;
    
    private final int type;
    
    private final int dclass;
    
    private final EntrySink sink;
    
    
    /**
     * Creates a one-shot query for the question's name and type.
     * 
     * @param question The question
     * @param sink The result sink
     */
    public Query(final Record question, final EntrySink sink)
    {
        this(question.getName(), question.getType(), question.getDClass(), sink);
    }
    
    
    /**
     * Creates a subscription query matching entries of the type, regardless of name.
     * 
     * @param type The record type or Type.ANY
     * @param sink The result sink
     */
    public Query(final int type, final EntrySink sink)
    {
        this(null, type, DClass.IN, sink);
    }
    
    
    protected Query(final Name name, final int type, final int dclass, final EntrySink sink)
    {
        if (sink == null)
        {
            throw new IllegalArgumentException("A query requires a result sink.");
        }
        Type.check(type);
        this.name = name;
        this.type = type;
        this.dclass = dclass;
        this.sink = sink;
    }
    
    
    public int getDClass()
    {
        return dclass;
    }
    
    
    /**
     * Returns the target name, or null for a subscription.
     * 
     * @return The target name
     */
    public Name getName()
    {
        return name;
    }
    
    
    public EntrySink getSink()
    {
        return sink;
    }
    
    
    public int getType()
    {
        return type;
    }
    
    
    public boolean isWildcard()
    {
        return name == null;
    }
    
    
    public boolean matches(final Entry entry)
    {
        return RecordMatcher.matches(this, entry);
    }
    
    
    @Override
    public String toString()
    {
        return (name == null ? "*" : name.toString()) + " " + DClass.string(dclass) + " " + Type.string(type);
    }
}
