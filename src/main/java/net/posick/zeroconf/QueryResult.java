package net.posick.zeroconf;

import java.util.Collections;
import java.util.List;

/**
 * The result of {@link Zone#queryAdditional(org.xbill.DNS.Record)}: the entries answering the
 * question and the additional entries a response should carry with them.
 */
public class QueryResult
{
    private final List<Entry> answers;
    
    private final List<Entry> additionals;
    
    
    public QueryResult(final List<Entry> answers, final List<Entry> additionals)
    {
        this.answers = answers == null ? Collections.<Entry>emptyList() : Collections.unmodifiableList(answers);
        this.additionals = additionals == null ? Collections.<Entry>emptyList() : Collections.unmodifiableList(additionals);
    }
    
    
    public List<Entry> getAdditionals()
    {
        return additionals;
    }
    
    
    public List<Entry> getAnswers()
    {
        return answers;
    }
    
    
    public boolean isEmpty()
    {
        return answers.isEmpty();
    }
    
    
    @Override
    public String toString()
    {
        return "[answers: " + answers + ", additionals: " + additionals + "]";
    }
}
