package net.posick.zeroconf.utils;

import static org.junit.Assert.*;

import org.junit.Test;

/**
 * Test Cases for the Backoff
 */
public class BackoffTest
{
    @Test
    public void testDelayDoublesUpToMaximum()
    {
        Backoff backoff = new Backoff(100, 500, 6);
        assertEquals(100, backoff.nextDelay());
        assertEquals(200, backoff.nextDelay());
        assertEquals(400, backoff.nextDelay());
        assertEquals(500, backoff.nextDelay());
        assertEquals(500, backoff.nextDelay());
        assertEquals(5, backoff.getAttempts());
        assertFalse(backoff.isExhausted());
    }
    
    
    @Test
    public void testExhaustedAfterMaxAttempts()
    {
        Backoff backoff = new Backoff(100, 1000, 2);
        backoff.nextDelay();
        backoff.nextDelay();
        assertTrue(backoff.isExhausted());
        
        try
        {
            backoff.nextDelay();
            fail("An exhausted backoff must not hand out delays");
        } catch (IllegalStateException e)
        {
            // expected
        }
        
        backoff.reset();
        assertFalse(backoff.isExhausted());
        assertEquals(100, backoff.nextDelay());
    }
    
    
    @Test
    public void testDefaults()
    {
        Backoff backoff = new Backoff();
        assertEquals(Backoff.DEFAULT_INITIAL_DELAY, backoff.nextDelay());
        assertEquals(Backoff.DEFAULT_INITIAL_DELAY * 2, backoff.nextDelay());
    }
    
    
    @Test(expected = IllegalArgumentException.class)
    public void testMaximumBelowInitialDelay()
    {
        new Backoff(1000, 10, 3);
    }
    
    
    @Test(expected = IllegalArgumentException.class)
    public void testNoAttempts()
    {
        new Backoff(1000, 2000, 0);
    }
}
