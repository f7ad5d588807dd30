package net.posick.zeroconf;

import static org.junit.Assert.*;

import java.net.InetAddress;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.xbill.DNS.DClass;
import org.xbill.DNS.Name;
import org.xbill.DNS.Record;
import org.xbill.DNS.SRVRecord;
import org.xbill.DNS.TXTRecord;
import org.xbill.DNS.Type;

/**
 * Test Cases for the Publisher
 */
public class PublisherTest
{
    private LocalZone zone;
    
    
    @Before
    public void setUp()
    throws Exception
    {
        zone = new LocalZone(16, 0);
    }
    
    
    @After
    public void tearDown()
    throws Exception
    {
        zone.close();
    }
    
    
    @Test
    public void testPublishCreatesRecordPerAddress()
    throws Exception
    {
        Host host = new Host("foo", "local.", InetAddress.getByName("192.168.1.10"), InetAddress.getByName("192.168.1.11"), InetAddress.getByName("fe80::10"));
        Service service = new Service(host, ServiceTypeRegistry.getDefault().lookup("http"), 8080);
        
        List<Entry> entries = Publisher.publish(zone, service);
        assertEquals(6, entries.size());
        assertEquals(6, zone.size());
        
        List<Entry> addresses = zone.query(question("foo.local.", Type.ANY));
        assertEquals(3, addresses.size());
        assertEquals(Type.A, addresses.get(0).getType());
        assertEquals(Type.A, addresses.get(1).getType());
        assertEquals(Type.AAAA, addresses.get(2).getType());
        
        assertEquals(1, zone.query(question("_http._tcp.local.", Type.PTR)).size());
        assertEquals(1, zone.query(question("foo._http._tcp.local.", Type.SRV)).size());
        assertEquals(1, zone.query(question("foo._http._tcp.local.", Type.TXT)).size());
        
        for (Entry entry : entries)
        {
            assertTrue(entry.isPublish());
            assertNull(entry.getSource());
            assertEquals(Publisher.DEFAULT_TTL, entry.getRecord().getTTL());
            assertEquals(DClass.IN, entry.getRecord().getDClass());
        }
    }
    
    
    @Test
    public void testPublishWithoutAddresses()
    throws Exception
    {
        Service service = new Service(new Host("bare", "local."), ServiceTypeRegistry.getDefault().lookup("ssh"), 22);
        
        List<Entry> entries = Publisher.publish(zone, service);
        assertEquals(3, entries.size());
        assertTrue(zone.query(question("bare.local.", Type.ANY)).isEmpty());
    }
    
    
    @Test
    public void testServiceRecordLocatesHost()
    throws Exception
    {
        Service service = new Service(new Host("foo", "local.", InetAddress.getByName("1.2.3.4")), ServiceTypeRegistry.getDefault().lookup("ssh"), 22);
        Publisher.publish(zone, service);
        
        SRVRecord srv = (SRVRecord) zone.query(question("foo._ssh._tcp.local.", Type.SRV)).get(0).getRecord();
        assertEquals(22, srv.getPort());
        assertEquals(0, srv.getPriority());
        assertEquals(0, srv.getWeight());
        assertEquals(Name.fromString("foo.local."), srv.getTarget());
    }
    
    
    @Test
    public void testAttributesArePublishedInTextRecord()
    throws Exception
    {
        Map<String, String> attributes = new LinkedHashMap<String, String>();
        attributes.put("path", "/index.html");
        attributes.put("secure", null);
        Service service = new Service(new Host("web", "local."), ServiceTypeRegistry.getDefault().lookup("http"), 80, attributes);
        
        List<Record> records = Publisher.buildRecords(service);
        TXTRecord txt = (TXTRecord) records.get(records.size() - 1);
        assertEquals(Arrays.asList("path=/index.html", "secure"), txt.getStrings());
    }
    
    
    @Test
    public void testEmptyAttributesPublishEmptyString()
    throws Exception
    {
        Service service = new Service(new Host("foo", "local."), ServiceTypeRegistry.getDefault().lookup("ssh"), 22);
        
        List<Record> records = Publisher.buildRecords(service);
        TXTRecord txt = (TXTRecord) records.get(records.size() - 1);
        assertEquals(Arrays.asList(""), txt.getStrings());
    }
    
    
    @Test
    public void testPortOutOfRange()
    throws Exception
    {
        Service service = new Service(new Host("foo", "local."), ServiceTypeRegistry.getDefault().lookup("ssh"), 70000);
        try
        {
            Publisher.publish(zone, service);
            fail("Port 70000 must be rejected");
        } catch (ServiceRegistrationException e)
        {
            assertEquals(ServiceRegistrationException.REASON.INVALID_PORT, e.getReason());
        }
        assertEquals(0, zone.size());
    }
    
    
    @Test
    public void testPublishRecord()
    throws Exception
    {
        Record record = new TXTRecord(Name.fromString("note.local."), DClass.IN, 120, "hello");
        Entry entry = Publisher.publishRecord(zone, record);
        
        assertTrue(entry.isPublish());
        assertSame(record, zone.query(question("note.local.", Type.TXT)).get(0).getRecord());
    }
    
    
    static Record question(final String name, final int type)
    throws Exception
    {
        return Record.newRecord(Name.fromString(name), type, DClass.IN);
    }
}
