package net.posick.zeroconf;

import static org.junit.Assert.*;

import org.junit.Before;
import org.junit.Test;

/**
 * Test Cases for the ServiceTypeRegistry
 */
public class ServiceTypeRegistryTest
{
    private ServiceTypeRegistry registry;
    
    
    @Before
    public void setUp()
    throws Exception
    {
        registry = new ServiceTypeRegistry();
    }
    
    
    @Test
    public void testSeededWithWellKnownTypes()
    {
        ServiceType ssh = registry.lookup("ssh");
        assertNotNull(ssh);
        assertEquals("_ssh", ssh.getName());
        assertEquals(Protocol.TCP, ssh.getProtocol());
        
        assertEquals(Protocol.UDP, registry.lookup("nfs").getProtocol());
        assertTrue(registry.contains("http"));
        assertNotNull(ServiceTypeRegistry.getDefault().lookup("ssh"));
    }
    
    
    @Test
    public void testLookupIgnoresCaseAndUnderscore()
    {
        assertEquals(registry.lookup("ssh"), registry.lookup("_SSH"));
        assertNull(registry.lookup("does-not-exist"));
    }
    
    
    @Test
    public void testRegisterCustomType()
    {
        ServiceType type = new ServiceType("mytool", Protocol.UDP);
        assertNull(registry.register("mytool", type));
        assertEquals(type, registry.lookup("_mytool"));
        assertEquals("_mytool", registry.lookup("mytool").getName());
        
        ServiceType replacement = new ServiceType("_mytool", Protocol.TCP);
        assertEquals(type, registry.register("mytool", replacement));
        assertEquals(Protocol.TCP, registry.lookup("mytool").getProtocol());
        
        assertEquals(replacement, registry.unregister("mytool"));
        assertFalse(registry.contains("mytool"));
    }
    
    
    @Test
    public void testUnseededRegistryIsEmpty()
    {
        ServiceTypeRegistry empty = new ServiceTypeRegistry(false);
        assertTrue(empty.getTypes().isEmpty());
        assertNull(empty.lookup("ssh"));
    }
    
    
    @Test(expected = UnsupportedOperationException.class)
    public void testTypesSnapshotIsReadOnly()
    {
        registry.getTypes().clear();
    }
}
