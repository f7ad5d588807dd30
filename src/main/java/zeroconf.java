import java.io.IOException;
import java.net.InetAddress;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.xbill.DNS.DClass;
import org.xbill.DNS.Name;
import org.xbill.DNS.PTRRecord;
import org.xbill.DNS.Record;
import org.xbill.DNS.Type;

import net.posick.zeroconf.Entry;
import net.posick.zeroconf.Host;
import net.posick.zeroconf.LocalZone;
import net.posick.zeroconf.Protocol;
import net.posick.zeroconf.Service;
import net.posick.zeroconf.ServiceType;
import net.posick.zeroconf.ServiceTypeRegistry;
import net.posick.zeroconf.Subscription;
import net.posick.zeroconf.ZeroconfService;

public class zeroconf
{
    private static final String VERSION = "zeroconf: 1.0.0";
    
    private static final long DEFAULT_LISTEN_TIME = 3000;
    
    private static final String COMMAND_LINE =
    "------------------------------------------------------------------------------------------\n" +
    "| Command Line: zeroconf <option> [parameters]                                           |\n" +
    "------------------------------------------------------------------------------------------\n" +
    "zeroconf -R <Host> <Type> <Protocol> <Domain> <Port> <Address>... [<key=value>...] (Publish)\n" +
    "zeroconf -B <Type> <Protocol> [<Domain>]              (Browse for service instances)\n" +
    "zeroconf -Q <Name> <rrtype>                    (Query records learned from the network)\n" +
    "zeroconf -T                                          (List the well-known service types)\n" +
    "zeroconf -V                                                              (Print version)\n" +
    "------------------------------------------------------------------------------------------";
    
    
    protected zeroconf()
    {
    }
    
    
    public static void main(final String[] args)
    throws Exception
    {
        if (args.length == 0)
        {
            System.out.println(COMMAND_LINE);
            return;
        }
        
        String temp = args[0];
        if ((temp == null) || !temp.startsWith("-") || (temp.length() < 2))
        {
            System.out.println(COMMAND_LINE);
            return;
        }
        
        char option = temp.charAt(temp.length() - 1);
        switch (option)
        {
            case 'R':
                register(args);
                break;
            case 'B':
                browse(args);
                break;
            case 'Q':
                query(args);
                break;
            case 'T':
                for (Map.Entry<String, ServiceType> type : ServiceTypeRegistry.getDefault().getTypes().entrySet())
                {
                    System.out.printf("\t%-15s %s\n", type.getKey(), type.getValue());
                }
                break;
            case 'V':
                System.out.println(VERSION);
                break;
            default:
                System.out.println(COMMAND_LINE);
                break;
        }
    }
    
    
    private static void register(final String[] args)
    throws Exception
    {
        if (args.length < 7)
        {
            System.out.println(COMMAND_LINE);
            return;
        }
        
        List<InetAddress> addresses = new ArrayList<InetAddress>();
        Map<String, String> attributes = new LinkedHashMap<String, String>();
        for (int index = 6; index < args.length; index++ )
        {
            String arg = args[index];
            int separator = arg.indexOf('=');
            if (separator > 0)
            {
                attributes.put(arg.substring(0, separator), arg.substring(separator + 1));
            } else
            {
                addresses.add(InetAddress.getByName(arg));
            }
        }
        
        Host host = new Host(args[1], args[4], addresses.toArray(new InetAddress[addresses.size()]));
        ServiceType type = resolveType(args[2], args[3]);
        Service service = new Service(host, type, Integer.parseInt(args[5]), attributes);
        
        ZeroconfService zeroconf = start();
        try
        {
            List<Entry> entries = zeroconf.publish(service);
            System.out.println("Service Published:\n\t" + service);
            for (Entry entry : entries)
            {
                System.out.println("\t\t" + entry.getRecord());
            }
            System.out.println("Press 'q' to quit.");
            waitForQuit();
        } finally
        {
            zeroconf.close();
        }
    }
    
    
    private static void browse(final String[] args)
    throws Exception
    {
        if (args.length < 3)
        {
            System.out.println(COMMAND_LINE);
            return;
        }
        
        ServiceType type = resolveType(args[1], args[2]);
        String domain = args.length > 3 ? args[3] : LocalZone.DEFAULT_DOMAIN;
        Name typeName = Name.fromString(type + "." + (domain.endsWith(".") ? domain : domain + "."));
        
        ZeroconfService zeroconf = start();
        Subscription subscription = zeroconf.getZone().subscribe(Type.PTR);
        try
        {
            System.out.println("Browsing for \"" + typeName + "\", press Ctrl-C to quit.");
            while (true)
            {
                Entry entry = subscription.take();
                if (entry == null)
                {
                    break;
                }
                if (entry.getName().equals(typeName))
                {
                    System.out.println("Service Discovered - " + ((PTRRecord) entry.getRecord()).getTarget() + " from " + entry.getSource());
                }
            }
        } finally
        {
            subscription.close();
            zeroconf.close();
        }
    }
    
    
    private static void query(final String[] args)
    throws Exception
    {
        if (args.length < 3)
        {
            System.out.println(COMMAND_LINE);
            return;
        }
        
        int type = Type.value(args[2]);
        if (type < 0)
        {
            System.err.println("Unknown record type \"" + args[2] + "\"");
            return;
        }
        Record question = Record.newRecord(Name.fromString(args[1], Name.root), type, DClass.IN);
        
        ZeroconfService zeroconf = start();
        try
        {
            Thread.sleep(DEFAULT_LISTEN_TIME);
            List<Entry> entries = zeroconf.getZone().query(question);
            System.out.println("Records for " + question.getName() + " " + Type.string(type) + ":");
            for (Entry entry : entries)
            {
                System.out.println("\t" + entry);
            }
        } finally
        {
            zeroconf.close();
        }
    }
    
    
    private static ServiceType resolveType(final String name, final String protocol)
    {
        ServiceType type = ServiceTypeRegistry.getDefault().lookup(name);
        Protocol p = Protocol.fromLabel(protocol);
        if ((type != null) && (type.getProtocol() == p))
        {
            return type;
        }
        return new ServiceType(name, p);
    }
    
    
    private static ZeroconfService start()
    {
        ZeroconfService zeroconf = new ZeroconfService();
        try
        {
            zeroconf.start();
        } catch (IOException e)
        {
            System.err.println("Could not start multicast service discovery - " + e.getMessage());
            zeroconf.close();
            System.exit(1);
        }
        return zeroconf;
    }
    
    
    private static void waitForQuit()
    throws IOException, InterruptedException
    {
        while (true)
        {
            int ch = System.in.read();
            if ((ch < 0) || (ch == 'q'))
            {
                break;
            }
            TimeUnit.MILLISECONDS.sleep(10);
        }
    }
}
