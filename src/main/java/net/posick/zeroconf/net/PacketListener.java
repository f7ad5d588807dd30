package net.posick.zeroconf.net;

/**
 * Receives the datagrams read by a {@link NetworkProcessor}.
 */
public interface PacketListener
{
    public void packetReceived(Packet packet);
}
