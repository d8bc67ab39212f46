package com.raditha.cildiff.model;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

/**
 * An IP address literal.
 *
 * @param name    declared name, or null when anonymous
 * @param address the textual address as written
 */
public record IpAddr(String name, String address) implements CilData {

    private static final Pattern IPV4 = Pattern.compile("\\d{1,3}(\\.\\d{1,3}){3}");
    private static final Pattern IPV6 = Pattern.compile("[0-9A-Fa-f:.]*:[0-9A-Fa-f:.]*");

    /**
     * The binary form of the address. Only literals are accepted so no name lookup ever happens.
     *
     * @throws PolicyModelException if the address is not an IPv4 or IPv6 literal
     */
    public byte[] toBytes() {
        if (IPV4.matcher(address).matches()) {
            for (String octet : address.split("\\.")) {
                if (Integer.parseInt(octet) > 255) {
                    throw new PolicyModelException("Invalid IP address '" + address + "'");
                }
            }
        } else if (!IPV6.matcher(address).matches()) {
            throw new PolicyModelException("Invalid IP address '" + address + "'");
        }
        try {
            return InetAddress.getByName(address).getAddress();
        } catch (UnknownHostException e) {
            throw new PolicyModelException("Invalid IP address '" + address + "'", e);
        }
    }

    @Override
    public <R> R accept(CilDataVisitor<R> visitor, CilFlavor flavor) {
        return visitor.visit(this, flavor);
    }
}
