package com.mlregistry.dataset.service;

import com.mlregistry.common.exception.ErrorCode;
import com.mlregistry.common.exception.RequestValidationException;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Validates broker addresses as IPv4 or IPv6 literals.
 * Host names are rejected and no DNS lookup is ever made.
 */
final class BrokerAddressValidator {

    private static final Pattern IPV4 = Pattern.compile(
            "^((25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)$");

    // InetAddress only parses input starting with a hex digit or ':' as a literal
    private static final Pattern IPV6_CHARS = Pattern.compile("^[0-9a-fA-F:][0-9a-fA-F:.]*$");

    private BrokerAddressValidator() {
    }

    /**
     * @return the trimmed literal, lower-cased for IPv6
     * @throws RequestValidationException when the value is not an IP literal
     */
    static String validateAddress(String address) {
        if (address == null || address.isBlank()) {
            throw invalidAddress(address);
        }
        String candidate = address.trim();
        if (IPV4.matcher(candidate).matches()) {
            return candidate;
        }
        if (candidate.indexOf(':') < 0 || !IPV6_CHARS.matcher(candidate).matches()) {
            throw invalidAddress(address);
        }
        try {
            // a literal containing ':' is parsed, never resolved
            InetAddress.getByName(candidate);
            return candidate.toLowerCase(Locale.ROOT);
        } catch (UnknownHostException e) {
            throw invalidAddress(address);
        }
    }

    static int validatePort(Integer port) {
        if (port == null || port <= 0) {
            throw new RequestValidationException(ErrorCode.INVALID_BROKER_PORT,
                    "Invalid broker port " + port + ": must be greater than 0");
        }
        return port;
    }

    private static RequestValidationException invalidAddress(String address) {
        return new RequestValidationException(ErrorCode.INVALID_BROKER_ADDRESS,
                "Invalid IP address format: " + address);
    }
}
