package com.trawler.util;

import java.util.Locale;
import java.util.regex.Pattern;

public class AddressUtil {

    public static final Pattern IPV4 = Pattern.compile(
            "^(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)(\\.(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)){3}$");

    /** ip:port pair anywhere inside a line of text */
    public static final Pattern IP_PORT = Pattern.compile(
            "(?<![\\d.])(\\d{1,3}(?:\\.\\d{1,3}){3}):(\\d{1,5})(?!\\d)");

    private static final Pattern COUNTRY_CODE = Pattern.compile("^[A-Z]{2}$");

    public static boolean isIpv4(String value) {
        return value != null && IPV4.matcher(value.trim()).matches();
    }

    /**
     * @return port in 1..65535 or -1 when the value is not a usable port
     */
    public static int parsePort(String value) {
        if (value == null) {
            return -1;
        }
        try {
            int port = Integer.parseInt(value.trim());
            return port >= 1 && port <= 65535 ? port : -1;
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    public static boolean isCountryCode(String token) {
        return token != null && COUNTRY_CODE.matcher(token).matches();
    }

    public static String normalizeCountry(String country) {
        return country == null ? "" : country.trim().toUpperCase(Locale.ROOT);
    }
}
