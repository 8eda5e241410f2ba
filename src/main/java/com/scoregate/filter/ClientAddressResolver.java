package com.scoregate.filter;

import java.util.regex.Pattern;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Resolves the caller's network address. Behind a reverse proxy the first
 * {@code X-Forwarded-For} entry wins, then {@code X-Real-IP}, then the socket peer.
 * Header values that are not IP literals are ignored.
 */
@Component
public class ClientAddressResolver {
    public static final int MAX_ADDRESS_LENGTH = 45;

    private static final Pattern IPV4 = Pattern.compile(
            "(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)(\\.(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)){3}");
    private static final Pattern IPV6 = Pattern.compile("[0-9a-fA-F:.]+");

    @Value("${scoregate.proxy.trust-forwarded-headers:true}")
    private boolean trustForwardedHeaders = true;

    void setTrustForwardedHeaders(boolean trustForwardedHeaders) {
        this.trustForwardedHeaders = trustForwardedHeaders;
    }

    public String resolve(HttpServletRequest request) {
        if (trustForwardedHeaders) {
            String forwardedFor = request.getHeader("X-Forwarded-For");
            if (forwardedFor != null) {
                String first = forwardedFor.split(",")[0].trim();
                if (isIpLiteral(first)) {
                    return first;
                }
            }
            String realIp = request.getHeader("X-Real-IP");
            if (realIp != null && isIpLiteral(realIp.trim())) {
                return realIp.trim();
            }
        }
        return request.getRemoteAddr();
    }

    static boolean isIpLiteral(String value) {
        if (value.isEmpty() || value.length() > MAX_ADDRESS_LENGTH) {
            return false;
        }
        if (IPV4.matcher(value).matches()) {
            return true;
        }
        return value.indexOf(':') >= 0 && IPV6.matcher(value).matches();
    }
}
