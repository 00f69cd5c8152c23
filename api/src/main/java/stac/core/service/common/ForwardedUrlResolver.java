package stac.core.service.common;

import java.util.Locale;
import java.util.regex.Pattern;

import org.jboss.logging.Logger;

import stac.core.model.forwarding.ForwardedUrlParts;
import stac.core.model.forwarding.RequestScope;

/**
 * Reconstructs the externally visible scheme, host, port and path prefix of a request served
 * behind a reverse proxy.
 *
 * <p>Precedence, highest first:
 * <ol>
 *   <li>RFC 7239 {@code Forwarded} header, {@code proto=} and {@code host=} directives</li>
 *   <li>{@code X-Forwarded-Host}, {@code X-Forwarded-Proto}, {@code X-Forwarded-Port}</li>
 *   <li>the {@code Host} header</li>
 *   <li>the connection's own scheme, host and port</li>
 * </ol>
 * {@code X-Forwarded-Prefix} is returned verbatim as the path prefix in every case.
 *
 * <p>A port that does not parse as an integer never fails the request; the previously resolved
 * port is kept.
 */
public final class ForwardedUrlResolver {

    private static final Logger LOG = Logger.getLogger(ForwardedUrlResolver.class);

    // Directive names and the proto value are case-insensitive; a host with a port may be quoted.
    private static final Pattern PROTO_DIRECTIVE =
            Pattern.compile("proto=\"?(?<proto>https?)\"?", Pattern.CASE_INSENSITIVE);
    private static final Pattern HOST_DIRECTIVE =
            Pattern.compile("host=\"?(?<host>[\\w.-]+)(:(?<port>\\d{1,5}))?\"?", Pattern.CASE_INSENSITIVE);

    private ForwardedUrlResolver() {}

    /**
     * Resolve the forwarded URL parts of a request.
     *
     * @param scope the request as seen by the server
     * @return the external scheme, host, port (nullable) and path prefix (nullable)
     */
    public static ForwardedUrlParts resolve(RequestScope scope) {
        var headers = scope.headers();
        var scheme = scope.scheme();
        String host;
        Integer port;

        var hostHeader = HeaderList.getValue(headers, "Host");
        if (hostHeader == null) {
            host = scope.serverHost();
            port = scope.serverPort();
        } else {
            var hostAndPort = splitHostPort(hostHeader);
            host = hostAndPort[0];
            port = parsePort(hostAndPort[1], null);
        }

        var forwarded = HeaderList.getValue(headers, "Forwarded");
        if (forwarded != null) {
            for (var entry : forwarded.split(",")) {
                var proto = PROTO_DIRECTIVE.matcher(entry);
                var forwardedHost = HOST_DIRECTIVE.matcher(entry);
                if (proto.find() && forwardedHost.find()) {
                    scheme = proto.group("proto").toLowerCase(Locale.ROOT);
                    host = forwardedHost.group("host");
                    port = parsePort(forwardedHost.group("port"), scope.serverPort());
                }
            }
        } else {
            host = HeaderList.getValue(headers, "X-Forwarded-Host", host);
            scheme = HeaderList.getValue(headers, "X-Forwarded-Proto", scheme);
            port = parsePort(HeaderList.getValue(headers, "X-Forwarded-Port"), port);
        }

        var prefix = HeaderList.getValue(headers, "X-Forwarded-Prefix");
        return new ForwardedUrlParts(scheme, host, port, prefix);
    }

    /**
     * Split {@code host[:port]} on the last colon, keeping bracketed IPv6 literals intact.
     *
     * @return two-element array of host and port text (port may be null)
     */
    static String[] splitHostPort(String value) {
        var text = value.trim();
        var colon = text.lastIndexOf(':');
        if (colon < 0 || (text.startsWith("[") && colon < text.lastIndexOf(']'))) {
            return new String[] {text, null};
        }
        return new String[] {text.substring(0, colon), text.substring(colon + 1)};
    }

    private static Integer parsePort(String value, Integer fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOG.debugv("Ignoring non-numeric forwarded port ''{0}'', keeping {1}", value, fallback);
            return fallback;
        }
    }
}
