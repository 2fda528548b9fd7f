package io.github.yok.rethinkdblink.config;

import com.google.common.base.Preconditions;
import java.net.URI;
import java.net.URISyntaxException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

/**
 * Network address of a RethinkDB server (host and client driver port).
 *
 * <p>
 * Instances are immutable. {@link #parse(String)} accepts the URL form used in
 * {@code application.yml}, for example {@code rethink://db.example.com:28015}. The scheme is not
 * interpreted; when the port is omitted {@link #DEFAULT_PORT} is used.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
public final class ServerAddress {

    /**
     * Default RethinkDB client driver port.
     */
    public static final int DEFAULT_PORT = 28015;

    /**
     * Default host name.
     */
    public static final String DEFAULT_HOST = "localhost";

    private final String host;
    private final int port;

    /**
     * Creates an address.
     *
     * @param host host name or IP address
     * @param port TCP port (1-65535)
     * @throws IllegalArgumentException if host is blank or port is out of range
     */
    public ServerAddress(String host, int port) {
        Preconditions.checkArgument(StringUtils.isNotBlank(host), "host must not be blank");
        Preconditions.checkArgument(port > 0 && port <= 65535, "port out of range: %s", port);
        this.host = host;
        this.port = port;
    }

    /**
     * Parses a server URL such as {@code rethink://localhost:28015}.
     *
     * @param url server URL
     * @return parsed address
     * @throws IllegalArgumentException if the URL is blank, malformed, or has no host
     */
    public static ServerAddress parse(String url) {
        Preconditions.checkArgument(StringUtils.isNotBlank(url), "url must not be blank");
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Malformed server URL: " + url, e);
        }
        String host = uri.getHost();
        if (StringUtils.isBlank(host)) {
            throw new IllegalArgumentException("Server URL has no host: " + url);
        }
        int port = uri.getPort() < 0 ? DEFAULT_PORT : uri.getPort();
        return new ServerAddress(host, port);
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
