package com.warden.core.network;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HTTP forward proxy that sandboxes with network access use as their only route out.
 * <p>
 * Supports {@code CONNECT host:port} tunnels and absolute-form plain HTTP requests. Every
 * attempt is decided by the {@link NetworkGuard}, first by name and then by the address the name
 * resolved to. The request id travels as the user name of a {@code Proxy-Authorization: Basic}
 * header so that decisions are attributed to the request that made them.
 */
public class EgressProxy {

    private static final Logger log = LoggerFactory.getLogger(EgressProxy.class);

    private static final int MAX_HEADER_BYTES = 16 * 1024;

    private final NetworkGuard networkGuard;
    private final String bindAddress;
    private final int port;
    private final int connectTimeoutMillis;
    private final Semaphore connections;

    private volatile ServerSocket serverSocket;
    private ExecutorService workers;
    private Thread acceptThread;

    public EgressProxy(NetworkGuard networkGuard, String bindAddress, int port,
                       int connectTimeoutMillis, int maxConnections) {
        this.networkGuard = networkGuard;
        this.bindAddress = bindAddress;
        this.port = port;
        this.connectTimeoutMillis = connectTimeoutMillis;
        this.connections = new Semaphore(maxConnections);
    }

    public synchronized void start() throws IOException {
        if (serverSocket != null) {
            return;
        }
        ServerSocket socket = new ServerSocket();
        socket.setReuseAddress(true);
        socket.bind(new InetSocketAddress(bindAddress, port));
        serverSocket = socket;
        AtomicInteger counter = new AtomicInteger();
        workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "egress-proxy-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        acceptThread = new Thread(this::acceptLoop, "egress-proxy-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();
        log.info("Egress proxy listening on {}:{}", bindAddress, getPort());
    }

    public synchronized void stop() {
        ServerSocket socket = serverSocket;
        serverSocket = null;
        if (socket != null) {
            try {
                socket.close();
            } catch (IOException e) {
                log.warn("Error closing egress proxy socket: {}", e.getMessage());
            }
        }
        if (workers != null) {
            workers.shutdownNow();
        }
        log.info("Egress proxy stopped");
    }

    /** Bound port; differs from the configured one when that was 0. */
    public int getPort() {
        ServerSocket socket = serverSocket;
        return socket == null ? port : socket.getLocalPort();
    }

    public boolean isRunning() {
        ServerSocket socket = serverSocket;
        return socket != null && !socket.isClosed();
    }

    private void acceptLoop() {
        while (isRunning()) {
            Socket client;
            try {
                client = serverSocket.accept();
            } catch (SocketException e) {
                if (isRunning()) {
                    log.warn("Egress proxy accept failed: {}", e.getMessage());
                }
                continue;
            } catch (IOException e) {
                log.warn("Egress proxy accept failed: {}", e.getMessage());
                continue;
            }
            if (!connections.tryAcquire()) {
                log.warn("Egress proxy connection limit reached, rejecting {}", client.getRemoteSocketAddress());
                respondAndClose(client, 503, "Service Unavailable", null);
                continue;
            }
            workers.execute(() -> {
                try {
                    handle(client);
                } finally {
                    connections.release();
                }
            });
        }
    }

    void handle(Socket client) {
        try {
            client.setSoTimeout(connectTimeoutMillis);
            String head = readHead(client.getInputStream());
            if (head == null) {
                respondAndClose(client, 400, "Bad Request", null);
                return;
            }
            List<String> lines = List.of(head.split("\r\n"));
            String[] requestLine = lines.get(0).split(" ");
            if (requestLine.length != 3) {
                respondAndClose(client, 400, "Bad Request", null);
                return;
            }
            String method = requestLine[0].toUpperCase(Locale.ROOT);
            String context = contextFrom(lines);
            if ("CONNECT".equals(method)) {
                tunnel(client, requestLine[1], context);
            } else {
                forward(client, method, requestLine[1], requestLine[2], lines, context);
            }
        } catch (IOException e) {
            log.debug("Egress proxy connection ended: {}", e.getMessage());
            closeQuietly(client);
        }
    }

    private void tunnel(Socket client, String authority, String context) throws IOException {
        int colon = authority.lastIndexOf(':');
        if (colon <= 0) {
            respondAndClose(client, 400, "Bad Request", null);
            return;
        }
        String host = authority.substring(0, colon);
        int targetPort;
        try {
            targetPort = Integer.parseInt(authority.substring(colon + 1));
        } catch (NumberFormatException e) {
            respondAndClose(client, 400, "Bad Request", null);
            return;
        }
        Socket upstream = open(client, authority, host, targetPort, context);
        if (upstream == null) {
            return;
        }
        OutputStream out = client.getOutputStream();
        out.write("HTTP/1.1 200 Connection Established\r\n\r\n".getBytes(StandardCharsets.ISO_8859_1));
        out.flush();
        pipe(client, upstream);
    }

    private void forward(Socket client, String method, String target, String version, List<String> lines,
                         String context) throws IOException {
        URI uri;
        try {
            uri = new URI(target);
        } catch (URISyntaxException e) {
            respondAndClose(client, 400, "Bad Request", null);
            return;
        }
        if (uri.getHost() == null || !"http".equalsIgnoreCase(uri.getScheme())) {
            respondAndClose(client, 400, "Bad Request", null);
            return;
        }
        int targetPort = uri.getPort() < 0 ? 80 : uri.getPort();
        Socket upstream = open(client, target, uri.getHost(), targetPort, context);
        if (upstream == null) {
            return;
        }
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null) {
            path += "?" + uri.getRawQuery();
        }
        var rewritten = new StringBuilder(method).append(' ').append(path).append(' ').append(version).append("\r\n");
        for (String line : lines.subList(1, lines.size())) {
            String lower = line.toLowerCase(Locale.ROOT);
            if (lower.startsWith("proxy-") || lower.startsWith("connection:")) {
                continue;
            }
            rewritten.append(line).append("\r\n");
        }
        rewritten.append("Connection: close\r\n\r\n");
        OutputStream upstreamOut = upstream.getOutputStream();
        upstreamOut.write(rewritten.toString().getBytes(StandardCharsets.ISO_8859_1));
        upstreamOut.flush();
        pipe(client, upstream);
    }

    /** Applies both guard checks and connects, or answers the client and returns null. */
    private Socket open(Socket client, String target, String host, int targetPort, String context) throws IOException {
        NetworkDecision decision = networkGuard.check(target, context);
        if (!decision.allowed()) {
            respondAndClose(client, 403, "Forbidden", decision.ruleMatched());
            return null;
        }
        InetAddress address;
        try {
            address = InetAddress.getByName(decision.host());
        } catch (UnknownHostException e) {
            log.debug("Egress proxy could not resolve {}", host);
            respondAndClose(client, 502, "Bad Gateway", null);
            return null;
        }
        NetworkDecision resolved = networkGuard.checkResolved(decision.host(), address, context);
        if (!resolved.allowed()) {
            respondAndClose(client, 403, "Forbidden", resolved.ruleMatched());
            return null;
        }
        Socket upstream = new Socket();
        try {
            upstream.connect(new InetSocketAddress(address, targetPort), connectTimeoutMillis);
        } catch (IOException e) {
            log.debug("Egress proxy connect to {}:{} failed: {}", host, targetPort, e.getMessage());
            closeQuietly(upstream);
            respondAndClose(client, 502, "Bad Gateway", null);
            return null;
        }
        client.setSoTimeout(0);
        return upstream;
    }

    private void pipe(Socket client, Socket upstream) {
        workers.execute(() -> copy(upstream, client));
        copy(client, upstream);
    }

    private static void copy(Socket from, Socket to) {
        byte[] buffer = new byte[8192];
        try (InputStream in = from.getInputStream(); OutputStream out = to.getOutputStream()) {
            int n;
            while ((n = in.read(buffer)) >= 0) {
                out.write(buffer, 0, n);
                out.flush();
            }
        } catch (IOException e) {
            log.trace("Egress proxy stream closed: {}", e.getMessage());
        } finally {
            closeQuietly(from);
            closeQuietly(to);
        }
    }

    static String contextFrom(List<String> headerLines) {
        for (String line : headerLines) {
            int colon = line.indexOf(':');
            if (colon < 0 || !line.substring(0, colon).trim().equalsIgnoreCase("Proxy-Authorization")) {
                continue;
            }
            String value = line.substring(colon + 1).trim();
            if (!value.regionMatches(true, 0, "Basic ", 0, 6)) {
                continue;
            }
            try {
                String decoded = new String(Base64.getDecoder().decode(value.substring(6).trim()), StandardCharsets.UTF_8);
                int sep = decoded.indexOf(':');
                return sep < 0 ? decoded : decoded.substring(0, sep);
            } catch (IllegalArgumentException e) {
                log.debug("Ignoring malformed Proxy-Authorization header");
            }
        }
        return null;
    }

    private static String readHead(InputStream in) throws IOException {
        var head = new ByteArrayOutputStream();
        int matched = 0;
        while (head.size() < MAX_HEADER_BYTES) {
            int b = in.read();
            if (b < 0) {
                return null;
            }
            head.write(b);
            if (b == '\r') {
                matched = matched == 2 ? 3 : 1;
            } else if (b == '\n' && (matched == 1 || matched == 3)) {
                matched++;
            } else {
                matched = 0;
            }
            if (matched == 4) {
                String text = head.toString(StandardCharsets.ISO_8859_1);
                return text.substring(0, text.length() - 4);
            }
        }
        return null;
    }

    private static void respondAndClose(Socket client, int status, String message, String rule) {
        var response = new ArrayList<String>();
        response.add("HTTP/1.1 " + status + " " + message);
        if (rule != null) {
            response.add("X-Warden-Rule: " + rule);
        }
        response.add("Content-Length: 0");
        response.add("Connection: close");
        try {
            OutputStream out = client.getOutputStream();
            out.write((String.join("\r\n", response) + "\r\n\r\n").getBytes(StandardCharsets.ISO_8859_1));
            out.flush();
        } catch (IOException e) {
            log.debug("Could not answer proxy client: {}", e.getMessage());
        } finally {
            closeQuietly(client);
        }
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            log.trace("Socket close failed: {}", e.getMessage());
        }
    }
}
