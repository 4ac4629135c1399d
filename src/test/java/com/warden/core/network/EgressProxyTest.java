package com.warden.core.network;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.core.events.EventBus;
import com.warden.core.policy.GatewayProperties;
import com.warden.core.policy.PolicyHolder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EgressProxyTest {

    private NetworkGuard guard;
    private EgressProxy proxy;

    @BeforeEach
    void setUp() throws IOException {
        guard = new NetworkGuard(new PolicyHolder(new GatewayProperties(), new ObjectMapper()),
                null, new EventBus(), null, 100);
        proxy = new EgressProxy(guard, "127.0.0.1", 0, 2000, 8);
        proxy.start();
    }

    @AfterEach
    void tearDown() {
        proxy.stop();
    }

    @Test
    void bindsAnEphemeralPort() {
        assertTrue(proxy.isRunning());
        assertTrue(proxy.getPort() > 0);
    }

    @Test
    void tunnelToDenyRangeIsForbidden() throws IOException {
        List<String> response = send("CONNECT 10.0.0.1:80 HTTP/1.1\r\n"
                + "Proxy-Authorization: Basic " + basic("req-42") + "\r\n\r\n");

        assertEquals("HTTP/1.1 403 Forbidden", response.get(0));
        assertTrue(response.contains("X-Warden-Rule: blacklist_ip_range"), response.toString());
        assertEquals(1, guard.deniedAttempts("req-42"));
    }

    @Test
    void domainOffTheAllowListIsForbidden() throws IOException {
        List<String> response = send("CONNECT example.com:443 HTTP/1.1\r\n\r\n");

        assertEquals("HTTP/1.1 403 Forbidden", response.get(0));
        assertTrue(response.contains("X-Warden-Rule: default_deny"));
        assertEquals("unknown", guard.recentTraffic(1).get(0).context());
    }

    @Test
    void plainHttpRequestsAreCheckedToo() throws IOException {
        List<String> response = send("GET http://169.254.169.254/latest/meta-data HTTP/1.1\r\n"
                + "Host: 169.254.169.254\r\n\r\n");

        assertEquals("HTTP/1.1 403 Forbidden", response.get(0));
        assertTrue(response.contains("X-Warden-Rule: blacklist_ip_range"));
    }

    @Test
    void allowListedNameResolvingIntoDenyRangeIsForbidden() throws IOException {
        guard.addAllowedDomain("localhost");

        List<String> response = send("CONNECT localhost:9 HTTP/1.1\r\n\r\n");

        assertEquals("HTTP/1.1 403 Forbidden", response.get(0));
        assertTrue(response.contains("X-Warden-Rule: blacklist_ip_range"));
    }

    @Test
    void allowedTunnelRelaysBytes() throws Exception {
        InetAddress loopback = InetAddress.getByName("localhost");
        guard.addAllowedDomain("localhost");
        guard.removeDenyRange("127.0.0.0/8");
        guard.removeDenyRange("::1/128");

        try (ServerSocket upstream = new ServerSocket(0, 1, loopback)) {
            Thread echo = new Thread(() -> {
                try (Socket s = upstream.accept()) {
                    s.getInputStream().transferTo(s.getOutputStream());
                } catch (IOException e) {
                    // connection torn down by the test
                }
            });
            echo.setDaemon(true);
            echo.start();

            try (Socket client = connect()) {
                OutputStream out = client.getOutputStream();
                out.write(("CONNECT localhost:" + upstream.getLocalPort() + " HTTP/1.1\r\n\r\n")
                        .getBytes(StandardCharsets.ISO_8859_1));
                out.flush();
                var reader = new BufferedReader(new InputStreamReader(client.getInputStream(), StandardCharsets.ISO_8859_1));
                assertEquals("HTTP/1.1 200 Connection Established", reader.readLine());
                assertEquals("", reader.readLine());

                out.write("ping\n".getBytes(StandardCharsets.ISO_8859_1));
                out.flush();
                assertEquals("ping", reader.readLine());
            }
        }
    }

    @Test
    void malformedRequestLineIsRejected() throws IOException {
        List<String> response = send("garbage\r\n\r\n");

        assertEquals("HTTP/1.1 400 Bad Request", response.get(0));
    }

    @Test
    void contextIsTakenFromProxyAuthorization() {
        assertEquals("req-7", EgressProxy.contextFrom(List.of("CONNECT a:1 HTTP/1.1",
                "proxy-authorization: Basic " + basic("req-7"))));
        assertNull(EgressProxy.contextFrom(List.of("CONNECT a:1 HTTP/1.1", "Host: a")));
        assertNull(EgressProxy.contextFrom(List.of("Proxy-Authorization: Basic %%%")));
    }

    private Socket connect() throws IOException {
        Socket socket = new Socket();
        socket.connect(new InetSocketAddress("127.0.0.1", proxy.getPort()), 2000);
        socket.setSoTimeout(5000);
        return socket;
    }

    private List<String> send(String request) throws IOException {
        try (Socket socket = connect()) {
            socket.getOutputStream().write(request.getBytes(StandardCharsets.ISO_8859_1));
            socket.getOutputStream().flush();
            var reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.ISO_8859_1));
            var lines = new ArrayList<String>();
            String line;
            while ((line = reader.readLine()) != null && !line.isEmpty()) {
                lines.add(line);
            }
            return lines;
        }
    }

    private static String basic(String user) {
        return Base64.getEncoder().encodeToString((user + ":x").getBytes(StandardCharsets.UTF_8));
    }
}
