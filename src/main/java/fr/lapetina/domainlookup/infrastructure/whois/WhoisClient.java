package fr.lapetina.domainlookup.infrastructure.whois;

import fr.lapetina.domainlookup.domain.model.ErrorType;
import fr.lapetina.domainlookup.domain.model.LookupResult;
import fr.lapetina.domainlookup.lookup.RegistrationLookup;
import fr.lapetina.domainlookup.lookup.exception.LookupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * WHOIS client speaking the plain-text protocol over TCP (RFC 3912).
 *
 * Sends {@code domain CRLF}, reads until the server closes the connection and
 * classifies the body with {@link WhoisResponseParser}. A single deadline bounds
 * the connect, the write and the whole read.
 */
public final class WhoisClient implements RegistrationLookup {

    private static final Logger log = LoggerFactory.getLogger(WhoisClient.class);

    private static final int BUFFER_SIZE = 4096;

    private final WhoisServerTable serverTable;
    private final int port;
    private final Duration timeout;

    public WhoisClient(WhoisServerTable serverTable, int port, Duration timeout) {
        this.serverTable = serverTable;
        this.port = port;
        this.timeout = timeout;
    }

    @Override
    public String getName() {
        return "whois";
    }

    @Override
    public LookupResult query(String domain) throws LookupException {
        String server = serverTable.serverFor(domain);
        log.debug("Querying WHOIS: domain={}, server={}, port={}", domain, server, port);

        String body = fetch(server, domain);
        LookupResult result = WhoisResponseParser.parse(domain, body);
        if (result.isUnknown()) {
            throw new LookupException(ErrorType.PROTOCOL_ERROR, result.errorDetail());
        }
        return result;
    }

    private String fetch(String server, String domain) throws LookupException {
        long deadline = System.nanoTime() + timeout.toNanos();

        try (Socket socket = new Socket()) {
            try {
                socket.connect(new InetSocketAddress(server, port), timeoutMillis(timeout.toNanos()));
            } catch (IOException e) {
                throw new LookupException(classify(e),
                        "Failed to connect to WHOIS server " + server + ": " + e.getMessage(), e);
            }

            try {
                OutputStream out = socket.getOutputStream();
                out.write((domain + "\r\n").getBytes(StandardCharsets.UTF_8));
                out.flush();
            } catch (IOException e) {
                throw new LookupException(classify(e), "Failed to send WHOIS query: " + e.getMessage(), e);
            }

            try {
                return readAll(socket, deadline);
            } catch (IOException e) {
                throw new LookupException(classify(e), "Failed to read WHOIS response: " + e.getMessage(), e);
            }
        } catch (IOException e) {
            // Only reachable when closing the socket fails
            throw new LookupException(ErrorType.TRANSPORT_ERROR, "WHOIS connection error: " + e.getMessage(), e);
        }
    }

    private static String readAll(Socket socket, long deadline) throws IOException {
        InputStream in = socket.getInputStream();
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        byte[] buffer = new byte[BUFFER_SIZE];

        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new SocketTimeoutException("Read timed out");
            }
            socket.setSoTimeout(timeoutMillis(remaining));
            int read = in.read(buffer);
            if (read < 0) {
                return body.toString(StandardCharsets.UTF_8);
            }
            body.write(buffer, 0, read);
        }
    }

    private static int timeoutMillis(long nanos) {
        long millis = Math.max(1, Duration.ofNanos(nanos).toMillis());
        return (int) Math.min(Integer.MAX_VALUE, millis);
    }

    private static ErrorType classify(IOException e) {
        return e instanceof SocketTimeoutException ? ErrorType.TIMEOUT : ErrorType.TRANSPORT_ERROR;
    }
}
