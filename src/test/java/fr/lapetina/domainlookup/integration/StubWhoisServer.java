package fr.lapetina.domainlookup.integration;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Local TCP server speaking the WHOIS protocol: reads one query line,
 * writes the configured body and closes the connection.
 */
public final class StubWhoisServer implements AutoCloseable {

    private final ServerSocket serverSocket;
    private final Function<String, String> responder;
    private final List<String> queries = new CopyOnWriteArrayList<>();
    private final Thread acceptThread;

    public StubWhoisServer(Function<String, String> responder) throws IOException {
        this.responder = responder;
        this.serverSocket = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
        this.acceptThread = new Thread(this::acceptLoop, "stub-whois");
        this.acceptThread.setDaemon(true);
        this.acceptThread.start();
    }

    public int port() {
        return serverSocket.getLocalPort();
    }

    /**
     * Raw query lines received so far, CRLF included.
     */
    public List<String> queries() {
        return queries;
    }

    private void acceptLoop() {
        while (!serverSocket.isClosed()) {
            try {
                Socket socket = serverSocket.accept();
                Thread handler = new Thread(() -> serve(socket), "stub-whois-conn");
                handler.setDaemon(true);
                handler.start();
            } catch (IOException e) {
                return;
            }
        }
    }

    private void serve(Socket socket) {
        try (socket) {
            BufferedReader reader = new BufferedReader(
                    new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
            StringBuilder line = new StringBuilder();
            int c;
            while ((c = reader.read()) != -1) {
                line.append((char) c);
                if (c == '\n') {
                    break;
                }
            }
            queries.add(line.toString());

            String body = responder.apply(line.toString().trim());
            if (body != null) {
                OutputStream out = socket.getOutputStream();
                out.write(body.getBytes(StandardCharsets.UTF_8));
                out.flush();
            }
        } catch (IOException e) {
            throw new IllegalStateException("Stub WHOIS connection failed", e);
        }
    }

    @Override
    public void close() throws IOException {
        serverSocket.close();
    }
}
