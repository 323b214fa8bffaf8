package org.severityoracle.api.impl;

import org.severityoracle.api.impl.handlers.JsonHandler;
import org.severityoracle.api.interfaces.IHandlerFactory;
import org.severityoracle.api.interfaces.IHttpHandler;
import org.severityoracle.api.interfaces.IHttpServer;
import org.severityoracle.common.http.HttpStatus;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Socket-level HTTP/1.1 server: one request per connection, each connection on a worker thread.
 * <p>
 * The server holds no lock of its own. Per-request serialization is the oracle's job, so
 * submissions for different request ids run in parallel.
 */
public final class OracleHttpServer implements IHttpServer {

    private static final int SOCKET_TIMEOUT_MS = 10_000;

    private final IHandlerFactory factory;
    private final AtomicInteger workerSeq = new AtomicInteger();
    private final ExecutorService workers = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "oracle-http-" + workerSeq.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    private volatile ServerSocket server;
    private volatile Thread acceptor;

    public OracleHttpServer(IHandlerFactory factory) {
        this.factory = factory;
    }

    @Override
    public void start(int port) throws IOException {
        if (server != null) {
            throw new IllegalStateException("server already started on port " + server.getLocalPort());
        }
        ServerSocket ss = new ServerSocket(port);
        server = ss;
        acceptor = new Thread(() -> acceptLoop(ss), "oracle-acceptor");
        acceptor.setDaemon(true);
        acceptor.start();
        System.out.println("[Server] listening on port " + ss.getLocalPort());
    }

    @Override
    public int port() {
        ServerSocket ss = server;
        if (ss == null) throw new IllegalStateException("server not started");
        return ss.getLocalPort();
    }

    /** Blocks until the accept loop ends (server closed). */
    public void awaitTermination() throws InterruptedException {
        Thread t = acceptor;
        if (t != null) t.join();
    }

    private void acceptLoop(ServerSocket ss) {
        while (!ss.isClosed()) {
            try {
                Socket client = ss.accept();
                workers.execute(() -> handle(client));
            } catch (SocketException closed) {
                if (!ss.isClosed()) {
                    System.err.println("[Server] accept failed: " + closed.getMessage());
                }
            } catch (IOException e) {
                System.err.println("[Server] accept failed: " + e.getMessage());
            }
        }
    }

    private void handle(Socket client) {
        try (client;
             InputStream in = new BufferedInputStream(client.getInputStream());
             OutputStream out = client.getOutputStream()) {

            client.setSoTimeout(SOCKET_TIMEOUT_MS);
            HttpResponseImpl res = new HttpResponseImpl();

            MinimalHttpRequest req;
            try {
                req = HttpRequestReader.read(in, out);
            } catch (HttpRequestReader.MalformedRequestException e) {
                JsonHandler.error(res, HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage());
                HttpResponseWriter.write(out, res);
                return;
            }
            if (req == null) {
                JsonHandler.error(res, HttpStatus.BAD_REQUEST, "BAD_REQUEST", "empty request line");
                HttpResponseWriter.write(out, res);
                return;
            }

            IHttpHandler handler = factory.create(req);
            try {
                handler.handle(req, res);
            } catch (Exception e) {
                System.err.println("[Server] handler failed for " + req.method() + " " + req.path() + ": " + e);
                res = new HttpResponseImpl();
                JsonHandler.error(res, HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL", String.valueOf(e.getMessage()));
            }

            HttpResponseWriter.write(out, res);
            System.out.println("[Server] " + req.method() + " " + req.path() + " -> " + res.status());

        } catch (SocketException se) {
            String msg = String.valueOf(se.getMessage()).toLowerCase();
            if (!(msg.contains("connection reset") || msg.contains("broken pipe")
                    || msg.contains("socket write error") || msg.contains("software caused connection abort"))) {
                System.err.println("[Server] socket error: " + se.getMessage());
            }
        } catch (IOException e) {
            System.err.println("[Server] error: " + e.getMessage());
        }
    }

    @Override
    public void close() throws IOException, InterruptedException {
        ServerSocket ss = server;
        if (ss != null) {
            ss.close();
        }
        workers.shutdown();
        if (!workers.awaitTermination(2, TimeUnit.SECONDS)) {
            workers.shutdownNow();
        }
        Thread t = acceptor;
        if (t != null) {
            t.join(2_000);
        }
        System.out.println("[Server] stopped");
    }
}
