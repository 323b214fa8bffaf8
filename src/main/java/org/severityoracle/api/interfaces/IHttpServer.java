package org.severityoracle.api.interfaces;

/*
AutoCloseable so tests and the shutdown hook can stop the server with try-with-resources
 */
public interface IHttpServer extends AutoCloseable {
    void start(int port) throws Exception;

    /** Port actually bound; differs from the requested one when that was 0. */
    int port();

    @Override void close() throws Exception;
}
