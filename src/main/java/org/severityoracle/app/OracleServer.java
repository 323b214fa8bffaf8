package org.severityoracle.app;

import org.severityoracle.api.impl.OracleHttpServer;
import org.severityoracle.api.impl.handlers.HandlerFactory;
import org.severityoracle.common.http.DefaultHttpWire;
import org.severityoracle.common.util.SimpleRetryExecutor;
import org.severityoracle.domain.interfaces.IAggregationService;
import org.severityoracle.infrastructure.impl.AggregationServiceImpl;
import org.severityoracle.infrastructure.impl.ConsoleAggregationListener;
import org.severityoracle.infrastructure.impl.HttpCallbackResponseSink;
import org.severityoracle.infrastructure.impl.LoggingResponseSink;
import org.severityoracle.infrastructure.util.OracleConfig;

/**
 * Runs the severity oracle behind its HTTP front end.
 * <pre>
 * java -cp target/classes:gson.jar org.severityoracle.app.OracleServer [port]
 * </pre>
 * Settings come from {@code oracle.properties} and {@code -Doracle.*} overrides; the optional
 * port argument wins over both.
 */
public final class OracleServer {

    private OracleServer() {}

    public static void main(String[] args) throws Exception {
        OracleConfig config = OracleConfig.load();
        if (args.length > 0) {
            config = config.withPort(Integer.parseInt(args[0]));
        }

        Running running = boot(config);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                running.server().close();
            } catch (Exception e) {
                System.err.println("[Server] shutdown failed: " + e.getMessage());
            }
        }, "oracle-shutdown"));
        running.server().awaitTermination();
    }

    /** Wires the oracle from {@code config} and starts listening. */
    public static Running boot(OracleConfig config) throws Exception {
        OracleConfig.CallbackRetry r = config.callbackRetry();
        HttpCallbackResponseSink sink = new HttpCallbackResponseSink(
                new DefaultHttpWire(),
                new SimpleRetryExecutor(r.attempts(), r.baseDelayMs(), r.maxDelayMs(), r.jitterMs()),
                new LoggingResponseSink());

        IAggregationService service = AggregationServiceImpl.create(
                config.deployer(), config.settings(), config.severityPolicy(), sink, new ConsoleAggregationListener());

        OracleHttpServer server = new OracleHttpServer(new HandlerFactory(service));
        server.start(config.port());
        System.out.println("[Server] deployer=" + config.deployer()
                + " quorum=" + config.settings().quorum()
                + " thresholds=" + config.settings().mediumThreshold() + "/" + config.settings().largeThreshold()
                + " enforceMaxSeverity=" + config.severityPolicy().enforceMax());
        return new Running(server, service);
    }

    public record Running(OracleHttpServer server, IAggregationService service) {}
}
