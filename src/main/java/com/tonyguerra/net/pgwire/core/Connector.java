package com.tonyguerra.net.pgwire.core;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.BufferUnderflowException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tonyguerra.net.pgwire.configurations.ConnectionSettings;
import com.tonyguerra.net.pgwire.copy.CopyInStream;
import com.tonyguerra.net.pgwire.copy.CopyOutStream;
import com.tonyguerra.net.pgwire.core.components.BackendMessage;
import com.tonyguerra.net.pgwire.core.components.FrontendMessages;
import com.tonyguerra.net.pgwire.core.components.PgStream;
import com.tonyguerra.net.pgwire.core.components.ServerError;
import com.tonyguerra.net.pgwire.di.Container;
import com.tonyguerra.net.pgwire.enums.CopyDirection;
import com.tonyguerra.net.pgwire.enums.Phase;
import com.tonyguerra.net.pgwire.enums.TransactionStatus;
import com.tonyguerra.net.pgwire.errors.ConnectionBrokenException;
import com.tonyguerra.net.pgwire.errors.ConnectionException;
import com.tonyguerra.net.pgwire.errors.CopyException;
import com.tonyguerra.net.pgwire.errors.PgException;
import com.tonyguerra.net.pgwire.errors.ProtocolStateException;
import com.tonyguerra.net.pgwire.errors.ServerErrorException;
import com.tonyguerra.net.pgwire.handlers.HandlerDefinition;
import com.tonyguerra.net.pgwire.handlers.HandlerRegistry;
import com.tonyguerra.net.pgwire.handlers.NotificationHandlerScanner;

/**
 * One physical connection to a PostgreSQL server and the protocol state machine driving it.
 *
 * All socket traffic goes through the phase-guarded exchange methods of this class. Synchronous
 * reads hold a {@link NotificationGate.Block} so the notification thread never consumes bytes
 * meant for them; that thread only reads while the connection is {@code Ready}.
 */
public final class Connector implements Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(Connector.class);

    private final ConnectionSettings settings;
    private final Mediator mediator;
    private final NotificationGate gate;

    // channel -> handler definition (class + method)
    private final HandlerRegistry registry;

    // Used to instantiate non-static handler owners
    private final Container container;

    private final CopyOnWriteArrayList<NotificationListener> listeners;

    // Notifications read by a synchronous exchange, delivered once it is over
    private final ConcurrentLinkedQueue<PgNotification> pendingNotifications;

    private final Map<String, String> serverParameters;
    private final Object lifecycleLock;
    private final Object stateLock;

    private volatile ProtocolState state;
    private volatile TransactionStatus transactionStatus;
    private volatile Executor eventDispatcher;
    private volatile boolean listening;
    private volatile int processId;
    private volatile int secretKey;

    private Socket socket;
    private volatile PgStream stream;
    private Thread notificationThread;

    public Connector(ConnectionSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.mediator = new Mediator(settings.copyBufferSize());
        this.gate = new NotificationGate(this::afterRelease);
        this.registry = new HandlerRegistry();
        this.container = new Container();
        this.listeners = new CopyOnWriteArrayList<>();
        this.pendingNotifications = new ConcurrentLinkedQueue<>();
        this.serverParameters = new ConcurrentHashMap<>();
        this.lifecycleLock = new Object();
        this.stateLock = new Object();
        this.state = ProtocolState.CLOSED;
        this.transactionStatus = TransactionStatus.UNKNOWN;
        this.eventDispatcher = Runnable::run; // default: notification thread

        // Register defaults shipped with the lib
        registry.registerDefault(NotificationHandlerScanner.scanDefaults());

        // Allow handlers to request the connector instance via DI
        container.registerInstance(Connector.class, this);
    }

    // -------------------------
    // State
    // -------------------------

    public ProtocolState currentState() {
        return state;
    }

    public boolean isUsable() {
        final var phase = state.phase();
        return phase != Phase.CLOSED && phase != Phase.BROKEN && phase != Phase.CONNECTING;
    }

    public Mediator getMediator() {
        return mediator;
    }

    public ConnectionSettings getSettings() {
        return settings;
    }

    public TransactionStatus getTransactionStatus() {
        return transactionStatus;
    }

    public String getServerParameter(String name) {
        return serverParameters.get(name);
    }

    public Map<String, String> getServerParameters() {
        return Map.copyOf(serverParameters);
    }

    public int getProcessId() {
        return processId;
    }

    public int getSecretKey() {
        return secretKey;
    }

    private void moveTo(ProtocolState next) {
        synchronized (stateLock) {
            final var current = state;
            if (!current.phase().canMoveTo(next.phase())) {
                throw new IllegalStateException("Illegal transition " + current.name() + " -> " + next.name());
            }
            state = next;
            LOGGER.debug("🔁 {} -> {}", current.name(), next.name());
        }
    }

    private void requireState(Class<? extends ProtocolState> expected, String attempted) throws ProtocolStateException {
        final var current = state;
        if (current instanceof ProtocolState.Broken broken) {
            throw new ConnectionBrokenException(attempted, broken.reason());
        }
        if (!expected.isInstance(current)) {
            throw new ProtocolStateException(attempted, current.name());
        }
    }

    private void markBroken(String reason) {
        synchronized (stateLock) {
            final var phase = state.phase();
            if (phase == Phase.BROKEN || phase == Phase.CLOSED) {
                return;
            }
            moveTo(new ProtocolState.Broken(reason));
        }
        LOGGER.error("❌ Connection broken: {}", reason);
    }

    private ConnectionBrokenException fail(String attempted, Exception cause) {
        markBroken(attempted + ": " + cause.getMessage());
        return new ConnectionBrokenException(attempted, cause);
    }

    // -------------------------
    // Lifecycle
    // -------------------------

    public void open() throws PgException {
        synchronized (lifecycleLock) {
            requireState(ProtocolState.Closed.class, "open");
            moveTo(ProtocolState.CONNECTING);

            try {
                socket = new Socket();
                socket.connect(new InetSocketAddress(settings.host(), settings.port()), settings.connectTimeoutMs());
                socket.setSoTimeout(settings.socketTimeoutMs());
                socket.setTcpNoDelay(true);
                stream = new PgStream(socket.getInputStream(), socket.getOutputStream());

                handshake();
                moveTo(ProtocolState.READY);
            } catch (IOException | BufferUnderflowException ex) {
                markBroken("startup failed: " + ex.getMessage());
                safeCloseQuietly();
                if (ex instanceof ConnectionException ce) {
                    throw ce;
                }
                throw new ConnectionException("Could not connect to " + settings + ": " + ex.getMessage(), ex);
            }

            LOGGER.info("✅ Connected to PostgreSQL server: {}:{} (backend {})", settings.host(), settings.port(),
                    processId);

            if (settings.listenForNotifications()) {
                startNotificationThread();
            }
        }
    }

    private void handshake() throws IOException {
        final Map<String, String> params = new LinkedHashMap<>();
        params.put("user", settings.user());
        params.put("database", settings.database());
        params.put("client_encoding", "UTF8");
        if (settings.applicationName() != null) {
            params.put("application_name", settings.applicationName());
        }
        params.putAll(settings.startupParameters());

        FrontendMessages.startup(stream, params);
        stream.flush();

        while (true) {
            final var msg = stream.readMessage();
            switch (msg.type()) {
                case BackendMessage.AUTHENTICATION:
                    authenticate(msg);
                    break;
                case BackendMessage.PARAMETER_STATUS:
                    recordParameter(msg);
                    break;
                case BackendMessage.BACKEND_KEY_DATA:
                    final var body = msg.body();
                    processId = body.getInt();
                    secretKey = body.getInt();
                    break;
                case BackendMessage.NOTICE_RESPONSE:
                    logNotice(msg);
                    break;
                case BackendMessage.ERROR_RESPONSE:
                    final var error = ServerError.parse(msg);
                    throw new ConnectionException("Server rejected the connection: " + error,
                            new ServerErrorException(error));
                case BackendMessage.READY_FOR_QUERY:
                    transactionStatus = readTransactionStatus(msg);
                    return;
                default:
                    throw new ConnectionException("Unexpected message '" + msg.typeChar() + "' during startup");
            }
        }
    }

    private void authenticate(BackendMessage msg) throws IOException {
        final var body = msg.body();
        final int code = body.getInt();

        switch (code) {
            case BackendMessage.AUTH_OK:
                LOGGER.debug("🔑 Authenticated as {}", settings.user());
                return;
            case BackendMessage.AUTH_CLEARTEXT_PASSWORD:
                FrontendMessages.cleartextPassword(stream, requirePassword());
                stream.flush();
                return;
            case BackendMessage.AUTH_MD5_PASSWORD:
                final byte[] salt = new byte[4];
                body.get(salt);
                FrontendMessages.md5Password(stream, settings.user(), requirePassword(), salt);
                stream.flush();
                return;
            default:
                throw new ConnectionException("Unsupported authentication method (code " + code + ")");
        }
    }

    private String requirePassword() throws ConnectionException {
        if (settings.password() == null) {
            throw new ConnectionException("Server requested a password but none was configured");
        }
        return settings.password();
    }

    @Override
    public void close() {
        synchronized (lifecycleLock) {
            final var current = state;
            if (current instanceof ProtocolState.Closed) {
                return;
            }

            stopNotificationThread();

            if (current instanceof ProtocolState.Ready && stream != null) {
                try {
                    FrontendMessages.terminate(stream);
                    stream.flush();
                } catch (IOException ex) {
                    LOGGER.debug("Terminate not delivered: {}", ex.getMessage());
                }
            }

            safeCloseQuietly();
            moveTo(ProtocolState.CLOSED);
            deliverPending();
            LOGGER.info("🔌 Connection to {}:{} closed.", settings.host(), settings.port());
        }
    }

    private void safeCloseQuietly() {
        try {
            if (stream != null)
                stream.close();
        } catch (IOException ex) {
            LOGGER.debug("Error closing stream: {}", ex.getMessage());
        }
        try {
            if (socket != null)
                socket.close();
        } catch (IOException ex) {
            LOGGER.debug("Error closing socket: {}", ex.getMessage());
        }

        stream = null;
        socket = null;
    }

    // -------------------------
    // Commands
    // -------------------------

    public CommandResult execute(String sql) throws PgException {
        return execute(new SimpleCommand(sql, this));
    }

    /**
     * Runs a command through the simple query protocol. Legal only in {@code Ready}.
     *
     * If the command starts a COPY and the {@link Mediator} holds a caller stream, the whole
     * transfer happens here. Without one, an engine stream is installed in the Mediator and
     * this returns with the connection in {@code CopyIn} or {@code CopyOut}.
     *
     * @throws ServerErrorException if the server reported an error; the connection is
     *                              {@code Ready} again
     */
    public CommandResult execute(PgCommand command) throws PgException {
        Objects.requireNonNull(command, "command");
        final String sql = command.getCommandText();

        try (var block = gate.block()) {
            requireState(ProtocolState.Ready.class, "execute");
            moveTo(new ProtocolState.Executing(sql));

            try {
                FrontendMessages.query(stream, sql);
                stream.flush();
                return readQueryResponse(sql);
            } catch (ServerErrorException | CopyException ex) {
                if (state.phase() == Phase.READY) {
                    throw ex;
                }
                throw fail("execute", ex);
            } catch (IOException | BufferUnderflowException | IllegalStateException ex) {
                throw fail("execute", ex);
            }
        }
    }

    private CommandResult readQueryResponse(String sql) throws IOException {
        ServerError error = null;
        String tag = null;
        long rows = 0;
        CopyDirection copy = null;
        IOException copyFailure = null;
        OutputStream copySink = null;

        while (true) {
            final var msg = stream.readMessage();
            switch (msg.type()) {
                case BackendMessage.COMMAND_COMPLETE:
                    tag = BackendMessage.readCString(msg.body());
                    mediator.setLastCommandTag(tag);
                    break;
                case BackendMessage.ROW_DESCRIPTION:
                case BackendMessage.EMPTY_QUERY_RESPONSE:
                    break;
                case BackendMessage.DATA_ROW:
                    rows++;
                    break;
                case BackendMessage.ERROR_RESPONSE:
                    error = ServerError.parse(msg);
                    break;
                case BackendMessage.NOTICE_RESPONSE:
                    logNotice(msg);
                    break;
                case BackendMessage.NOTIFICATION_RESPONSE:
                    pendingNotifications.add(PgNotification.parse(msg));
                    break;
                case BackendMessage.PARAMETER_STATUS:
                    recordParameter(msg);
                    break;
                case BackendMessage.COPY_IN_RESPONSE: {
                    copy = CopyDirection.IN;
                    final var format = CopyFormat.parse(msg);
                    moveTo(new ProtocolState.CopyIn(format));
                    LOGGER.debug("📥 COPY IN started ({}) for: {}", format, sql);

                    final Closeable source = mediator.getCopyStream();
                    if (source == null) {
                        mediator.setCopyStream(new CopyInStream(this));
                        return new CommandResult(tag, -1, rows, copy, null);
                    }
                    if (source instanceof InputStream in) {
                        copyFailure = flushCopySource(in);
                    } else {
                        copyFailure = new IOException("COPY FROM STDIN needs a readable source, got "
                                + source.getClass().getName());
                        abortCopyIn(copyFailure);
                    }
                    // Further statements of the same query may start another COPY
                    moveTo(new ProtocolState.Executing(sql));
                    break;
                }
                case BackendMessage.COPY_OUT_RESPONSE: {
                    copy = CopyDirection.OUT;
                    final var format = CopyFormat.parse(msg);
                    moveTo(new ProtocolState.CopyOut(format));
                    LOGGER.debug("📤 COPY OUT started ({}) for: {}", format, sql);

                    final Closeable sink = mediator.getCopyStream();
                    if (sink == null) {
                        mediator.setCopyStream(new CopyOutStream(this));
                        return new CommandResult(tag, -1, rows, copy, null);
                    }
                    if (sink instanceof OutputStream out) {
                        copySink = out;
                    } else {
                        copyFailure = new IOException("COPY TO STDOUT needs a writable sink, got "
                                + sink.getClass().getName());
                        copySink = OutputStream.nullOutputStream();
                    }
                    break;
                }
                case BackendMessage.COPY_DATA:
                    if (copySink == null) {
                        throw new PgException("Unexpected CopyData while executing: " + sql);
                    }
                    if (copyFailure == null) {
                        try {
                            copySink.write(msg.payload());
                        } catch (IOException ex) {
                            LOGGER.warn("⚠️ Copy sink failed, discarding the rest of the data: {}", ex.getMessage());
                            copyFailure = ex;
                        }
                    }
                    break;
                case BackendMessage.COPY_DONE:
                    if (copySink == null) {
                        throw new PgException("Unexpected CopyDone while executing: " + sql);
                    }
                    copySink = null;
                    moveTo(new ProtocolState.Executing(sql));
                    break;
                case BackendMessage.READY_FOR_QUERY:
                    transactionStatus = readTransactionStatus(msg);
                    moveTo(ProtocolState.READY);

                    if (copyFailure != null) {
                        final var ex = new CopyException("Copy stream failed for: " + sql, copyFailure);
                        if (error != null) {
                            ex.addSuppressed(new ServerErrorException(error));
                        }
                        throw ex;
                    }
                    if (error != null) {
                        throw new ServerErrorException(error);
                    }
                    return new CommandResult(tag, CommandResult.parseRowCount(tag), rows, copy, null);
                default:
                    throw new PgException("Unexpected message '" + msg.typeChar() + "' while executing: " + sql);
            }
        }
    }

    /**
     * Streams a caller source as CopyData. A failing source aborts the COPY with CopyFail.
     *
     * @return the source failure, or null when everything was sent and CopyDone followed
     */
    private IOException flushCopySource(InputStream in) throws IOException {
        final byte[] buf = new byte[mediator.getCopyBufferSize()];

        while (true) {
            final int read;
            try {
                read = in.read(buf);
            } catch (IOException ex) {
                LOGGER.warn("⚠️ Copy source failed, aborting COPY: {}", ex.getMessage());
                abortCopyIn(ex);
                return ex;
            }

            if (read == -1) {
                break;
            }
            if (read > 0) {
                FrontendMessages.copyData(stream, buf, 0, read);
            }
        }

        FrontendMessages.copyDone(stream);
        stream.flush();
        return null;
    }

    private void abortCopyIn(IOException reason) throws IOException {
        FrontendMessages.copyFail(stream, "Copy source failed: " + reason.getMessage());
        stream.flush();
    }

    // -------------------------
    // COPY subprotocol
    // -------------------------

    /**
     * Sends one CopyData message. Legal only in {@code CopyIn}.
     */
    public void sendCopyData(byte[] data, int off, int len) throws PgException {
        Objects.checkFromIndexSize(off, len, data.length);
        requireState(ProtocolState.CopyIn.class, "sendCopyData");

        try {
            FrontendMessages.copyData(stream, data, off, len);
        } catch (IOException ex) {
            throw fail("sendCopyData", ex);
        }
    }

    /**
     * Completes the running COPY IN and waits for the server to commit it. Legal only in
     * {@code CopyIn}; the connection is {@code Ready} afterwards.
     *
     * @throws ServerErrorException if the server rejected the data
     */
    public CommandResult sendCopyDone() throws PgException {
        try (var block = gate.block()) {
            requireState(ProtocolState.CopyIn.class, "sendCopyDone");

            try {
                FrontendMessages.copyDone(stream);
                stream.flush();
                return finishCopy(CopyDirection.IN, null, false);
            } catch (ServerErrorException ex) {
                throw ex;
            } catch (IOException | BufferUnderflowException | IllegalStateException ex) {
                throw fail("sendCopyDone", ex);
            }
        }
    }

    /**
     * Aborts the running COPY IN. The server answers with an error carrying {@code message};
     * it is returned as the failed result rather than raised.
     */
    public CommandResult sendCopyFail(String message) throws PgException {
        Objects.requireNonNull(message, "message");

        try (var block = gate.block()) {
            requireState(ProtocolState.CopyIn.class, "sendCopyFail");

            try {
                FrontendMessages.copyFail(stream, message);
                stream.flush();
                return finishCopy(CopyDirection.IN, null, true);
            } catch (IOException | BufferUnderflowException | IllegalStateException ex) {
                throw fail("sendCopyFail", ex);
            }
        }
    }

    /**
     * Reads the next CopyData payload of a running COPY OUT.
     *
     * @return the payload, or null once the copy is over and the connection is {@code Ready}
     */
    public byte[] readCopyData() throws PgException {
        try (var block = gate.block()) {
            requireState(ProtocolState.CopyOut.class, "readCopyData");

            try {
                while (true) {
                    final var msg = stream.readMessage();
                    switch (msg.type()) {
                        case BackendMessage.COPY_DATA:
                            return msg.payload();
                        case BackendMessage.COPY_DONE:
                            finishCopy(CopyDirection.OUT, null, false);
                            return null;
                        case BackendMessage.ERROR_RESPONSE:
                            finishCopy(CopyDirection.OUT, ServerError.parse(msg), false);
                            return null;
                        default:
                            if (!handleInterleaved(msg)) {
                                throw new PgException("Unexpected message '" + msg.typeChar() + "' during COPY OUT");
                            }
                    }
                }
            } catch (ServerErrorException ex) {
                throw ex;
            } catch (IOException | BufferUnderflowException | IllegalStateException ex) {
                throw fail("readCopyData", ex);
            }
        }
    }

    /**
     * Reads the tail of a COPY exchange up to ReadyForQuery.
     *
     * @param errorIsResult return a server error in the result instead of raising it
     */
    private CommandResult finishCopy(CopyDirection direction, ServerError pending, boolean errorIsResult)
            throws IOException {
        ServerError error = pending;
        String tag = null;

        while (true) {
            final var msg = stream.readMessage();
            switch (msg.type()) {
                case BackendMessage.COMMAND_COMPLETE:
                    tag = BackendMessage.readCString(msg.body());
                    mediator.setLastCommandTag(tag);
                    break;
                case BackendMessage.ERROR_RESPONSE:
                    error = ServerError.parse(msg);
                    break;
                case BackendMessage.READY_FOR_QUERY:
                    transactionStatus = readTransactionStatus(msg);
                    moveTo(ProtocolState.READY);
                    LOGGER.debug("✔️ COPY {} finished: {}", direction, (error != null) ? error : tag);

                    if (error != null && !errorIsResult) {
                        throw new ServerErrorException(error);
                    }
                    return new CommandResult(tag, CommandResult.parseRowCount(tag), 0, direction, error);
                default:
                    if (!handleInterleaved(msg)) {
                        throw new PgException("Unexpected message '" + msg.typeChar() + "' finishing COPY " + direction);
                    }
            }
        }
    }

    /** Messages the server may send at any point of an exchange. */
    private boolean handleInterleaved(BackendMessage msg) {
        switch (msg.type()) {
            case BackendMessage.NOTICE_RESPONSE:
                logNotice(msg);
                return true;
            case BackendMessage.NOTIFICATION_RESPONSE:
                pendingNotifications.add(PgNotification.parse(msg));
                return true;
            case BackendMessage.PARAMETER_STATUS:
                recordParameter(msg);
                return true;
            default:
                return false;
        }
    }

    private void recordParameter(BackendMessage msg) {
        final var body = msg.body();
        final String name = BackendMessage.readCString(body);
        final String value = BackendMessage.readCString(body);
        serverParameters.put(name, value);
    }

    private static void logNotice(BackendMessage msg) {
        LOGGER.warn("⚠️ Server notice: {}", ServerError.parse(msg));
    }

    private static TransactionStatus readTransactionStatus(BackendMessage msg) {
        return msg.payload().length > 0 ? TransactionStatus.of(msg.payload()[0]) : TransactionStatus.UNKNOWN;
    }

    // -------------------------
    // Notifications
    // -------------------------

    /**
     * Suspends the notification thread until the returned block is closed. Returns only once
     * that thread is parked outside its read section.
     */
    public NotificationGate.Block blockNotificationThread() {
        return gate.block();
    }

    public boolean isNotificationThreadBlocked() {
        return gate.isBlocked();
    }

    public Connector addNotificationListener(NotificationListener l) {
        if (l != null)
            listeners.add(l);
        return this;
    }

    public Connector removeNotificationListener(NotificationListener l) {
        if (l != null)
            listeners.remove(l);
        return this;
    }

    /**
     * Registers the {@code @NotificationHandler} methods found under {@code basePackage}.
     */
    public Connector registerNotificationHandlers(String basePackage) {
        registry.registerUser(NotificationHandlerScanner.scanUserHandlers(basePackage));
        return this;
    }

    /**
     * Sets the executor notifications are delivered on. Default: the notification thread.
     */
    public Connector setEventDispatcher(Executor dispatcher) {
        this.eventDispatcher = (dispatcher != null) ? dispatcher : Runnable::run;
        return this;
    }

    private void startNotificationThread() {
        gate.reopen();
        listening = true;
        notificationThread = new Thread(this::notificationLoop, "pg-notification-" + processId);
        notificationThread.setDaemon(true);
        notificationThread.start();
    }

    private void stopNotificationThread() {
        final var thread = notificationThread;
        if (thread == null) {
            return;
        }

        listening = false;
        gate.shutdown();
        notificationThread = null;

        if (thread != Thread.currentThread()) {
            try {
                thread.join(settings.notificationPollIntervalMs() * 10);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * The only socket reader besides the synchronous exchanges. Reads while the connection is
     * {@code Ready} and no block is held; delivers notifications outside the read section.
     */
    private void notificationLoop() {
        final long interval = settings.notificationPollIntervalMs();

        try {
            while (listening) {
                if (!gate.isBlocked()) {
                    deliverPending();
                }

                if (!gate.enterRead(interval)) {
                    continue;
                }

                boolean readSomething = false;
                try {
                    final var in = stream;
                    if (in != null && state instanceof ProtocolState.Ready && in.hasPendingInput()) {
                        handleAsync(in.readMessage());
                        readSomething = true;
                    }
                } finally {
                    gate.exitRead();
                }

                if (!readSomething) {
                    gate.idle(interval);
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        } catch (IOException | BufferUnderflowException ex) {
            if (listening) {
                markBroken("notification thread: " + ex.getMessage());
            }
        } catch (RuntimeException ex) {
            LOGGER.error("❌ Notification thread failed", ex);
        } finally {
            deliverPending();
            LOGGER.debug("Notification thread stopped");
        }
    }

    private void handleAsync(BackendMessage msg) {
        if (handleInterleaved(msg)) {
            return;
        }

        if (msg.type() == BackendMessage.ERROR_RESPONSE) {
            markBroken("server error while idle: " + ServerError.parse(msg));
        } else {
            markBroken("unexpected message '" + msg.typeChar() + "' while idle");
        }
    }

    /** Without a notification thread, whoever closes the last block delivers what was queued. */
    private void afterRelease() {
        if (!listening) {
            deliverPending();
        }
    }

    private void deliverPending() {
        PgNotification n;
        while ((n = pendingNotifications.poll()) != null) {
            dispatch(n);
        }
    }

    private void dispatch(PgNotification notification) {
        final Runnable delivery = () -> {
            listeners.forEach(l -> {
                try {
                    l.onNotification(notification);
                } catch (RuntimeException ex) {
                    LOGGER.warn("⚠️ Notification listener failed on channel {}", notification.channel(), ex);
                }
            });

            for (final var def : registry.resolveForDelivery(notification.channel())) {
                invokeHandler(def, notification);
            }
        };

        try {
            eventDispatcher.execute(delivery);
        } catch (RejectedExecutionException ex) {
            // Fallback: never lose notifications completely
            LOGGER.warn("⚠️ Event dispatcher rejected a notification, delivering inline");
            delivery.run();
        }
    }

    /**
     * Supported signatures:
     * - ()
     * - (PgNotification)
     * - (Connector, PgNotification)
     */
    private void invokeHandler(HandlerDefinition def, PgNotification notification) {
        final Method method = def.method();

        try {
            final Object target = Modifier.isStatic(method.getModifiers())
                    ? null
                    : container.get(def.ownerClass());
            final var params = method.getParameterTypes();

            if (params.length == 0) {
                method.invoke(target);
            } else if (params.length == 1 && params[0] == PgNotification.class) {
                method.invoke(target, notification);
            } else if (params.length == 2 && params[0] == Connector.class && params[1] == PgNotification.class) {
                method.invoke(target, this, notification);
            } else {
                LOGGER.warn("⚠️ Invalid handler signature: {}#{}", def.ownerClass().getName(), method.getName());
            }
        } catch (IllegalAccessException | InvocationTargetException | RuntimeException ex) {
            LOGGER.warn("⚠️ Error executing handler {}#{} for channel {}", def.ownerClass().getName(),
                    method.getName(), notification.channel(), ex);
        }
    }
}
