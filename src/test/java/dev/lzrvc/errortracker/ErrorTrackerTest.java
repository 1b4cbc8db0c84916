package dev.lzrvc.errortracker;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ErrorTrackerTest {

    // Nothing listens here; events go to a recording transport instead
    private static final String TEST_DSN = "http://localhost:19999/api/events";

    private RecordingTransport transport;

    @BeforeEach
    void setUp() {
        ErrorTracker.close(); // start each test with a clean state
        transport = new RecordingTransport();
    }

    @AfterEach
    void tearDown() {
        ErrorTracker.close();
    }

    private ErrorTrackerClient init() {
        return ErrorTracker.init(new ErrorTrackerOptions.Builder(TEST_DSN)
                .transport(transport)
                .diagnostics(new RecordingDiagnostics())
                .build());
    }

    // -------------------------------------------------------------------------
    // Initialisation
    // -------------------------------------------------------------------------

    @Test
    void init_returnsClient() {
        ErrorTrackerClient client = init();
        assertNotNull(client);
        assertSame(client, ErrorTracker.getClient());
    }

    @Test
    void init_rejectsNullOptions() {
        assertThrows(IllegalArgumentException.class, () -> ErrorTracker.init(null));
    }

    @Test
    void init_replacesAndClosesExistingClient() {
        ErrorTrackerClient first = init();
        RecordingTransport firstTransport = transport;

        transport = new RecordingTransport();
        ErrorTrackerClient second = init();

        assertNotSame(first, second);
        assertSame(second, ErrorTracker.getClient());
        assertTrue(firstTransport.closed);
        assertFalse(transport.closed);
    }

    @Test
    void init_withAutoCapture_detachesReplacedClientHandler() {
        Thread.UncaughtExceptionHandler original = Thread.getDefaultUncaughtExceptionHandler();
        List<Throwable> base = new ArrayList<>();
        Thread.UncaughtExceptionHandler baseHandler = (t, e) -> base.add(e);
        Thread.setDefaultUncaughtExceptionHandler(baseHandler);
        try {
            RecordingTransport first = new RecordingTransport();
            ErrorTracker.init(new ErrorTrackerOptions.Builder(TEST_DSN)
                    .transport(first)
                    .diagnostics(new RecordingDiagnostics())
                    .autoCaptureErrors(true)
                    .build());
            RecordingTransport second = new RecordingTransport();
            ErrorTracker.init(new ErrorTrackerOptions.Builder(TEST_DSN)
                    .transport(second)
                    .diagnostics(new RecordingDiagnostics())
                    .autoCaptureErrors(true)
                    .build());

            RuntimeException crash = new RuntimeException("crash");
            Thread.getDefaultUncaughtExceptionHandler().uncaughtException(Thread.currentThread(), crash);

            assertTrue(first.sent.isEmpty(), "replaced client must no longer capture");
            assertEquals(1, second.sent.size());
            assertEquals(List.of(crash), base);

            ErrorTracker.close();
            assertSame(baseHandler, Thread.getDefaultUncaughtExceptionHandler());
        } finally {
            Thread.setDefaultUncaughtExceptionHandler(original);
        }
    }

    @Test
    void init_failureKeepsPreviousClient() {
        ErrorTrackerClient first = init();
        assertThrows(IllegalArgumentException.class,
                () -> ErrorTracker.init(new ErrorTrackerOptions.Builder("http://bad host/").build()));
        assertSame(first, ErrorTracker.getClient());
    }

    @Test
    void staticMethods_silentBeforeInit() {
        assertNull(ErrorTracker.getClient());
        assertNull(ErrorTracker.captureMessage("hello"));
        assertNull(ErrorTracker.captureException(new RuntimeException("boom")));
        assertDoesNotThrow(() -> ErrorTracker.setUser(new UserContext.Builder().id("u1").build()));
        assertDoesNotThrow(ErrorTracker::clearUser);
        assertDoesNotThrow(() -> ErrorTracker.setTag("k", "v"));
        assertDoesNotThrow(() -> ErrorTracker.setExtra("k", 1));
        assertDoesNotThrow(() -> ErrorTracker.addBreadcrumb(BreadcrumbType.USER, BreadcrumbLevel.INFO, "x"));
        assertDoesNotThrow(ErrorTracker::clearContext);
        assertTrue(ErrorTracker.flush(Duration.ofMillis(10)));
    }

    // -------------------------------------------------------------------------
    // Options builder
    // -------------------------------------------------------------------------

    @Test
    void options_requiresDsn() {
        assertThrows(IllegalArgumentException.class, () -> new ErrorTrackerOptions.Builder(null));
        assertThrows(IllegalArgumentException.class, () -> new ErrorTrackerOptions.Builder("  "));
    }

    @Test
    void options_defaults() {
        ErrorTrackerOptions opts = new ErrorTrackerOptions.Builder(TEST_DSN).build();
        assertEquals(TEST_DSN, opts.getDsn());
        assertNull(opts.getRelease());
        assertNull(opts.getEnvironment());
        assertNull(opts.getServerName());
        assertFalse(opts.isDebug());
        assertTrue(opts.isEnabled());
        assertEquals(100, opts.getMaxBreadcrumbs());
        assertEquals(100, opts.getMaxQueueSize());
        assertEquals(1.0, opts.getSampleRate());
        assertFalse(opts.isAutoCaptureErrors());
        assertFalse(opts.isAsyncDelivery());
        assertEquals(Duration.ofSeconds(5), opts.getSendTimeout());
        assertTrue(opts.getIgnoreErrors().isEmpty());
        assertEquals(Sanitizer.DEFAULT_SENSITIVE_KEYS, opts.getSensitiveKeys());
        assertNull(opts.getBeforeSend());
        assertNull(opts.getBeforeBreadcrumb());
        assertNull(opts.getTransport());
        assertNotNull(opts.getDiagnostics());
        assertFalse(opts.isConsoleDsn());
    }

    @Test
    void options_builder_fullConfig() {
        ErrorTrackerOptions opts = new ErrorTrackerOptions.Builder(ErrorTrackerOptions.CONSOLE_DSN)
                .release("2.0.0")
                .environment("staging")
                .serverName("web-1")
                .debug(true)
                .maxBreadcrumbs(50)
                .maxQueueSize(10)
                .sampleRate(0.5)
                .asyncDelivery(true)
                .sendTimeout(Duration.ofSeconds(1))
                .header("Authorization", "Bearer abc")
                .ignoreError("Connection refused")
                .ignoreErrorPattern("Timeout.*")
                .sensitiveKeys(List.of("pin"))
                .build();

        assertTrue(opts.isConsoleDsn());
        assertEquals("2.0.0",   opts.getRelease());
        assertEquals("staging", opts.getEnvironment());
        assertEquals("web-1",   opts.getServerName());
        assertTrue(opts.isDebug());
        assertEquals(50,        opts.getMaxBreadcrumbs());
        assertEquals(10,        opts.getMaxQueueSize());
        assertEquals(0.5,       opts.getSampleRate());
        assertTrue(opts.isAsyncDelivery());
        assertEquals(Duration.ofSeconds(1), opts.getSendTimeout());
        assertEquals(Map.of("Authorization", "Bearer abc"), opts.getHeaders());
        assertEquals(2,         opts.getIgnoreErrors().size());
        assertEquals(List.of("pin"), opts.getSensitiveKeys());
    }

    @Test
    void options_rejectsInvalidValues() {
        ErrorTrackerOptions.Builder b = new ErrorTrackerOptions.Builder(TEST_DSN);
        assertThrows(IllegalArgumentException.class, () -> b.sampleRate(-0.1));
        assertThrows(IllegalArgumentException.class, () -> b.sampleRate(1.5));
        assertThrows(IllegalArgumentException.class, () -> b.sampleRate(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> b.maxBreadcrumbs(-1));
        assertThrows(IllegalArgumentException.class, () -> b.maxQueueSize(0));
        assertThrows(IllegalArgumentException.class, () -> b.sendTimeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> b.sendTimeout(null));
    }

    // -------------------------------------------------------------------------
    // Static delegation
    // -------------------------------------------------------------------------

    @Test
    void captureMessage_delegatesToClient() {
        init();
        ErrorTracker.setUser(new UserContext.Builder().id("u123").build());
        ErrorTracker.setTag("region", "eu");
        ErrorTracker.setExtras(Map.of("cart", 3));
        ErrorTracker.setContext("app", Map.of("build", "42"));
        ErrorTracker.setFingerprint(List.of("checkout"));
        ErrorTracker.addBreadcrumb(BreadcrumbType.NAVIGATION, BreadcrumbLevel.INFO, "/cart");

        String id = ErrorTracker.captureMessage("Payment gateway timed out", Severity.WARNING);

        assertNotNull(id);
        Event event = transport.last();
        assertEquals(id, event.getEventId());
        assertEquals(Severity.WARNING, event.getLevel());
        assertEquals("u123", event.getUser().getId());
        assertEquals("eu", event.getTags().get("region"));
        assertEquals(Value.of(3), event.getExtra().get("cart"));
        assertTrue(event.getContexts().containsKey("app"));
        assertEquals(List.of("checkout"), event.getFingerprint());
        assertEquals(1, event.getBreadcrumbs().size());
    }

    @Test
    void captureException_delegatesToClient() {
        init();
        String id = ErrorTracker.captureException(new IllegalStateException("bad state"), Map.of("step", "pay"));

        assertNotNull(id);
        Event event = transport.last();
        assertEquals(Severity.ERROR, event.getLevel());
        assertEquals("java.lang.IllegalStateException", event.getExceptions().get(0).getType());
        assertEquals(Value.of("pay"), event.getExtra().get("step"));
    }

    @Test
    void clearContext_resetsScope() {
        init();
        ErrorTracker.setTag("k", "v");
        ErrorTracker.setLevel(Severity.FATAL);
        ErrorTracker.clearContext();

        ErrorTracker.captureMessage("after clear");
        assertTrue(transport.last().getTags().isEmpty());
        assertEquals(Severity.INFO, transport.last().getLevel());
    }

    @Test
    void close_detachesClient() {
        init();
        ErrorTracker.close();
        assertNull(ErrorTracker.getClient());
        assertTrue(transport.closed);
        assertNull(ErrorTracker.captureMessage("after close"));
    }
}
