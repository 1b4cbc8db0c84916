package dev.lzrvc.errortracker;

/**
 * Hook called after an event is assembled and before it is sanitized and handed to the transport.
 *
 * <pre>{@code
 * ErrorTrackerOptions options = new ErrorTrackerOptions.Builder("https://...")
 *     .beforeSend(event -> {
 *         if (event.getMessage() != null && event.getMessage().startsWith("healthcheck")) {
 *             return HookResult.drop();
 *         }
 *         return HookResult.replace(event.toBuilder().transaction("checkout").build());
 *     })
 *     .build();
 * }</pre>
 *
 * <p>Returning {@code null} drops the event. A hook that throws is reported through
 * {@link Diagnostics} and the original event is sent unchanged.
 */
@FunctionalInterface
public interface BeforeSendHook {

    HookResult<Event> beforeSend(Event event);
}
