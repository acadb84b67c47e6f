package org.empiresim.engine.api.processors;

/**
 * An error raised while a processor handled a single entity.
 *
 * @param entityId    Affected entity (player id, or the processor name for processor-wide failures).
 * @param entityType  Kind of entity, e.g. "player" or "processor".
 * @param message     Error message.
 * @param recoverable {@code true} if the next tick may succeed for this entity.
 */
public record TickError(
    String entityId,
    String entityType,
    String message,
    boolean recoverable
) {

    public static TickError forPlayer(String playerId, Throwable cause) {
        return new TickError(playerId, "player", describe(cause), true);
    }

    public static TickError forProcessor(String processorName, Throwable cause) {
        return new TickError(processorName, "processor", describe(cause), false);
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null
            ? cause.getClass().getSimpleName() + ": " + cause.getMessage()
            : cause.getClass().getSimpleName();
    }
}
