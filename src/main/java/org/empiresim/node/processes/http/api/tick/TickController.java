package org.empiresim.node.processes.http.api.tick;

import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.empiresim.engine.TickEngine;
import org.empiresim.engine.api.processors.ITickProcessor;
import org.empiresim.engine.api.ticks.TickNotFoundException;
import org.empiresim.engine.api.ticks.TickRecord;
import org.empiresim.engine.scheduler.TickScheduler;
import org.empiresim.node.processes.http.AbstractController;
import org.empiresim.node.processes.http.api.tick.dto.ErrorResponseDto;
import org.empiresim.node.processes.http.api.tick.dto.ForceFailRequestDto;
import org.empiresim.node.processes.http.api.tick.dto.TickRecordDto;
import org.empiresim.node.processes.http.api.tick.dto.TickStatusDto;
import org.empiresim.node.processes.http.api.tick.dto.TriggerTickRequestDto;
import org.empiresim.node.spi.ServiceRegistry;
import org.empiresim.runtime.model.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Admin API of the tick engine.
 *
 * <ul>
 *   <li>{@code GET status}: engine state, current game time and running tick.</li>
 *   <li>{@code GET history?limit=n}: most recent tick records, newest first.</li>
 *   <li>{@code POST trigger} with {@code {count?, userId?}}: runs manual ticks.</li>
 *   <li>{@code POST {tickId}/fail} with {@code {reason}}: fails a running tick.</li>
 * </ul>
 *
 * Options: {@code defaultHistoryLimit} (20), {@code maxHistoryLimit} (500), {@code maxTriggerCount} (120).
 */
public class TickController extends AbstractController {

    private static final Logger LOGGER = LoggerFactory.getLogger(TickController.class);

    private final TickEngine engine;
    private final TickScheduler scheduler;
    private final int defaultHistoryLimit;
    private final int maxHistoryLimit;
    private final int maxTriggerCount;

    public TickController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
        this.engine = registry.get(TickEngine.class);
        this.scheduler = registry.get(TickScheduler.class);
        this.defaultHistoryLimit = options.hasPath("defaultHistoryLimit") ? options.getInt("defaultHistoryLimit") : 20;
        this.maxHistoryLimit = options.hasPath("maxHistoryLimit") ? options.getInt("maxHistoryLimit") : 500;
        this.maxTriggerCount = options.hasPath("maxTriggerCount") ? options.getInt("maxTriggerCount") : 120;
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        final String fullPath = basePath.replaceAll("//", "/");

        app.get(fullPath + "status", this::getStatus);
        app.get(fullPath + "history", this::getHistory);
        app.post(fullPath + "trigger", this::triggerTicks);
        app.post(fullPath + "{tickId}/fail", this::failTick);

        app.exception(TickNotFoundException.class, (e, ctx) -> {
            LOGGER.warn("Tick not found for request {}: {}", ctx.path(), e.getMessage());
            respondError(ctx, HttpStatus.NOT_FOUND, e.getMessage());
        });
        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            LOGGER.warn("Bad request {}: {}", ctx.path(), e.getMessage());
            respondError(ctx, HttpStatus.BAD_REQUEST, e.getMessage());
        });
        app.exception(IllegalStateException.class, (e, ctx) -> {
            LOGGER.warn("Conflict for request {}: {}", ctx.path(), e.getMessage());
            respondError(ctx, HttpStatus.CONFLICT, e.getMessage());
        });
        app.exception(Exception.class, (e, ctx) -> {
            LOGGER.error("Unhandled exception for request {}: {}", ctx.path(), e.getMessage());
            LOGGER.debug("Unhandled exception for request {}", ctx.path(), e);
            respondError(ctx, HttpStatus.INTERNAL_SERVER_ERROR, "An internal server error occurred.");
        });
    }

    void getStatus(final Context ctx) {
        final List<String> processors = engine.getProcessorRegistry().getActiveProcessors().stream()
            .map(ITickProcessor::getName)
            .toList();
        ctx.status(HttpStatus.OK);
        ctx.json(TickStatusDto.from(scheduler.getState(), processors, engine.getMetrics()));
    }

    void getHistory(final Context ctx) {
        final String limitParam = ctx.queryParam("limit");
        final int limit = limitParam == null || limitParam.isBlank() ? defaultHistoryLimit : Integer.parseInt(limitParam.trim());
        if (limit < 1 || limit > maxHistoryLimit) {
            throw new ValidationException("limit must be between 1 and " + maxHistoryLimit + " but was " + limit);
        }
        final List<TickRecordDto> records = engine.getTickRecords().findRecent(limit).stream()
            .map(TickRecordDto::from)
            .toList();
        ctx.status(HttpStatus.OK);
        ctx.json(records);
    }

    void triggerTicks(final Context ctx) {
        final TriggerTickRequestDto request = readBody(ctx, TriggerTickRequestDto.class, new TriggerTickRequestDto(null, null));
        final int count = request.countOrDefault();
        if (count > maxTriggerCount) {
            throw new ValidationException("count must not exceed " + maxTriggerCount + " but was " + count);
        }
        LOGGER.info("Manual trigger of {} tick(s) by {}", count, request.userId() == null ? "anonymous" : request.userId());
        final List<TickRecord> records = scheduler.advance(count, request.userId());
        ctx.status(HttpStatus.OK);
        ctx.json(records.stream().map(TickRecordDto::from).toList());
    }

    void failTick(final Context ctx) throws TickNotFoundException {
        final String tickId = ctx.pathParam("tickId");
        final ForceFailRequestDto request = readBody(ctx, ForceFailRequestDto.class, new ForceFailRequestDto(null));
        final String reason = request.reason() == null || request.reason().isBlank()
            ? "Forced failure by operator"
            : request.reason();
        final TickRecord record = scheduler.failTick(tickId, reason, null);
        LOGGER.warn("Tick '{}' force-failed by operator: {}", tickId, reason);
        ctx.status(HttpStatus.OK);
        ctx.json(TickRecordDto.from(record));
    }

    private static <T> T readBody(final Context ctx, final Class<T> type, final T fallback) {
        final String body = ctx.body();
        if (body == null || body.isBlank()) {
            return fallback;
        }
        try {
            return ctx.bodyAsClass(type);
        } catch (final RuntimeException e) {
            throw new ValidationException("Malformed request body: " + e.getMessage());
        }
    }

    private static void respondError(final Context ctx, final HttpStatus status, final String message) {
        ctx.status(status);
        ctx.json(ErrorResponseDto.of(status.getCode(), status.getMessage(), message));
    }
}
