package com.autoflow.worker;

import com.autoflow.core.exception.ErrorCodes;
import com.autoflow.core.model.StepType;
import com.autoflow.worker.connector.CalendarConnector;
import com.autoflow.worker.connector.MessagingConnector;
import com.autoflow.worker.connector.NotificationConnector;
import com.autoflow.worker.connector.TaskTrackerConnector;
import com.autoflow.worker.connector.WebhookConnector;
import com.autoflow.worker.handler.CreateTaskHandler;
import com.autoflow.worker.handler.DelayHandler;
import com.autoflow.worker.handler.ScheduleEventHandler;
import com.autoflow.worker.handler.SendMessageHandler;
import com.autoflow.worker.handler.SendNotificationHandler;
import com.autoflow.worker.handler.SetVariableHandler;
import com.autoflow.worker.handler.WebhookCallHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatches a step to the handler for its type.
 * The switch over {@link StepType} is exhaustive, so a new step type does not compile
 * until it has a handler here.
 */
public class StepHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(StepHandlerRegistry.class);

    private final StepHandler sendNotification;
    private final StepHandler createTask;
    private final StepHandler sendMessage;
    private final StepHandler scheduleEvent;
    private final StepHandler webhookCall;
    private final StepHandler delay;
    private final StepHandler setVariable;

    public StepHandlerRegistry(
            StepHandler sendNotification,
            StepHandler createTask,
            StepHandler sendMessage,
            StepHandler scheduleEvent,
            StepHandler webhookCall,
            StepHandler delay,
            StepHandler setVariable) {
        this.sendNotification = sendNotification;
        this.createTask = createTask;
        this.sendMessage = sendMessage;
        this.scheduleEvent = scheduleEvent;
        this.webhookCall = webhookCall;
        this.delay = delay;
        this.setVariable = setVariable;
    }

    /**
     * Registry with the built-in handler for every type.
     */
    public static StepHandlerRegistry create(
            NotificationConnector notifications,
            TaskTrackerConnector tasks,
            MessagingConnector messaging,
            CalendarConnector calendar,
            WebhookConnector webhooks,
            DelayHandler delayHandler) {
        return new StepHandlerRegistry(
            new SendNotificationHandler(notifications),
            new CreateTaskHandler(tasks),
            new SendMessageHandler(messaging),
            new ScheduleEventHandler(calendar),
            new WebhookCallHandler(webhooks),
            delayHandler,
            new SetVariableHandler()
        );
    }

    /**
     * Dispatch a step. Never throws: unexpected handler exceptions become failures.
     */
    public StepResult dispatch(StepContext context) {
        StepType type = context.getStep().type();
        StepHandler handler = switch (type) {
            case SEND_NOTIFICATION -> sendNotification;
            case CREATE_TASK -> createTask;
            case SEND_MESSAGE -> sendMessage;
            case SCHEDULE_EVENT -> scheduleEvent;
            case WEBHOOK_CALL -> webhookCall;
            case DELAY -> delay;
            case SET_VARIABLE -> setVariable;
            case APPROVAL_GATE -> null;
        };
        if (handler == null) {
            return StepResult.failure(ErrorCodes.INVALID_STEP_CONFIG,
                "Step type " + type.value() + " is not dispatched to a handler", false);
        }

        try {
            StepResult result = handler.handle(context);
            if (result == null) {
                return StepResult.failure(ErrorCodes.STEP_EXECUTION_ERROR,
                    "Handler for " + type.value() + " returned no result", true);
            }
            return result;
        } catch (RuntimeException e) {
            log.error("Handler for {} threw in step {}", type.value(), context.getStepId(), e);
            return StepResult.failure(ErrorCodes.STEP_EXECUTION_ERROR,
                e.getClass().getSimpleName() + ": " + e.getMessage(), true);
        }
    }
}
