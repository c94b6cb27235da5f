package com.autoflow.triage.compiler;

import com.autoflow.core.model.Action;
import com.autoflow.core.model.ActionKind;
import com.autoflow.core.model.ActionPriority;
import com.autoflow.core.model.TriggerEvent;
import com.autoflow.triage.TriageResult;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Picks a meeting type, duration and time slot for a scheduling request.
 *
 * Candidate slots start two hours after the current whole hour and repeat
 * every two hours inside the priority's wait bound. At most five slots that
 * satisfy the constraints are scored 100, 90, 80 and so on.
 */
public class SchedulingCompiler implements ActionCompiler {

    public static final String OPERATION = "schedule_meeting";

    static final int DEFAULT_DURATION_MINUTES = 30;
    static final int MAX_CANDIDATES = 5;

    private static final Map<String, Integer> MEETING_DURATIONS = new LinkedHashMap<>();
    private static final Map<ActionPriority, Duration> MAX_WAIT = Map.of(
        ActionPriority.CRITICAL, Duration.ofHours(2),
        ActionPriority.HIGH, Duration.ofHours(24),
        ActionPriority.MEDIUM, Duration.ofHours(72),
        ActionPriority.LOW, Duration.ofHours(168)
    );

    static {
        MEETING_DURATIONS.put("interview", 60);
        MEETING_DURATIONS.put("presentation", 45);
        MEETING_DURATIONS.put("brainstorm", 60);
        MEETING_DURATIONS.put("quick", 15);
        MEETING_DURATIONS.put("brief", 15);
        MEETING_DURATIONS.put("detailed", 90);
    }

    private final Clock clock;

    public SchedulingCompiler(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ActionKind kind() {
        return ActionKind.SCHEDULING;
    }

    @Override
    public Action compile(TriageResult triage, TriggerEvent event) {
        String text = event.content() == null ? "" : event.content().toLowerCase(Locale.ROOT);
        Instant now = clock.instant();

        String meetingType = "standard";
        int duration = DEFAULT_DURATION_MINUTES;
        for (Map.Entry<String, Integer> entry : MEETING_DURATIONS.entrySet()) {
            if (text.contains(entry.getKey())) {
                meetingType = entry.getKey();
                duration = entry.getValue();
                break;
            }
        }

        ActionPriority priority = priorityOf(text);
        List<String> constraints = constraintsOf(text);
        Duration maxWait = MAX_WAIT.get(priority);

        List<Slot> slots = candidateSlots(now, maxWait, constraints);
        boolean relaxed = slots.isEmpty();
        if (relaxed) {
            slots = candidateSlots(now, maxWait, List.of());
        }
        Slot chosen = priority == ActionPriority.CRITICAL
            ? slots.stream().min(Comparator.comparing(Slot::start)).orElseThrow()
            : slots.stream().max(Comparator.comparingInt(Slot::score)).orElseThrow();

        ObjectNode payload = Payloads.base(triage, event);
        payload.put("title", "Meeting: " + Payloads.summary(event.content(), 80));
        payload.put("meeting_type", meetingType);
        payload.put("duration_minutes", duration);
        payload.set("participants", Payloads.stringList(event.metadata(), "participants", event.userId()));
        payload.set("constraints", Payloads.array(constraints));
        payload.put("constraints_relaxed", relaxed);
        payload.put("start", chosen.start().toString());
        payload.put("end", chosen.start().plus(Duration.ofMinutes(duration)).toString());
        payload.put("slot_score", chosen.score());
        payload.put("max_wait_hours", maxWait.toHours());

        return Action.builder(ActionKind.SCHEDULING, OPERATION)
            .priority(priority)
            .payload(payload)
            .requiresApproval(false)
            .timeout(Duration.ofMinutes(10))
            .createdAt(now)
            .build();
    }

    private static ActionPriority priorityOf(String text) {
        if (text.contains("urgent") || text.contains("asap")) {
            return ActionPriority.CRITICAL;
        }
        if (text.contains("important")) {
            return ActionPriority.HIGH;
        }
        return ActionPriority.MEDIUM;
    }

    private static List<String> constraintsOf(String text) {
        List<String> constraints = new ArrayList<>();
        if (text.contains("morning")) {
            constraints.add("morning_only");
        }
        if (text.contains("afternoon")) {
            constraints.add("afternoon_only");
        }
        if (text.contains("this week")) {
            constraints.add("this_week");
        }
        return constraints;
    }

    private List<Slot> candidateSlots(Instant now, Duration maxWait, List<String> constraints) {
        ZonedDateTime start = now.atZone(clock.getZone()).truncatedTo(ChronoUnit.HOURS).plusHours(2);
        ZonedDateTime horizon = now.atZone(clock.getZone()).plus(maxWait);
        ZonedDateTime endOfWeek = now.atZone(clock.getZone())
            .truncatedTo(ChronoUnit.DAYS)
            .with(TemporalAdjusters.next(DayOfWeek.MONDAY));

        List<Slot> slots = new ArrayList<>();
        for (ZonedDateTime slot = start; !slot.isAfter(horizon) && slots.size() < MAX_CANDIDATES;
                slot = slot.plusHours(2)) {
            if (constraints.contains("morning_only") && slot.getHour() >= 12) {
                continue;
            }
            if (constraints.contains("afternoon_only") && (slot.getHour() < 12 || slot.getHour() >= 18)) {
                continue;
            }
            if (constraints.contains("this_week") && !slot.isBefore(endOfWeek)) {
                continue;
            }
            slots.add(new Slot(slot.toInstant(), 100 - 10 * slots.size()));
        }
        if (slots.isEmpty() && constraints.isEmpty()) {
            slots.add(new Slot(start.toInstant(), 100));
        }
        return slots;
    }

    record Slot(Instant start, int score) {
    }
}
