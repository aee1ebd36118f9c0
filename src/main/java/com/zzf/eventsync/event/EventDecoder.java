package com.zzf.eventsync.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.eventsync.state.MessageRecord;
import com.zzf.eventsync.state.MessageRole;
import com.zzf.eventsync.state.PartRecord;
import com.zzf.eventsync.state.PermissionRequest;
import com.zzf.eventsync.state.QuestionRequest;
import com.zzf.eventsync.state.SessionRecord;
import com.zzf.eventsync.state.SessionStatusInfo;
import com.zzf.eventsync.util.JsonUtils;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Narrows a {@link ServerEvent} into its {@link RoutedEvent} variant.
 * <p>
 * An unknown type decodes to {@link RoutedEvent.UnknownEvent}. A known type whose payload lacks
 * the fields its effect needs decodes to {@link Optional#empty()}, which the router treats as a
 * no-op. Permission and question events always decode so they still reach auxiliary observers.
 */
public class EventDecoder {

    private final Clock clock;

    public EventDecoder(Clock clock) {
        this.clock = clock;
    }

    public Optional<RoutedEvent> decode(ServerEvent event) {
        ObjectNode props = JsonUtils.asObject(event.getProperties());
        String type = event.getType() == null ? "" : event.getType();
        return switch (type) {
            case EventTypes.SESSION_CREATED, EventTypes.SESSION_UPDATED -> decodeSessionInfo(event, props);
            case EventTypes.SESSION_STATUS -> decodeSessionStatus(event, props);
            case EventTypes.MESSAGE_UPDATED -> decodeMessage(event, props);
            case EventTypes.MESSAGE_PART_UPDATED -> decodePart(event, props);
            case EventTypes.MESSAGE_PART_REMOVED -> decodePartRemoved(event, props);
            case EventTypes.PERMISSION_ASKED ->
                    Optional.of(new RoutedEvent.PermissionAskedEvent(event, parsePermission(event, props)));
            case EventTypes.PERMISSION_REPLIED -> Optional.of(new RoutedEvent.PermissionRepliedEvent(event,
                    JsonUtils.textOrNull(props, "requestID"),
                    !"reject".equals(JsonUtils.textOrNull(props, "reply"))));
            case EventTypes.QUESTION_ASKED ->
                    Optional.of(new RoutedEvent.QuestionAskedEvent(event, parseQuestion(event, props)));
            case EventTypes.QUESTION_REPLIED -> Optional.of(new RoutedEvent.QuestionAnsweredEvent(event,
                    JsonUtils.textOrNull(props, "requestID"),
                    props.has("reply") ? props.get("reply") : NullNode.getInstance()));
            case EventTypes.QUESTION_REJECTED -> Optional.of(new RoutedEvent.QuestionAnsweredEvent(event,
                    JsonUtils.textOrNull(props, "requestID"),
                    rejection(JsonUtils.textOrNull(props, "reason"))));
            default -> Optional.of(new RoutedEvent.UnknownEvent(event));
        };
    }

    /**
     * Maps an inbound status payload. {@code "idle"} and {@code "error"} map to idle, {@code "running"}
     * to busy; objects {@code {type: idle|busy}} map directly and {@code {type: "retry"}} needs
     * numeric {@code attempt}, string {@code message} and numeric {@code next}. Anything else is
     * {@code null}: no status change.
     */
    public static SessionStatusInfo toSessionStatus(JsonNode status) {
        if (status == null || status.isNull() || status.isMissingNode()) {
            return null;
        }
        if (status.isTextual()) {
            return switch (status.asText()) {
                case "idle", "error" -> SessionStatusInfo.idle();
                case "running" -> SessionStatusInfo.busy();
                default -> null;
            };
        }
        String kind = JsonUtils.textOrNull(status, "type");
        if (kind == null) {
            return null;
        }
        if ("idle".equals(kind)) {
            return SessionStatusInfo.idle();
        }
        if ("busy".equals(kind)) {
            return SessionStatusInfo.busy();
        }
        if ("retry".equals(kind)) {
            Integer attempt = JsonUtils.intOrNull(status, "attempt");
            String message = JsonUtils.textOrNull(status, "message");
            Long next = JsonUtils.longOrNull(status, "next");
            if (attempt != null && message != null && next != null) {
                return SessionStatusInfo.retry(attempt, message, next);
            }
        }
        return null;
    }

    private Optional<RoutedEvent> decodeSessionInfo(ServerEvent event, ObjectNode props) {
        SessionRecord parsed = parseSession(props.get("info"));
        String sessionID = JsonUtils.textOrNull(props, "sessionID");
        SessionRecord session = parsed != null
                ? parsed
                : sessionID != null ? SessionRecord.minimal(sessionID, JsonUtils.textOrNull(props, "directory")) : null;
        SessionStatusInfo status = toSessionStatus(props.get("status"));
        String statusTarget = sessionID != null ? sessionID : session != null ? session.getSessionID() : null;
        if (session == null && statusTarget == null) {
            return Optional.empty();
        }
        return Optional.of(new RoutedEvent.SessionInfoEvent(event, session, statusTarget, status));
    }

    private Optional<RoutedEvent> decodeSessionStatus(ServerEvent event, ObjectNode props) {
        String sessionID = JsonUtils.textOrNull(props, "sessionID");
        if (sessionID == null) {
            sessionID = event.hasSession() ? event.getSessionID() : null;
        }
        SessionStatusInfo status = toSessionStatus(props.get("status"));
        if (sessionID == null || status == null) {
            return Optional.empty();
        }
        return Optional.of(new RoutedEvent.SessionStatusEvent(event, sessionID, status, directory(event, props)));
    }

    private Optional<RoutedEvent> decodeMessage(ServerEvent event, ObjectNode props) {
        JsonNode info = JsonUtils.objectOrNull(props, "info");
        String id = JsonUtils.textOrNull(info, "id");
        if (id == null) {
            return Optional.empty();
        }
        JsonNode time = JsonUtils.objectOrNull(info, "time");
        MessageRecord.MessageTime messageTime = null;
        if (time != null) {
            Long created = JsonUtils.longOrNull(time, "created");
            messageTime = MessageRecord.MessageTime.builder()
                    .created(created != null ? created : clock.millis())
                    .completed(JsonUtils.longOrNull(time, "completed"))
                    .build();
        }
        MessageRecord message = MessageRecord.builder()
                .id(id)
                .role(MessageRole.parse(JsonUtils.textOrNull(info, "role")))
                .sessionID(JsonUtils.textOrNull(info, "sessionID"))
                .parentID(JsonUtils.textOrNull(info, "parentID", "parentId"))
                .time(messageTime)
                .model(JsonUtils.textOrNull(info, "model", "modelID"))
                .provider(JsonUtils.textOrNull(info, "provider", "providerID"))
                .build();
        String fallbackSessionID = JsonUtils.textOrNull(props, "sessionID");
        if (fallbackSessionID == null && event.hasSession()) {
            fallbackSessionID = event.getSessionID();
        }
        return Optional.of(new RoutedEvent.MessageUpdatedEvent(event, message, fallbackSessionID, directory(event, props)));
    }

    private Optional<RoutedEvent> decodePart(ServerEvent event, ObjectNode props) {
        JsonNode part = JsonUtils.objectOrNull(props, "part");
        String id = JsonUtils.textOrNull(part, "id");
        String messageID = JsonUtils.textOrNull(part, "messageID");
        String sessionID = JsonUtils.textOrNull(part, "sessionID");
        if (id == null || messageID == null || sessionID == null) {
            return Optional.empty();
        }
        PartRecord record = PartRecord.builder()
                .id(id)
                .messageID(messageID)
                .sessionID(sessionID)
                .type(JsonUtils.textOrNull(part, "type"))
                .data(part.deepCopy())
                .build();
        return Optional.of(new RoutedEvent.PartUpdatedEvent(event, record));
    }

    private Optional<RoutedEvent> decodePartRemoved(ServerEvent event, ObjectNode props) {
        String messageID = JsonUtils.textOrNull(props, "messageID");
        String partID = JsonUtils.textOrNull(props, "partID");
        if (messageID == null || partID == null) {
            return Optional.empty();
        }
        return Optional.of(new RoutedEvent.PartRemovedEvent(event, messageID, partID));
    }

    private PermissionRequest parsePermission(ServerEvent event, ObjectNode props) {
        String id = JsonUtils.textOrNull(props, "id");
        String sessionID = JsonUtils.textOrNull(props, "sessionID");
        if (id == null || sessionID == null) {
            return null;
        }
        JsonNode tool = JsonUtils.objectOrEmpty(props, "tool");
        List<String> patterns = JsonUtils.textArray(props, "patterns");
        return PermissionRequest.builder()
                .id(id)
                .sessionID(sessionID)
                .messageID(JsonUtils.textOrDefault(tool, "messageID", "permission:" + id))
                .toolName(JsonUtils.textOrDefault(props, "permission", "tool"))
                .args(JsonUtils.objectOrEmpty(props, "metadata"))
                .description(patterns.isEmpty() ? null : "Requires permission for: " + String.join(", ", patterns))
                .timestamp(timestamp(event))
                .callID(JsonUtils.textOrNull(tool, "callID"))
                .build();
    }

    private QuestionRequest parseQuestion(ServerEvent event, ObjectNode props) {
        String id = JsonUtils.textOrNull(props, "id");
        String sessionID = JsonUtils.textOrNull(props, "sessionID");
        if (id == null || sessionID == null) {
            return null;
        }
        JsonNode tool = JsonUtils.objectOrEmpty(props, "tool");
        JsonNode questions = props.get("questions");
        JsonNode primary = questions != null && questions.isArray() && questions.size() > 0 ? questions.get(0) : null;
        String text = "Question";
        List<String> options = null;
        if (primary != null && primary.isTextual()) {
            text = primary.asText();
        } else if (primary != null && primary.isObject()) {
            text = JsonUtils.textOrDefault(primary, "question", text);
            if (primary.path("options").isArray()) {
                options = JsonUtils.textArray(primary, "options");
            }
        }
        return QuestionRequest.builder()
                .id(id)
                .sessionID(sessionID)
                .messageID(JsonUtils.textOrDefault(tool, "messageID", "question:" + id))
                .question(text)
                .options(options)
                .timestamp(timestamp(event))
                .callID(JsonUtils.textOrNull(tool, "callID"))
                .build();
    }

    private static SessionRecord parseSession(JsonNode info) {
        String sessionID = JsonUtils.textOrNull(info, "sessionID", "sessionId", "id");
        if (sessionID == null) {
            return null;
        }
        return SessionRecord.minimal(sessionID, JsonUtils.textOrNull(info, "directory"));
    }

    private static String directory(ServerEvent event, ObjectNode props) {
        String directory = JsonUtils.textOrNull(props, "directory");
        if (directory != null) {
            return directory;
        }
        return event.getDirectory() != null ? event.getDirectory() : SessionRecord.DEFAULT_DIRECTORY;
    }

    private long timestamp(ServerEvent event) {
        return event.getTimestamp() != null ? event.getTimestamp() : clock.millis();
    }

    private static JsonNode rejection(String reason) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("rejected", true);
        if (reason != null) {
            node.put("reason", reason);
        }
        return node;
    }
}
