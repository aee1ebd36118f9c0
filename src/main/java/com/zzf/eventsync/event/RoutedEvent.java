package com.zzf.eventsync.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.eventsync.state.MessageRecord;
import com.zzf.eventsync.state.PartRecord;
import com.zzf.eventsync.state.PermissionRequest;
import com.zzf.eventsync.state.QuestionRequest;
import com.zzf.eventsync.state.SessionRecord;
import com.zzf.eventsync.state.SessionStatusInfo;
import lombok.Getter;

/**
 * Typed view of a {@link ServerEvent}: one variant per event type, produced by {@link EventDecoder}.
 * <p>
 * Consumers dispatch through {@link Visitor}, so a new variant cannot be added without every
 * visitor handling it.
 */
@Getter
public abstract class RoutedEvent {

    private final ServerEvent source;

    protected RoutedEvent(ServerEvent source) {
        this.source = source;
    }

    public String getType() {
        return source.getType();
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {
        R visitSessionInfo(SessionInfoEvent event);

        R visitSessionStatus(SessionStatusEvent event);

        R visitMessageUpdated(MessageUpdatedEvent event);

        R visitPartUpdated(PartUpdatedEvent event);

        R visitPartRemoved(PartRemovedEvent event);

        R visitPermissionAsked(PermissionAskedEvent event);

        R visitPermissionReplied(PermissionRepliedEvent event);

        R visitQuestionAsked(QuestionAskedEvent event);

        R visitQuestionAnswered(QuestionAnsweredEvent event);

        R visitUnknown(UnknownEvent event);
    }

    /** {@code session.created} / {@code session.updated}. */
    @Getter
    public static final class SessionInfoEvent extends RoutedEvent {
        /** Parsed or synthesised record; {@code null} when the payload names no session. */
        private final SessionRecord session;
        /** {@code properties.sessionID}, target of {@link #status}. */
        private final String sessionID;
        private final SessionStatusInfo status;

        public SessionInfoEvent(ServerEvent source, SessionRecord session, String sessionID, SessionStatusInfo status) {
            super(source);
            this.session = session;
            this.sessionID = sessionID;
            this.status = status;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSessionInfo(this);
        }
    }

    /** {@code session.status}. */
    @Getter
    public static final class SessionStatusEvent extends RoutedEvent {
        private final String sessionID;
        private final SessionStatusInfo status;
        /** Directory for the session when it has to be created first. */
        private final String directory;

        public SessionStatusEvent(ServerEvent source, String sessionID, SessionStatusInfo status, String directory) {
            super(source);
            this.sessionID = sessionID;
            this.status = status;
            this.directory = directory;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSessionStatus(this);
        }
    }

    /** {@code message.updated}. */
    @Getter
    public static final class MessageUpdatedEvent extends RoutedEvent {
        /** The message as sent; its sessionID may still be unresolved. */
        private final MessageRecord message;
        /** {@code properties.sessionID}, else the envelope sessionID. */
        private final String fallbackSessionID;
        private final String directory;

        public MessageUpdatedEvent(ServerEvent source, MessageRecord message, String fallbackSessionID, String directory) {
            super(source);
            this.message = message;
            this.fallbackSessionID = fallbackSessionID;
            this.directory = directory;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMessageUpdated(this);
        }
    }

    /** {@code message.part.updated}. */
    @Getter
    public static final class PartUpdatedEvent extends RoutedEvent {
        private final PartRecord part;

        public PartUpdatedEvent(ServerEvent source, PartRecord part) {
            super(source);
            this.part = part;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPartUpdated(this);
        }
    }

    /** {@code message.part.removed}. */
    @Getter
    public static final class PartRemovedEvent extends RoutedEvent {
        private final String messageID;
        private final String partID;

        public PartRemovedEvent(ServerEvent source, String messageID, String partID) {
            super(source);
            this.messageID = messageID;
            this.partID = partID;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPartRemoved(this);
        }
    }

    /** {@code permission.asked}. The request is {@code null} when id or sessionID is missing. */
    @Getter
    public static final class PermissionAskedEvent extends RoutedEvent {
        private final PermissionRequest request;

        public PermissionAskedEvent(ServerEvent source, PermissionRequest request) {
            super(source);
            this.request = request;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPermissionAsked(this);
        }
    }

    /** {@code permission.replied}. Any reply other than {@code reject} approves. */
    @Getter
    public static final class PermissionRepliedEvent extends RoutedEvent {
        private final String requestID;
        private final boolean approved;

        public PermissionRepliedEvent(ServerEvent source, String requestID, boolean approved) {
            super(source);
            this.requestID = requestID;
            this.approved = approved;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPermissionReplied(this);
        }
    }

    /** {@code question.asked}. The request is {@code null} when id or sessionID is missing. */
    @Getter
    public static final class QuestionAskedEvent extends RoutedEvent {
        private final QuestionRequest request;

        public QuestionAskedEvent(ServerEvent source, QuestionRequest request) {
            super(source);
            this.request = request;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitQuestionAsked(this);
        }
    }

    /** {@code question.replied} and {@code question.rejected}. */
    @Getter
    public static final class QuestionAnsweredEvent extends RoutedEvent {
        private final String requestID;
        private final JsonNode answer;

        public QuestionAnsweredEvent(ServerEvent source, String requestID, JsonNode answer) {
            super(source);
            this.requestID = requestID;
            this.answer = answer;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitQuestionAnswered(this);
        }
    }

    /** Any type this version does not know. Routed as a no-op. */
    public static final class UnknownEvent extends RoutedEvent {

        public UnknownEvent(ServerEvent source) {
            super(source);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnknown(this);
        }
    }
}
