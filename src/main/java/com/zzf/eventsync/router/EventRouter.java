package com.zzf.eventsync.router;

import com.zzf.eventsync.event.EventDecoder;
import com.zzf.eventsync.event.RoutedEvent;
import com.zzf.eventsync.event.ServerEvent;
import com.zzf.eventsync.pending.PendingPartsStore;
import com.zzf.eventsync.state.MessageRecord;
import com.zzf.eventsync.state.PartRecord;
import com.zzf.eventsync.state.SessionRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Applies one validated, ordered, deduplicated event to the state containers.
 * <p>
 * Unknown types and payloads missing required fields are no-ops, never exceptions. Parts that
 * arrive before their message are held in the {@link PendingPartsStore} and replayed when the
 * message is created. Exceptions thrown by the stores themselves propagate to the caller.
 */
@Slf4j
public class EventRouter {

    private final EventDecoder decoder;
    private final PendingPartsStore pendingParts;

    public EventRouter(EventDecoder decoder, PendingPartsStore pendingParts) {
        this.decoder = decoder;
        this.pendingParts = pendingParts;
    }

    public RouteReport route(ServerEvent event, StateContainers containers) {
        Optional<RoutedEvent> decoded = decoder.decode(event);
        if (decoded.isEmpty()) {
            log.debug("event.route.skip type={} eventId={} reason=invalid-properties", event.getType(), event.getEventId());
            return RouteReport.noop();
        }
        RouteReport report = new RouteReport();
        decoded.get().accept(new Dispatch(containers, report));
        return report;
    }

    private final class Dispatch implements RoutedEvent.Visitor<Void> {
        private final StateContainers c;
        private final RouteReport report;

        private Dispatch(StateContainers containers, RouteReport report) {
            this.c = containers;
            this.report = report;
        }

        @Override
        public Void visitSessionInfo(RoutedEvent.SessionInfoEvent event) {
            if (event.getSession() != null) {
                c.getSessions().upsert(event.getSession());
                report.markMutated();
            }
            if (event.getSessionID() != null && event.getStatus() != null
                    && c.getSessions().setStatus(event.getSessionID(), event.getStatus())) {
                report.markMutated();
            }
            return null;
        }

        @Override
        public Void visitSessionStatus(RoutedEvent.SessionStatusEvent event) {
            ensureSession(event.getSessionID(), event.getDirectory());
            c.getSessions().setStatus(event.getSessionID(), event.getStatus());
            report.markMutated();
            return null;
        }

        @Override
        public Void visitMessageUpdated(RoutedEvent.MessageUpdatedEvent event) {
            MessageRecord incoming = event.getMessage();
            String sessionID = resolveSessionID(incoming, event.getFallbackSessionID());
            if (sessionID == null) {
                log.debug("event.route.skip type={} messageID={} reason=unresolved-session",
                        event.getType(), incoming.getId());
                return null;
            }
            ensureSession(sessionID, event.getDirectory());
            c.getMessages().upsert(incoming.toBuilder().sessionID(sessionID).build());
            report.markMutated();
            replayPendingParts(incoming.getId());
            return null;
        }

        @Override
        public Void visitPartUpdated(RoutedEvent.PartUpdatedEvent event) {
            PartRecord part = event.getPart();
            if (c.getMessages().getById(part.getMessageID()).isEmpty()) {
                pendingParts.hold(part.getMessageID(), part);
                log.debug("event.part.held messageID={} partID={}", part.getMessageID(), part.getId());
                return null;
            }
            c.getParts().upsert(part);
            report.markMutated();
            return null;
        }

        @Override
        public Void visitPartRemoved(RoutedEvent.PartRemovedEvent event) {
            if (pendingParts.remove(event.getMessageID(), event.getPartID())) {
                log.debug("event.part.held.removed messageID={} partID={}", event.getMessageID(), event.getPartID());
            }
            c.getParts().remove(event.getPartID(), event.getMessageID());
            report.markMutated();
            return null;
        }

        @Override
        public Void visitPermissionAsked(RoutedEvent.PermissionAskedEvent event) {
            if (event.getRequest() != null) {
                c.permissionSink().ifPresent(sink -> {
                    sink.add(event.getRequest());
                    report.markMutated();
                });
            }
            forward(event);
            return null;
        }

        @Override
        public Void visitPermissionReplied(RoutedEvent.PermissionRepliedEvent event) {
            if (event.getRequestID() != null) {
                c.permissionSink().ifPresent(sink -> {
                    if (sink.resolve(event.getRequestID(), event.isApproved())) {
                        report.markMutated();
                    }
                });
            }
            forward(event);
            return null;
        }

        @Override
        public Void visitQuestionAsked(RoutedEvent.QuestionAskedEvent event) {
            if (event.getRequest() != null) {
                c.questionSink().ifPresent(sink -> {
                    sink.add(event.getRequest());
                    report.markMutated();
                });
            }
            forward(event);
            return null;
        }

        @Override
        public Void visitQuestionAnswered(RoutedEvent.QuestionAnsweredEvent event) {
            if (event.getRequestID() != null) {
                c.questionSink().ifPresent(sink -> {
                    if (sink.answer(event.getRequestID(), event.getAnswer())) {
                        report.markMutated();
                    }
                });
            }
            forward(event);
            return null;
        }

        @Override
        public Void visitUnknown(RoutedEvent.UnknownEvent event) {
            log.trace("event.route.skip type={} reason=unknown-type", event.getType());
            return null;
        }

        private String resolveSessionID(MessageRecord message, String fallback) {
            if (message.getSessionID() != null) {
                return message.getSessionID();
            }
            if (fallback != null) {
                return fallback;
            }
            if (message.getParentID() == null) {
                return null;
            }
            return c.getMessages().getById(message.getParentID())
                    .map(MessageRecord::getSessionID)
                    .orElse(null);
        }

        private void ensureSession(String sessionID, String directory) {
            if (c.getSessions().getById(sessionID).isEmpty()) {
                c.getSessions().upsert(SessionRecord.minimal(sessionID, directory));
            }
        }

        private void replayPendingParts(String messageID) {
            List<PartRecord> held = pendingParts.drain(messageID);
            for (PartRecord part : held) {
                try {
                    c.getParts().upsert(part);
                } catch (RuntimeException e) {
                    log.error("event.part.replay.fail messageID={} partID={}", messageID, part.getId(), e);
                    report.warn("pending part " + part.getId() + " failed: " + e.getMessage());
                }
            }
            if (!held.isEmpty()) {
                log.debug("event.part.replayed messageID={} count={}", messageID, held.size());
            }
        }

        private void forward(RoutedEvent event) {
            ServerEvent source = event.getSource();
            c.getAuxiliary().publish(source.getType(), source.getProperties());
        }
    }
}
