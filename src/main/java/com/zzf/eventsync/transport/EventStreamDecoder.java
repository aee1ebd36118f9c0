package com.zzf.eventsync.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.eventsync.event.ServerEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decodes a text body of events, either newline-delimited JSON or Server-Sent-Events framing
 * ({@code data:} lines, blank-line separated). Comment ({@code :}) and {@code event:}/{@code id:}/
 * {@code retry:} lines are ignored; lines that do not decode are logged and skipped.
 */
@Slf4j
public class EventStreamDecoder {

    private static final String DATA_PREFIX = "data:";

    private final ObjectMapper mapper;

    public EventStreamDecoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<ServerEvent> decode(String body) {
        List<ServerEvent> out = new ArrayList<>();
        if (body == null || body.isBlank()) {
            return out;
        }
        StringBuilder data = new StringBuilder();
        for (String rawLine : body.split("\\r?\\n")) {
            String line = rawLine.trim();
            if (line.isEmpty()) {
                flushData(data, out);
                continue;
            }
            if (line.startsWith(":") || line.startsWith("event:") || line.startsWith("id:") || line.startsWith("retry:")) {
                continue;
            }
            if (line.startsWith(DATA_PREFIX)) {
                if (data.length() > 0) {
                    data.append('\n');
                }
                data.append(line.substring(DATA_PREFIX.length()).trim());
                continue;
            }
            flushData(data, out);
            decodeLine(line).ifPresent(out::add);
        }
        flushData(data, out);
        return out;
    }

    public Optional<ServerEvent> decodeLine(String json) {
        try {
            return Optional.ofNullable(mapper.readValue(json, ServerEvent.class));
        } catch (JsonProcessingException e) {
            log.warn("event.stream.decode.fail err={} line={}", e.getOriginalMessage(), abbreviate(json));
            return Optional.empty();
        }
    }

    private void flushData(StringBuilder data, List<ServerEvent> out) {
        if (data.length() == 0) {
            return;
        }
        decodeLine(data.toString()).ifPresent(out::add);
        data.setLength(0);
    }

    private static String abbreviate(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
